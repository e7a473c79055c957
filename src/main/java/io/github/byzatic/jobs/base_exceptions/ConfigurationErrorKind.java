package io.github.byzatic.jobs.base_exceptions;

public enum ConfigurationErrorKind {
    MISSING_PARAMETER,
    INVALID_PARAMETER,
    LISTENER_NOT_FOUND,
    LISTENER_WRONG_TYPE,
    SCHEDULER_CONTEXT_UNAVAILABLE
}
