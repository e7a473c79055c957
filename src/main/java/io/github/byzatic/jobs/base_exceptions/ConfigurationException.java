package io.github.byzatic.jobs.base_exceptions;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A job was misconfigured: a parameter is missing or invalid, a collaborator cannot be resolved,
 * or the host could not supply its scheduler context. Never refired.
 */
public class ConfigurationException extends JobExecutionException {
    private final ConfigurationErrorKind kind;
    private final String key;

    public ConfigurationException(@NotNull ConfigurationErrorKind kind, @Nullable String key, String message) {
        this(kind, key, message, null);
    }

    public ConfigurationException(@NotNull ConfigurationErrorKind kind, @Nullable String key, String message, Throwable cause) {
        super(message, cause, false);
        this.kind = kind;
        this.key = key;
    }

    public @NotNull ConfigurationErrorKind getKind() {
        return kind;
    }

    /**
     * @return the offending parameter key or listener name, {@code null} when no key is involved
     */
    public @Nullable String getKey() {
        return key;
    }
}
