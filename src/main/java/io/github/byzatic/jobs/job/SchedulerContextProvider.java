package io.github.byzatic.jobs.job;

import io.github.byzatic.jobs.base_exceptions.SchedulerException;
import org.jetbrains.annotations.NotNull;

@FunctionalInterface
public interface SchedulerContextProvider {
    @NotNull SchedulerContext getContext() throws SchedulerException;
}
