package io.github.byzatic.jobs.job;

import io.github.byzatic.jobs.base_exceptions.JobExecutionException;
import org.jetbrains.annotations.NotNull;

/**
 * Unit of work run by a host each time one of its triggers fires.
 * Implementations need a public no-arg constructor; a new instance may be created for every run.
 */
public interface Job {
    void execute(@NotNull JobExecutionContext context) throws JobExecutionException;
}
