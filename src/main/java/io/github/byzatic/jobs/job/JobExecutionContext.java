package io.github.byzatic.jobs.job;

import io.github.byzatic.jobs.base_exceptions.SchedulerException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * What a host hands to a {@link Job} for one invocation.
 */
public interface JobExecutionContext {
    @NotNull JobDetail getJobDetail();

    /**
     * Job detail parameters overlaid by trigger parameters. A copy: writes are not persisted,
     * use {@link JobDetail#getJobDataMap()} for state that must survive the invocation.
     */
    @NotNull JobDataMap getMergedJobDataMap();

    @NotNull SchedulerContext getSchedulerContext() throws SchedulerException;

    @NotNull Instant getFireTime();

    /**
     * @return how many times this firing was re-run after a failure, 0 on the first run
     */
    int getRefireCount();

    @Nullable Object getResult();

    /**
     * Optional result for the host's listeners; meaningless to the host itself.
     */
    void setResult(@Nullable Object result);
}
