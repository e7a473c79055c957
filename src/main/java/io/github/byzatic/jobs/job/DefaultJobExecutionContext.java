package io.github.byzatic.jobs.job;

import io.github.byzatic.jobs.base_exceptions.SchedulerException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * Plain {@link JobExecutionContext} for hosts and tests.
 * The merged map is built once per context: job detail entries first, trigger entries on top.
 */
public final class DefaultJobExecutionContext implements JobExecutionContext {
    private final JobDetail jobDetail;
    private final JobDataMap mergedJobDataMap;
    private final SchedulerContextProvider schedulerContextProvider;
    private final Instant fireTime;
    private final int refireCount;
    private volatile Object result;

    private DefaultJobExecutionContext(Builder b) {
        this.jobDetail = b.jobDetail;
        this.mergedJobDataMap = new JobDataMap(b.jobDetail.getJobDataMap());
        this.mergedJobDataMap.putAll(b.triggerDataMap);
        this.mergedJobDataMap.clearDirtyFlag();
        this.schedulerContextProvider = b.schedulerContextProvider;
        this.fireTime = b.fireTime;
        this.refireCount = b.refireCount;
    }

    @Override
    public @NotNull JobDetail getJobDetail() {
        return jobDetail;
    }

    @Override
    public @NotNull JobDataMap getMergedJobDataMap() {
        return mergedJobDataMap;
    }

    @Override
    public @NotNull SchedulerContext getSchedulerContext() throws SchedulerException {
        SchedulerContext ctx = schedulerContextProvider.getContext();
        if (ctx == null) throw new SchedulerException("Scheduler context provider returned null");
        return ctx;
    }

    @Override
    public @NotNull Instant getFireTime() {
        return fireTime;
    }

    @Override
    public int getRefireCount() {
        return refireCount;
    }

    @Override
    public @Nullable Object getResult() {
        return result;
    }

    @Override
    public void setResult(@Nullable Object result) {
        this.result = result;
    }

    @Override
    public String toString() {
        return "DefaultJobExecutionContext{" +
                "jobDetail=" + jobDetail.getName() +
                ", fireTime=" + fireTime +
                ", refireCount=" + refireCount +
                ", result=" + result +
                '}';
    }

    public static final class Builder {
        private JobDetail jobDetail;
        private JobDataMap triggerDataMap = new JobDataMap();
        private SchedulerContextProvider schedulerContextProvider;
        private Instant fireTime = Instant.now();
        private int refireCount = 0;

        public Builder jobDetail(JobDetail jobDetail) {
            this.jobDetail = Objects.requireNonNull(jobDetail);
            return this;
        }

        /**
         * Parameters of the firing trigger, they override job detail parameters with the same key.
         */
        public Builder triggerDataMap(JobDataMap triggerDataMap) {
            this.triggerDataMap = Objects.requireNonNull(triggerDataMap);
            return this;
        }

        public Builder schedulerContext(SchedulerContext schedulerContext) {
            Objects.requireNonNull(schedulerContext);
            this.schedulerContextProvider = () -> schedulerContext;
            return this;
        }

        /**
         * Use when obtaining the context can fail, e.g. the scheduler is shutting down.
         */
        public Builder schedulerContextProvider(SchedulerContextProvider provider) {
            this.schedulerContextProvider = Objects.requireNonNull(provider);
            return this;
        }

        public Builder fireTime(Instant fireTime) {
            this.fireTime = Objects.requireNonNull(fireTime);
            return this;
        }

        public Builder refireCount(int refireCount) {
            if (refireCount < 0) throw new IllegalArgumentException("refireCount must be >= 0");
            this.refireCount = refireCount;
            return this;
        }

        public DefaultJobExecutionContext build() {
            Objects.requireNonNull(jobDetail, "jobDetail");
            Objects.requireNonNull(schedulerContextProvider, "schedulerContextProvider");
            return new DefaultJobExecutionContext(this);
        }
    }
}
