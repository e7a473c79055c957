package io.github.byzatic.jobs.job;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * One configured instance of a job. Holds the {@link JobDataMap} that survives between invocations.
 */
public class JobDetail {
    private final String name;
    private final String description;
    private final Class<? extends Job> jobClass;
    private final JobDataMap jobDataMap;

    private JobDetail(Builder builder) {
        name = builder.name;
        description = builder.description;
        jobClass = builder.jobClass;
        jobDataMap = builder.jobDataMap;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static Builder newBuilder(JobDetail copy) {
        Builder builder = new Builder();
        builder.name = copy.name;
        builder.description = copy.description;
        builder.jobClass = copy.jobClass;
        builder.jobDataMap = new JobDataMap(copy.jobDataMap);
        return builder;
    }

    public @NotNull String getName() {
        return name;
    }

    public @Nullable String getDescription() {
        return description;
    }

    public @NotNull Class<? extends Job> getJobClass() {
        return jobClass;
    }

    public @NotNull JobDataMap getJobDataMap() {
        return jobDataMap;
    }

    public boolean isConcurrentExecutionDisallowed() {
        return jobClass.isAnnotationPresent(DisallowConcurrentExecution.class);
    }

    public boolean isPersistJobDataAfterExecution() {
        return jobClass.isAnnotationPresent(PersistJobDataAfterExecution.class);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobDetail jobDetail = (JobDetail) o;
        return Objects.equals(name, jobDetail.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "JobDetail{" +
                "name='" + name + '\'' +
                ", description='" + description + '\'' +
                ", jobClass=" + jobClass.getName() +
                ", jobDataMap=" + jobDataMap +
                '}';
    }

    /**
     * {@code JobDetail} builder static inner class.
     */
    public static final class Builder {
        private String name;
        private String description;
        private Class<? extends Job> jobClass;
        private JobDataMap jobDataMap = new JobDataMap();

        private Builder() {
        }

        /**
         * Sets the {@code name} and returns a reference to this Builder so that the methods can be chained together.
         *
         * @param name the {@code name} to set, unique within a host
         * @return a reference to this Builder
         */
        public Builder setName(String name) {
            this.name = name;
            return this;
        }

        public Builder setDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder setJobClass(Class<? extends Job> jobClass) {
            this.jobClass = jobClass;
            return this;
        }

        /**
         * Replaces the whole {@code jobDataMap}. The instance is kept, not copied.
         *
         * @param jobDataMap the {@code jobDataMap} to set
         * @return a reference to this Builder
         */
        public Builder setJobDataMap(JobDataMap jobDataMap) {
            this.jobDataMap = jobDataMap;
            return this;
        }

        /**
         * Adds one entry to the {@code jobDataMap}.
         *
         * @return a reference to this Builder
         */
        public Builder usingJobData(String key, Object value) {
            this.jobDataMap.put(key, value);
            return this;
        }

        /**
         * Returns a {@code JobDetail} built from the parameters previously set.
         * The data map starts clean: entries set on the builder are configuration, not changed state.
         *
         * @return a {@code JobDetail} built with parameters of this {@code JobDetail.Builder}
         */
        public JobDetail build() {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(jobClass, "jobClass");
            Objects.requireNonNull(jobDataMap, "jobDataMap");
            jobDataMap.clearDirtyFlag();
            return new JobDetail(this);
        }
    }
}
