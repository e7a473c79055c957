package io.github.byzatic.jobs.job;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * The host must keep the {@link JobDetail#getJobDataMap() job data map} changes made by an invocation
 * and hand them to the next invocation of the same {@link JobDetail}.
 * Usually combined with {@link DisallowConcurrentExecution} to keep the read-modify-write race free.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface PersistJobDataAfterExecution {
}
