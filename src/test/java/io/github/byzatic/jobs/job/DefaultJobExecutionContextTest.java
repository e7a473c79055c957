package io.github.byzatic.jobs.job;

import io.github.byzatic.jobs.base_exceptions.SchedulerException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJobExecutionContextTest {

    static class NoopJob implements Job {
        @Override
        public void execute(JobExecutionContext context) {
        }
    }

    private static JobDetail detail() {
        return JobDetail.newBuilder()
                .setName("job")
                .setJobClass(NoopJob.class)
                .usingJobData("shared", "detail")
                .usingJobData("detailOnly", "detail")
                .build();
    }

    @Test
    void triggerEntriesOverrideDetailEntriesInMergedMap() {
        JobDataMap trigger = new JobDataMap();
        trigger.put("shared", "trigger");

        JobExecutionContext context = new DefaultJobExecutionContext.Builder()
                .jobDetail(detail())
                .triggerDataMap(trigger)
                .schedulerContext(new SchedulerContext())
                .build();

        JobDataMap merged = context.getMergedJobDataMap();
        assertEquals("trigger", merged.getString("shared"));
        assertEquals("detail", merged.getString("detailOnly"));
        assertFalse(merged.isDirty());
    }

    @Test
    void writesToMergedMapAreNotPersisted() {
        JobDetail detail = detail();
        JobExecutionContext first = new DefaultJobExecutionContext.Builder()
                .jobDetail(detail)
                .schedulerContext(new SchedulerContext())
                .build();

        first.getMergedJobDataMap().put("transient", "x");
        detail.getJobDataMap().put("persistent", "y");

        JobExecutionContext second = new DefaultJobExecutionContext.Builder()
                .jobDetail(detail)
                .schedulerContext(new SchedulerContext())
                .build();
        assertFalse(second.getMergedJobDataMap().containsKey("transient"));
        assertEquals("y", second.getMergedJobDataMap().getString("persistent"));
    }

    @Test
    void schedulerContextFailureSurfacesAsSchedulerException() {
        JobExecutionContext context = new DefaultJobExecutionContext.Builder()
                .jobDetail(detail())
                .schedulerContextProvider(() -> {
                    throw new SchedulerException("down");
                })
                .build();

        SchedulerException e = assertThrows(SchedulerException.class, context::getSchedulerContext);
        assertEquals("down", e.getMessage());
    }

    @Test
    void keepsFireTimeRefireCountAndResult() {
        Instant fireTime = Instant.parse("2025-08-08T11:00:00Z");
        JobExecutionContext context = new DefaultJobExecutionContext.Builder()
                .jobDetail(detail())
                .schedulerContext(new SchedulerContext())
                .fireTime(fireTime)
                .refireCount(2)
                .build();

        context.setResult("done");

        assertEquals(fireTime, context.getFireTime());
        assertEquals(2, context.getRefireCount());
        assertEquals("done", context.getResult());
        assertTrue(context.toString().contains("DefaultJobExecutionContext"));
    }

    @Test
    void negativeRefireCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new DefaultJobExecutionContext.Builder().refireCount(-1));
    }
}
