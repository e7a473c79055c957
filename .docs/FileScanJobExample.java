import io.github.byzatic.jobs.base_exceptions.JobExecutionException;
import io.github.byzatic.jobs.file_scan.FileScanJob;
import io.github.byzatic.jobs.file_scan.FileScanListener;
import io.github.byzatic.jobs.job.DefaultJobExecutionContext;
import io.github.byzatic.jobs.job.JobDetail;
import io.github.byzatic.jobs.job.SchedulerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

class FileScanJobExample {
    private static final Logger logger = LoggerFactory.getLogger(FileScanJobExample.class);

    public static void main(String[] args) throws Exception {
        SchedulerContext schedulerContext = new SchedulerContext();
        schedulerContext.put("configReloader", new ConfigReloader());

        // One JobDetail per watched file: it keeps the last seen timestamp between runs
        JobDetail jobDetail = JobDetail.newBuilder()
                .setName("watch-app-config")
                .setJobClass(FileScanJob.class)
                .usingJobData(FileScanJob.FILE_NAME, "/etc/myapp/app.properties")
                .usingJobData(FileScanJob.FILE_SCAN_LISTENER_NAME, "configReloader")
                .usingJobData(FileScanJob.MINIMUM_UPDATE_AGE, 2_000L)
                .build();

        // scheduleWithFixedDelay never overlaps runs, as FileScanJob requires
        ScheduledExecutorService host = Executors.newSingleThreadScheduledExecutor();
        host.scheduleWithFixedDelay(() -> {
            try {
                new FileScanJob().execute(new DefaultJobExecutionContext.Builder()
                        .jobDetail(jobDetail)
                        .schedulerContext(schedulerContext)
                        .build());
            } catch (JobExecutionException e) {
                logger.error("File scan failed, refire={}", e.refireImmediately(), e);
            }
        }, 0, 5, TimeUnit.SECONDS);

        Thread.sleep(60_000);
        host.shutdownNow();
    }

    static class ConfigReloader implements FileScanListener {
        @Override
        public void fileUpdated(String fileName) {
            logger.info("[EVENT] Reloading configuration from {}", fileName);
        }
    }
}
