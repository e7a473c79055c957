package io.github.byzatic.jobs.file_scan;

import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.jobs.base_exceptions.ConfigurationErrorKind;
import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import io.github.byzatic.jobs.base_exceptions.JobExecutionException;
import io.github.byzatic.jobs.base_exceptions.SchedulerException;
import io.github.byzatic.jobs.job.DisallowConcurrentExecution;
import io.github.byzatic.jobs.job.Job;
import io.github.byzatic.jobs.job.JobDataMap;
import io.github.byzatic.jobs.job.JobExecutionContext;
import io.github.byzatic.jobs.job.PersistJobDataAfterExecution;
import io.github.byzatic.jobs.job.SchedulerContext;
import org.apache.commons.vfs2.FileObject;
import org.apache.commons.vfs2.FileSystemException;
import org.apache.commons.vfs2.FileSystemManager;
import org.apache.commons.vfs2.VFS;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Inspects a file (or folder) and compares whether its last-modified time has changed since the
 * previous invocation. If it has, the job calls {@link FileScanListener#fileUpdated(String)} on the
 * listener registered in the {@link SchedulerContext} under {@link #FILE_SCAN_LISTENER_NAME}.
 * <p>
 * Parameters, read from the merged job data map:
 * <ul>
 *     <li>{@link #FILE_NAME} - local path or Commons VFS URI of the target, required</li>
 *     <li>{@link #FILE_SCAN_LISTENER_NAME} - scheduler context name of the listener, required</li>
 *     <li>{@link #MINIMUM_UPDATE_AGE} - milliseconds a change must age before it is reported, default 0</li>
 * </ul>
 * The observed time is kept in the job detail's data map, so one job detail must not run concurrently.
 * Any change is reported, including a time earlier than the stored one.
 */
@DisallowConcurrentExecution
@PersistJobDataAfterExecution
public class FileScanJob implements Job {
    private final static Logger logger = LoggerFactory.getLogger(FileScanJob.class);

    public static final String FILE_NAME = "FILE_NAME";
    public static final String FILE_SCAN_LISTENER_NAME = "FILE_SCAN_LISTENER_NAME";
    public static final String MINIMUM_UPDATE_AGE = "MINIMUM_UPDATE_AGE";
    static final String LAST_MODIFIED_TIME = "LAST_MODIFIED_TIME";

    // scheme of two or more chars, so "C:\..." stays a local path
    private static final Pattern URI_SCHEME = Pattern.compile("^([a-zA-Z][a-zA-Z0-9+.-]+):.*");

    @GuardedBy("this") private FileSystemManager fsManager;
    private final Clock clock;

    /**
     * Uses the shared {@link VFS#getManager()} manager and the UTC system clock.
     */
    public FileScanJob() {
        this.fsManager = null;
        this.clock = Clock.systemUTC();
    }

    public FileScanJob(@NotNull FileSystemManager fsManager, @NotNull Clock clock) {
        this.fsManager = Objects.requireNonNull(fsManager, "fsManager");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void execute(@NotNull JobExecutionContext context) throws JobExecutionException {
        context.setResult(scan(context));
    }

    public @NotNull ScanOutcome scan(@NotNull JobExecutionContext context) throws JobExecutionException {
        JobDataMap data = context.getMergedJobDataMap();
        SchedulerContext schedulerContext;
        try {
            schedulerContext = context.getSchedulerContext();
        } catch (SchedulerException e) {
            throw new ConfigurationException(ConfigurationErrorKind.SCHEDULER_CONTEXT_UNAVAILABLE, null,
                    "Error obtaining scheduler context.", e);
        }

        String fileName = requireString(data, FILE_NAME);
        String listenerName = requireString(data, FILE_SCAN_LISTENER_NAME);
        FileScanListener listener = resolveListener(schedulerContext, listenerName);
        Duration minimumUpdateAge = readMinimumUpdateAge(data);
        Optional<Instant> lastDate = readLastModifiedTime(data);

        Optional<Instant> current;
        try {
            current = getLastModifiedDate(fileName);
        } catch (FileSystemException e) {
            throw new JobExecutionException("Error reading last-modified time of '" + fileName + "'", e);
        }
        if (current.isEmpty()) {
            logger.warn("File '{}' does not exist.", fileName);
            return ScanOutcome.NOT_FOUND;
        }
        Instant newDate = current.get();

        ScanOutcome outcome;
        if (lastDate.isPresent() && !newDate.equals(lastDate.get())) {
            Duration age = Duration.between(newDate, clock.instant());
            if (!minimumUpdateAge.isZero() && age.compareTo(minimumUpdateAge) < 0) {
                logger.debug("File '{}' updated {} ago, waiting until it is {} old.", fileName, age, minimumUpdateAge);
                return ScanOutcome.DEFERRED;
            }
            logger.info("File '{}' updated, notifying listener.", fileName);
            try {
                listener.fileUpdated(fileName);
            } catch (RuntimeException e) {
                throw new JobExecutionException("FileScanListener '" + listenerName + "' failed for file '" + fileName + "'", e);
            }
            outcome = ScanOutcome.NOTIFIED;
        } else if (lastDate.isEmpty()) {
            logger.debug("File '{}' first seen, last modified {}.", fileName, newDate);
            outcome = ScanOutcome.BASELINE;
        } else {
            logger.debug("File '{}' unchanged.", fileName);
            outcome = ScanOutcome.UNCHANGED;
        }

        context.getJobDetail().getJobDataMap().put(LAST_MODIFIED_TIME, newDate);
        return outcome;
    }

    /**
     * @return the last-modified time, empty when {@code fileName} is neither a file nor a folder
     * @throws FileSystemException if the target cannot be resolved or its metadata read
     */
    protected Optional<Instant> getLastModifiedDate(@NotNull String fileName) throws FileSystemException {
        FileSystemManager manager = fileSystemManager();
        try (FileObject fo = manager.resolveFile(toUri(manager, fileName))) {
            fo.refresh();
            if (!fo.exists() || !(fo.isFile() || fo.isFolder())) {
                return Optional.empty();
            }
            return Optional.of(Instant.ofEpochMilli(fo.getContent().getLastModifiedTime()));
        }
    }

    private synchronized FileSystemManager fileSystemManager() throws FileSystemException {
        if (fsManager == null) {
            fsManager = VFS.getManager();
        }
        return fsManager;
    }

    /**
     * A name is a URI only when its prefix is a scheme the manager has a provider for,
     * anything else ("report:2024.txt" included) is a local path.
     */
    private static String toUri(FileSystemManager manager, String fileName) throws FileSystemException {
        Matcher matcher = URI_SCHEME.matcher(fileName);
        if (matcher.matches() && manager.hasProvider(matcher.group(1))) {
            return fileName;
        }
        try {
            return Paths.get(fileName).toAbsolutePath().toUri().toString();
        } catch (InvalidPathException e) {
            throw new FileSystemException("Invalid file name: " + fileName, e);
        }
    }

    private static String requireString(JobDataMap data, String key) throws ConfigurationException {
        String value;
        try {
            value = data.getString(key);
        } catch (ClassCastException e) {
            throw new ConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER, key,
                    String.format("Parameter '%s' must be a string", key), e);
        }
        if (value == null) {
            throw new ConfigurationException(ConfigurationErrorKind.MISSING_PARAMETER, key,
                    String.format("Required parameter '%s' not found in merged JobDataMap", key));
        }
        return value;
    }

    private static FileScanListener resolveListener(SchedulerContext schedulerContext, String listenerName) throws ConfigurationException {
        Object candidate = schedulerContext.get(listenerName);
        if (candidate == null) {
            throw new ConfigurationException(ConfigurationErrorKind.LISTENER_NOT_FOUND, listenerName,
                    String.format("FileScanListener named '%s' not found in SchedulerContext", listenerName));
        }
        if (!(candidate instanceof FileScanListener)) {
            throw new ConfigurationException(ConfigurationErrorKind.LISTENER_WRONG_TYPE, listenerName,
                    String.format("Object named '%s' in SchedulerContext is a %s, not a FileScanListener",
                            listenerName, candidate.getClass().getName()));
        }
        return (FileScanListener) candidate;
    }

    private static Duration readMinimumUpdateAge(JobDataMap data) throws ConfigurationException {
        long millis;
        try {
            millis = data.getLong(MINIMUM_UPDATE_AGE).orElse(0L);
        } catch (ClassCastException | NumberFormatException e) {
            throw new ConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER, MINIMUM_UPDATE_AGE,
                    String.format("Parameter '%s' must be a number of milliseconds", MINIMUM_UPDATE_AGE), e);
        }
        if (millis < 0) {
            throw new ConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER, MINIMUM_UPDATE_AGE,
                    String.format("Parameter '%s' must be >= 0, got %d", MINIMUM_UPDATE_AGE, millis));
        }
        return Duration.ofMillis(millis);
    }

    private static Optional<Instant> readLastModifiedTime(JobDataMap data) throws ConfigurationException {
        try {
            return data.getInstant(LAST_MODIFIED_TIME);
        } catch (ClassCastException e) {
            throw new ConfigurationException(ConfigurationErrorKind.INVALID_PARAMETER, LAST_MODIFIED_TIME,
                    String.format("Stored '%s' is not a point in time", LAST_MODIFIED_TIME), e);
        }
    }
}
