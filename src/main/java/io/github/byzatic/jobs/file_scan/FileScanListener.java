package io.github.byzatic.jobs.file_scan;

import org.jetbrains.annotations.NotNull;

/**
 * Call-back of {@link FileScanJob}. Register an implementation in the scheduler context under the name
 * given by {@link FileScanJob#FILE_SCAN_LISTENER_NAME}.
 * Implementations should be fast: they run on the host's job thread.
 */
public interface FileScanListener {
    /**
     * @param fileName the {@link FileScanJob#FILE_NAME} parameter, exactly as configured
     */
    void fileUpdated(@NotNull String fileName);
}
