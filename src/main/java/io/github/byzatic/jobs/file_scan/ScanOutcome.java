package io.github.byzatic.jobs.file_scan;

/**
 * Result of one {@link FileScanJob} invocation.
 */
public enum ScanOutcome {
    /** First observation, timestamp stored, listener not called. */
    BASELINE,
    /** Timestamp equals the stored one. */
    UNCHANGED,
    /** Timestamp differs from the stored one and the listener was called. */
    NOTIFIED,
    /** Change seen but younger than the minimum update age; nothing stored. */
    DEFERRED,
    /** Target is neither a file nor a folder; nothing stored. */
    NOT_FOUND
}
