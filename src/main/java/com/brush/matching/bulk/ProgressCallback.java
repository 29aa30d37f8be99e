package com.brush.matching.bulk;

/**
 * Receives progress reports from a batch run.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param processed records processed so far
     * @param total     total records, or -1 while still unknown
     * @param message   short human-readable status
     */
    void onProgress(long processed, long total, String message);

    ProgressCallback NOOP = (processed, total, message) -> {};
}
