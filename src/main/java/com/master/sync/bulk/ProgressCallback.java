package com.master.sync.bulk;

/**
 * Receives row counts while a change set is written out, once per chunk file and once
 * when the export completes.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * @param written rows written to chunk files so far, or the total once complete
     * @param total   rows in the change set
     * @param message file just written, or a completion note
     */
    void onProgress(long written, long total, String message);

    /**
     * Ignores every report. Used when the caller passes no callback.
     */
    ProgressCallback NOOP = (written, total, message) -> {};
}
