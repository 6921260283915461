package com.labscheduler.engine;

/**
 * Called on the run's worker thread with non-decreasing objective values.
 * Exceptions thrown here are logged and do not stop the search.
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = update -> { };

    void onProgress(ProgressUpdate update);
}
