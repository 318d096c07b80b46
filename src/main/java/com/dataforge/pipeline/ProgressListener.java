package com.dataforge.pipeline;

@FunctionalInterface
public interface ProgressListener {
    ProgressListener NONE = (percent, step, message) -> {
    };

    void onProgress(int percent, String step, String message);

    /**
     * Maps 0-100 progress reported by a nested run onto the {@code [from, to]} band of this listener.
     */
    default ProgressListener scaled(int from, int to) {
        return (percent, step, message) -> onProgress(from + (to - from) * percent / 100, step, message);
    }
}
