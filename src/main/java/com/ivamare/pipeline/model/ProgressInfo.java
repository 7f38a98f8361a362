package com.ivamare.pipeline.model;

/**
 * Progress report of a running download or upload.
 *
 * @param percent Completion in percent, clamped to [0, 100]
 * @param rate Human readable transfer rate (may be null)
 * @param eta Human readable time remaining (may be null)
 */
public record ProgressInfo(
    double percent,
    String rate,
    String eta
) {
    public ProgressInfo {
        if (Double.isNaN(percent) || percent < 0) {
            percent = 0;
        } else if (percent > 100) {
            percent = 100;
        }
    }

    public static ProgressInfo of(double percent) {
        return new ProgressInfo(percent, null, null);
    }
}
