package com.astropsf.model;

import java.util.Locale;

public final class NoiseStats {
    public final double mean;
    public final double median;
    public final double stddev;
    public final int sampleCount; // survivors of the clipping

    public NoiseStats(double mean, double median, double stddev, int sampleCount) {
        this.mean = mean;
        this.median = median;
        this.stddev = Math.max(0.0, stddev);
        this.sampleCount = sampleCount;
    }

    public static NoiseStats empty() {
        return new NoiseStats(0, 0, 0, 0);
    }

    // fewer than two survivors, zero spread, or a scale that overflowed
    public boolean isDegenerate() {
        return sampleCount < 2 || stddev == 0.0 || !Double.isFinite(stddev) || !Double.isFinite(mean);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "mean=%.4f median=%.4f stddev=%.4f n=%d", mean, median, stddev, sampleCount);
    }
}
