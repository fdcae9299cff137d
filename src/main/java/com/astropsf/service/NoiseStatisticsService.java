package com.astropsf.service;

import com.astropsf.exception.ConfigurationException;
import com.astropsf.model.NoiseStats;
import java.util.Arrays;

// Median-centered sigma clipping with the population standard deviation as scale.
public class NoiseStatisticsService {

    public static final int DEFAULT_MAX_ITERATIONS = 5;

    public NoiseStats sigmaClippedStats(double[] samples, double sigma) throws ConfigurationException {
        return sigmaClippedStats(samples, sigma, DEFAULT_MAX_ITERATIONS);
    }

    public NoiseStats sigmaClippedStats(double[] samples, double sigma, int maxIterations) throws ConfigurationException {
        if (!(sigma > 0)) throw new ConfigurationException("sigma_clip must be positive (was " + sigma + ")");
        if (samples == null || samples.length == 0) return NoiseStats.empty();

        double[] kept = samples.clone();
        Arrays.sort(kept);
        int n = kept.length;

        for (int iter = 0; iter < maxIterations && n >= 2; iter++) {
            double median = median(kept, 0, n);
            double std = stdDev(kept, 0, n, mean(kept, 0, n));
            double lo = median - sigma * std;
            double hi = median + sigma * std;

            // kept[0, n) is sorted: survivors form one contiguous run
            int from = 0;
            while (from < n && kept[from] < lo) from++;
            int to = n;
            while (to > from && kept[to - 1] > hi) to--;
            if (from == 0 && to == n) break;
            if (from > 0) System.arraycopy(kept, from, kept, 0, to - from);
            n = to - from;
        }

        if (n == 0) return NoiseStats.empty();
        double mean = mean(kept, 0, n);
        return new NoiseStats(mean, median(kept, 0, n), n < 2 ? 0.0 : stdDev(kept, 0, n, mean), n);
    }

    public static double median(double[] samples) {
        double[] s = samples.clone();
        Arrays.sort(s);
        return median(s, 0, s.length);
    }

    private static double median(double[] sorted, int from, int to) {
        int n = to - from;
        int mid = from + n / 2;
        if (n % 2 == 0) return sorted[mid - 1] / 2.0 + sorted[mid] / 2.0;
        return sorted[mid];
    }

    // Saturated samples sanitized to +-Double.MAX_VALUE must not overflow the sums.
    private static double mean(double[] v, int from, int to) {
        int n = to - from;
        double sum = 0;
        for (int i = from; i < to; i++) sum += v[i];
        if (Double.isFinite(sum)) return sum / n;

        double m = 0;
        for (int i = from; i < to; i++) m += v[i] / n;
        return m;
    }

    private static double stdDev(double[] v, int from, int to, double mean) {
        double scale = 0;
        for (int i = from; i < to; i++) scale = Math.max(scale, Math.abs(v[i] / 2 - mean / 2));
        if (scale == 0) return 0.0;

        double ss = 0;
        for (int i = from; i < to; i++) {
            double d = (v[i] / 2 - mean / 2) / scale;
            ss += d * d;
        }
        return 2 * scale * Math.sqrt(ss / (to - from));
    }
}
