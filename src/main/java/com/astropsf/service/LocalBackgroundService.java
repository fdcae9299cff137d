package com.astropsf.service;

import com.astropsf.exception.ConfigurationException;
import com.astropsf.exception.PreconditionException;
import com.astropsf.model.Image;
import com.astropsf.model.NoiseStats;
import java.util.Locale;

public class LocalBackgroundService {

    private static final double CLIP_SIGMA = 3.0;
    private static final int CLIP_ITERATIONS = 10;

    private final NoiseStatisticsService noiseService;

    public LocalBackgroundService() {
        this(new NoiseStatisticsService());
    }

    public LocalBackgroundService(NoiseStatisticsService noiseService) {
        this.noiseService = noiseService;
    }

    public double estimate(Image image, double x, double y, double inner, double outer) throws PreconditionException {
        if (!(inner >= 0) || !(outer > inner)) {
            throw new PreconditionException("Annulus radii must satisfy 0 <= inner < outer (was " + inner + ", " + outer + ")");
        }
        double[] samples = annulus(image, x, y, inner, outer);
        if (samples.length == 0) {
            throw new PreconditionException(String.format(Locale.US,
                    "Background annulus [%.1f, %.1f) around (%.2f, %.2f) has no pixels inside the image", inner, outer, x, y));
        }
        NoiseStats stats;
        try {
            stats = noiseService.sigmaClippedStats(samples, CLIP_SIGMA, CLIP_ITERATIONS);
        } catch (ConfigurationException e) {
            throw new IllegalStateException(e);
        }
        double background = 3 * stats.median - 2 * stats.mean;
        if (!Double.isFinite(background)) {
            throw new PreconditionException(String.format(Locale.US,
                    "Background annulus around (%.2f, %.2f) is saturated (%s)", x, y, stats));
        }
        return background;
    }

    static double[] annulus(Image image, double x, double y, double inner, double outer) {
        int x0 = Math.max(0, (int) Math.floor(x - outer));
        int x1 = Math.min(image.getWidth() - 1, (int) Math.ceil(x + outer));
        int y0 = Math.max(0, (int) Math.floor(y - outer));
        int y1 = Math.min(image.getHeight() - 1, (int) Math.ceil(y + outer));
        double in2 = inner * inner;
        double out2 = outer * outer;

        int count = 0;
        double[] buf = new double[Math.max(0, x1 - x0 + 1) * Math.max(0, y1 - y0 + 1)];
        for (int py = y0; py <= y1; py++) {
            for (int px = x0; px <= x1; px++) {
                double dx = px - x;
                double dy = py - y;
                double r2 = dx * dx + dy * dy;
                if (r2 >= in2 && r2 < out2) buf[count++] = image.get(px, py);
            }
        }
        double[] out = new double[count];
        System.arraycopy(buf, 0, out, 0, count);
        return out;
    }
}
