package com.astropsf.service;

import com.astropsf.exception.ConfigurationException;
import com.astropsf.exception.PreconditionException;
import com.astropsf.model.DetectionParameters;
import com.astropsf.model.FwhmEstimate;
import com.astropsf.model.Image;
import com.astropsf.model.NoiseStats;
import com.astropsf.model.Region;
import com.astropsf.model.StarCandidate;
import com.astropsf.model.StarRole;
import ij.plugin.filter.Convolver;
import ij.process.FloatProcessor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class StarDetectionService {

    private static final Logger log = LoggerFactory.getLogger(StarDetectionService.class);

    // kernel footprint in units of the PSF sigma
    private static final double KERNEL_SIGMA_RADIUS = 1.5;
    private static final int MIN_KERNEL_RADIUS = 2;

    private final NoiseStatisticsService noiseService;

    public StarDetectionService() {
        this(new NoiseStatisticsService());
    }

    public StarDetectionService(NoiseStatisticsService noiseService) {
        this.noiseService = noiseService;
    }

    public List<StarCandidate> detect(Image image, Region region, DetectionParameters params, StarRole role)
            throws PreconditionException, ConfigurationException {
        double[] data = image.crop(region);
        NoiseStats stats = noiseService.sigmaClippedStats(data, params.sigmaClip);
        if (stats.isDegenerate()) {
            log.info("No usable contrast in {} region {} ({}), nothing detected", role.label(), region, stats);
            return Collections.emptyList();
        }

        int w = region.width;
        int h = region.height;
        float[] residual = new float[w * h];
        for (int i = 0; i < residual.length; i++) {
            residual[i] = (float) (data[i] - stats.median);
        }

        double sigma = params.fwhm / FwhmEstimate.SIGMA_TO_FWHM;
        int radius = kernelRadius(sigma);
        int size = 2 * radius + 1;

        FloatProcessor response = new FloatProcessor(w, h, residual.clone());
        Convolver convolver = new Convolver();
        convolver.setNormalize(false);
        if (!convolver.convolve(response, matchedKernel(sigma, radius), size, size)) {
            throw new IllegalStateException("Matched-filter convolution was not performed");
        }
        float[] r = (float[]) response.getPixels();
        double limit = params.threshold * stats.stddev;

        List<StarCandidate> found = new ArrayList<>();
        boolean[] claimed = new boolean[w * h];
        for (int y = radius; y < h - radius; y++) {
            for (int x = radius; x < w - radius; x++) {
                float v = r[y * w + x];
                // responses next to a saturated sample overflow to Inf or NaN
                if (claimed[y * w + x] || !(v > limit) || Float.isInfinite(v) || !isLocalMaximum(r, w, x, y, radius)) continue;

                // a saturated core gives a flat response; center the window on the plateau
                int[] peak = plateauCenter(r, w, h, x, y, claimed);
                int px = Math.min(Math.max(peak[0], radius), w - 1 - radius);
                int py = Math.min(Math.max(peak[1], radius), h - 1 - radius);

                // --- CENTROID ---
                double sum = 0, sx = 0, sy = 0;
                for (int dy = -radius; dy <= radius; dy++) {
                    for (int dx = -radius; dx <= radius; dx++) {
                        double f = residual[(py + dy) * w + (px + dx)];
                        if (!(f > 0) || Double.isInfinite(f)) continue;
                        sum += f;
                        sx += f * (px + dx);
                        sy += f * (py + dy);
                    }
                }
                double cx = sx / sum;
                double cy = sy / sum;
                if (!(sum > 0) || !Double.isFinite(cx) || !Double.isFinite(cy)) {
                    log.debug("Dropped {} peak at ({}, {}): no finite centroid", role.label(), region.x0 + x, region.y0 + y);
                    continue;
                }
                found.add(new StarCandidate(region.x0 + cx, region.y0 + cy, role));
            }
        }

        log.info("Detected {} {} candidate(s) in region {} (median={}, stddev={}, limit={})",
                found.size(), role.label(), region, stats.median, stats.stddev, limit);
        return found;
    }

    // Mean position of the 8-connected pixels sharing the peak's response, rounded.
    private static int[] plateauCenter(float[] r, int w, int h, int x0, int y0, boolean[] claimed) {
        float v = r[y0 * w + x0];
        ArrayDeque<Integer> queue = new ArrayDeque<>();
        queue.add(y0 * w + x0);
        claimed[y0 * w + x0] = true;
        long sx = 0, sy = 0;
        int n = 0;
        while (!queue.isEmpty()) {
            int i = queue.poll();
            int x = i % w;
            int y = i / w;
            sx += x;
            sy += y;
            n++;
            for (int dy = -1; dy <= 1; dy++) {
                for (int dx = -1; dx <= 1; dx++) {
                    int nx = x + dx;
                    int ny = y + dy;
                    if (nx < 0 || ny < 0 || nx >= w || ny >= h) continue;
                    int j = ny * w + nx;
                    if (claimed[j] || r[j] != v) continue;
                    claimed[j] = true;
                    queue.add(j);
                }
            }
        }
        return new int[] {(int) Math.round((double) sx / n), (int) Math.round((double) sy / n)};
    }

    static int kernelRadius(double sigma) {
        return Math.max(MIN_KERNEL_RADIUS, (int) Math.ceil(KERNEL_SIGMA_RADIUS * sigma));
    }

    /**
     * Circular Gaussian divided by the sum of its squares, so the response at a
     * source center equals the least-squares amplitude of that source.
     */
    static float[] matchedKernel(double sigma, int radius) {
        int size = 2 * radius + 1;
        double[] g = new double[size * size];
        double norm = 0;
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                int r2 = dx * dx + dy * dy;
                if (r2 > radius * radius) continue;
                double v = Math.exp(-r2 / (2 * sigma * sigma));
                g[(dy + radius) * size + (dx + radius)] = v;
                norm += v * v;
            }
        }
        float[] kernel = new float[g.length];
        for (int i = 0; i < g.length; i++) kernel[i] = (float) (g[i] / norm);
        return kernel;
    }

    // Ties go to the pixel met first in scan order.
    private static boolean isLocalMaximum(float[] r, int w, int x, int y, int radius) {
        float v = r[y * w + x];
        for (int dy = -radius; dy <= radius; dy++) {
            for (int dx = -radius; dx <= radius; dx++) {
                if ((dx == 0 && dy == 0) || dx * dx + dy * dy > radius * radius) continue;
                float n = r[(y + dy) * w + (x + dx)];
                if (n > v) return false;
                if (n == v && (dy < 0 || (dy == 0 && dx < 0))) return false;
            }
        }
        return true;
    }
}
