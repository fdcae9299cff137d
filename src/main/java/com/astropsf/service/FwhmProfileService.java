package com.astropsf.service;

import com.astropsf.exception.FwhmEstimationException;
import com.astropsf.exception.PreconditionException;
import com.astropsf.model.FwhmEstimate;
import com.astropsf.model.Image;
import com.astropsf.model.StarRole;
import ij.measure.CurveFitter;
import ij.measure.Minimizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FwhmProfileService {

    private static final Logger log = LoggerFactory.getLogger(FwhmProfileService.class);

    public static final int DEFAULT_PATCH_SIZE = 31;
    private static final double INITIAL_SIGMA = 3.0;
    private static final int RANDOM_SEED = 1;

    public FwhmEstimate estimate(Image image, double x0, double y0, int size, StarRole role) throws PreconditionException {
        if (size < 3 || size % 2 == 0) {
            throw new PreconditionException("FWHM patch size must be odd and >= 3 (was " + size + ")");
        }
        int half = size / 2;
        int cx = (int) Math.round(x0);
        int cy = (int) Math.round(y0);
        if (cx - half < 0 || cy - half < 0 || cx + half >= image.getWidth() || cy + half >= image.getHeight()) {
            throw new PreconditionException(String.format(Locale.US,
                    "FWHM patch of %dx%d around the %s star (%d, %d) leaves the %dx%d image",
                    size, size, role.label(), cx, cy, image.getWidth(), image.getHeight()));
        }

        double[] t = new double[size];
        double[] profileX = new double[size];
        double[] profileY = new double[size];
        for (int i = 0; i < size; i++) {
            t[i] = i;
            profileX[i] = image.get(cx - half + i, cy);
            profileY[i] = image.get(cx, cy - half + i);
        }

        AxisFit fx = fitProfile(t, profileX, half, role, "x");
        AxisFit fy = fitProfile(t, profileY, half, role, "y");
        FwhmEstimate estimate = new FwhmEstimate(role, cx, cy, fx.sigma, fx.success, fy.sigma, fy.success);
        log.info("{} star FWHM_x: {}", capitalize(role), format(estimate.fwhmX));
        log.info("{} star FWHM_y: {}", capitalize(role), format(estimate.fwhmY));
        return estimate;
    }

    public double combine(FwhmEstimate... estimates) throws FwhmEstimationException {
        double sum = 0;
        int n = 0;
        List<String> failed = new ArrayList<>();
        for (FwhmEstimate e : estimates) {
            if (e.successX) { sum += e.fwhmX; n++; } else failed.add(e.role.label() + "/x");
            if (e.successY) { sum += e.fwhmY; n++; } else failed.add(e.role.label() + "/y");
        }
        if (n == 0) {
            throw new FwhmEstimationException("FWHM estimation failed: no profile fit converged (" + String.join(", ", failed) + ")");
        }
        if (!failed.isEmpty()) {
            log.warn("FWHM averaged over {} axis estimate(s); failed axes: {}", n, failed);
        }
        return sum / n;
    }

    private AxisFit fitProfile(double[] t, double[] profile, int half, StarRole role, String axis) {
        double min = profile[0], max = profile[0];
        for (double v : profile) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (max == min) {
            log.warn("FWHM fit for {} star, {} axis: flat profile", role.label(), axis);
            return AxisFit.FAILED;
        }

        // y = a + (b - a) * exp(-(t - c)^2 / (2 d^2)); b - a is the amplitude
        CurveFitter cf = new CurveFitter(t, profile);
        cf.getMinimizer().setRandomSeed(RANDOM_SEED);
        cf.setInitialParameters(new double[] {min, max, half, INITIAL_SIGMA});
        cf.doFit(CurveFitter.GAUSSIAN);

        double[] p = cf.getParams();
        double sigma = p[3];
        if (cf.getStatus() != Minimizer.SUCCESS || !Double.isFinite(sigma) || sigma == 0
                || !Double.isFinite(p[0]) || !Double.isFinite(p[1]) || !Double.isFinite(p[2])) {
            log.warn("FWHM fit for {} star, {} axis did not converge: {}", role.label(), axis, cf.getStatusString());
            return AxisFit.FAILED;
        }
        log.debug("{} {} profile fit: offset={} peak={} center={} sigma={}", role.label(), axis, p[0], p[1], p[2], sigma);
        return new AxisFit(Math.abs(sigma), true);
    }

    private static String capitalize(StarRole role) {
        String s = role.label();
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    static String format(double v) {
        return String.format(Locale.US, "%.3f", v);
    }

    private static final class AxisFit {
        static final AxisFit FAILED = new AxisFit(Double.NaN, false);
        final double sigma;
        final boolean success;

        AxisFit(double sigma, boolean success) {
            this.sigma = sigma;
            this.success = success;
        }
    }
}
