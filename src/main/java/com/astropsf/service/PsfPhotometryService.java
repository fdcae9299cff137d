package com.astropsf.service;

import com.astropsf.exception.PreconditionException;
import com.astropsf.model.Image;
import com.astropsf.model.PhotometryResult;
import com.astropsf.model.PsfGeometry;
import com.astropsf.model.StarCandidate;
import ij.measure.Minimizer;
import ij.measure.UserFunction;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Free parameters are position and flux; the local background is held fixed
// unless the service was built to fit it as an extra offset.
public class PsfPhotometryService {

    private static final Logger log = LoggerFactory.getLogger(PsfPhotometryService.class);

    private static final int RANDOM_SEED = 1;
    private static final double POSITION_STEP = 0.5;
    private static final double MAX_RELATIVE_ERROR = 1e-10;

    private final LocalBackgroundService backgroundService;
    private final boolean fitBackground;

    public PsfPhotometryService() {
        this(new LocalBackgroundService(), false);
    }

    public PsfPhotometryService(LocalBackgroundService backgroundService, boolean fitBackground) {
        this.backgroundService = backgroundService;
        this.fitBackground = fitBackground;
    }

    /**
     * Fits every star, on the executor when one is given. Results keep the input
     * order and a failed star never stops the others.
     */
    public List<PhotometryResult> fitAll(Image image, PsfGeometry geometry, List<StarCandidate> stars,
                                         ExecutorService executor) throws InterruptedException {
        List<PhotometryResult> results = new ArrayList<>(stars.size());
        if (executor == null) {
            for (int i = 0; i < stars.size(); i++) results.add(fitQuietly(image, geometry, stars.get(i), i));
            return results;
        }

        List<Future<PhotometryResult>> futures = new ArrayList<>(stars.size());
        for (int i = 0; i < stars.size(); i++) {
            final int index = i;
            Callable<PhotometryResult> task = () -> fitQuietly(image, geometry, stars.get(index), index);
            futures.add(executor.submit(task));
        }
        for (int i = 0; i < futures.size(); i++) {
            StarCandidate star = stars.get(i);
            try {
                results.add(futures.get(i).get());
            } catch (ExecutionException e) {
                log.error("PSF fit of {} #{} crashed", star.role.label(), i, e.getCause());
                results.add(PhotometryResult.failed(star.role, i, star.x, star.y, "fit crashed: " + e.getCause()));
            }
        }
        return results;
    }

    private PhotometryResult fitQuietly(Image image, PsfGeometry geometry, StarCandidate star, int index) {
        try {
            return fit(image, geometry, star, index);
        } catch (PreconditionException e) {
            log.warn("PSF fit of {} #{} skipped: {}", star.role.label(), index, e.getMessage());
            return PhotometryResult.failed(star.role, index, star.x, star.y, e.getMessage());
        } catch (RuntimeException e) {
            log.error("PSF fit of {} #{} crashed", star.role.label(), index, e);
            return PhotometryResult.failed(star.role, index, star.x, star.y, "fit crashed: " + e);
        }
    }

    public PhotometryResult fit(Image image, PsfGeometry geometry, StarCandidate star, int index) throws PreconditionException {
        int cx = (int) Math.round(star.x);
        int cy = (int) Math.round(star.y);
        if (!image.contains(cx, cy)) {
            throw new PreconditionException(String.format(Locale.US, "%s star #%d at (%.2f, %.2f) lies outside the %dx%d image",
                    star.role.label(), index, star.x, star.y, image.getWidth(), image.getHeight()));
        }

        double background = backgroundService.estimate(image, star.x, star.y, geometry.annulusInner, geometry.annulusOuter);
        CircularGaussianPsf psf = new CircularGaussianPsf(geometry.fwhm);

        // --- FIT WINDOW (clipped at the image edge) ---
        int half = geometry.fitSize / 2;
        int wx0 = Math.max(0, cx - half);
        int wx1 = Math.min(image.getWidth() - 1, cx + half);
        int wy0 = Math.max(0, cy - half);
        int wy1 = Math.min(image.getHeight() - 1, cy + half);
        int n = (wx1 - wx0 + 1) * (wy1 - wy0 + 1);
        int numParams = fitBackground ? 4 : 3;
        if (n <= numParams) {
            throw new PreconditionException(String.format(Locale.US, "%s star #%d: only %d pixel(s) of the fit window lie inside the image",
                    star.role.label(), index, n));
        }
        double[] px = new double[n];
        double[] py = new double[n];
        double[] values = new double[n];
        int k = 0;
        double peak = Double.NEGATIVE_INFINITY;
        for (int y = wy0; y <= wy1; y++) {
            for (int x = wx0; x <= wx1; x++) {
                px[k] = x;
                py[k] = y;
                values[k] = fitBackground ? image.get(x, y) : image.get(x, y) - background;
                peak = Math.max(peak, image.get(x, y) - background);
                k++;
            }
        }

        double flux0 = apertureSum(image, star.x, star.y, geometry.apertureRadius, background);
        if (!(flux0 > 0)) flux0 = Math.max(peak, 1.0) / psf.peakFraction();

        double[] init = fitBackground
                ? new double[] {star.x, star.y, flux0, background}
                : new double[] {star.x, star.y, flux0};
        double[] steps = fitBackground
                ? new double[] {POSITION_STEP, POSITION_STEP, 0.1 * flux0, 0.1 * Math.abs(background) + 1.0}
                : new double[] {POSITION_STEP, POSITION_STEP, 0.1 * flux0};

        UserFunction residuals = (p, ignored) -> {
            double offset = fitBackground ? p[3] : 0.0;
            double ss = 0;
            for (int i = 0; i < values.length; i++) {
                double d = values[i] - psf.evaluate(px[i], py[i], p[0], p[1], p[2]) - offset;
                ss += d * d;
            }
            return ss;
        };

        double sumSq = 0;
        for (double v : values) sumSq += v * v;

        Minimizer minimizer = new Minimizer();
        minimizer.setRandomSeed(RANDOM_SEED);
        minimizer.setFunction(residuals, numParams);
        // absolute bound for residual sums near zero
        minimizer.setMaxError(MAX_RELATIVE_ERROR, MAX_RELATIVE_ERROR * 1e-3 * Math.max(sumSq, Double.MIN_NORMAL));
        int status = minimizer.minimize(init, steps);
        double[] p = minimizer.getParams();

        double fx = p[0];
        double fy = p[1];
        double flux = p[2];
        double bkg = fitBackground ? p[3] : background;

        String message = null;
        if (status != Minimizer.SUCCESS) {
            message = "fit did not converge: " + Minimizer.STATUS_STRING[status];
        } else if (!Double.isFinite(fx) || !Double.isFinite(fy) || !Double.isFinite(flux) || !Double.isFinite(bkg)) {
            message = "fit produced non-finite parameters";
        } else if (fx < wx0 - 0.5 || fx > wx1 + 0.5 || fy < wy0 - 0.5 || fy > wy1 + 0.5) {
            message = String.format(Locale.US, "fitted center (%.2f, %.2f) left the fit window", fx, fy);
        } else if (flux <= 0) {
            message = "non-physical flux " + flux;
        }

        PhotometryResult result = new PhotometryResult(star.role, index, star.x, star.y, fx, fy, flux, bkg, message == null, message);
        if (result.success) {
            log.info("PSF fit {}", result);
        } else {
            log.warn("PSF fit {}", result);
        }
        return result;
    }

    static double apertureSum(Image image, double x, double y, double radius, double background) {
        int x0 = Math.max(0, (int) Math.floor(x - radius));
        int x1 = Math.min(image.getWidth() - 1, (int) Math.ceil(x + radius));
        int y0 = Math.max(0, (int) Math.floor(y - radius));
        int y1 = Math.min(image.getHeight() - 1, (int) Math.ceil(y + radius));
        double r2 = radius * radius;
        double sum = 0;
        for (int py = y0; py <= y1; py++) {
            for (int px = x0; px <= x1; px++) {
                double dx = px - x;
                double dy = py - y;
                if (dx * dx + dy * dy <= r2) sum += image.get(px, py) - background;
            }
        }
        return sum;
    }
}
