package com.astropsf.service;

import com.astropsf.exception.ConfigurationException;
import com.astropsf.exception.FitFailedException;
import com.astropsf.exception.FwhmEstimationException;
import com.astropsf.exception.PhotometryException;
import com.astropsf.exception.PreconditionException;
import com.astropsf.model.DetectionParameters;
import com.astropsf.model.FwhmEstimate;
import com.astropsf.model.Image;
import com.astropsf.model.MagnitudeResult;
import com.astropsf.model.PhotometryReport;
import com.astropsf.model.PhotometryResult;
import com.astropsf.model.PhotometrySession;
import com.astropsf.model.PsfGeometry;
import com.astropsf.model.Region;
import com.astropsf.model.StarCandidate;
import com.astropsf.model.StarRole;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// User actions of a session; each call blocks until it has a result or a failure.
public class PhotometryPipelineService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PhotometryPipelineService.class);

    private final StarDetectionService detectionService;
    private final FwhmProfileService fwhmService;
    private final PsfPhotometryService photometryService;
    private final MagnitudeCalculatorService magnitudeService;
    private final ExecutorService exec;
    private final int patchSize;

    public PhotometryPipelineService() {
        this(Runtime.getRuntime().availableProcessors(), FwhmProfileService.DEFAULT_PATCH_SIZE);
    }

    public PhotometryPipelineService(int threads, int patchSize) {
        this(new StarDetectionService(), new FwhmProfileService(), new PsfPhotometryService(),
                new MagnitudeCalculatorService(), threads > 1 ? Executors.newFixedThreadPool(threads) : null, patchSize);
    }

    public PhotometryPipelineService(StarDetectionService detectionService, FwhmProfileService fwhmService,
                                     PsfPhotometryService photometryService, MagnitudeCalculatorService magnitudeService,
                                     ExecutorService exec, int patchSize) {
        this.detectionService = detectionService;
        this.fwhmService = fwhmService;
        this.photometryService = photometryService;
        this.magnitudeService = magnitudeService;
        this.exec = exec;
        this.patchSize = patchSize;
    }

    public List<StarCandidate> detect(Image image, Region region, StarRole role, PhotometrySession session,
                                      DetectionParameters params) throws PreconditionException, ConfigurationException {
        List<StarCandidate> found = detectionService.detect(image, region, params, role);
        session.replaceStars(role, found);
        log.info("Detected {} star count: {}", role.label(), found.size());
        return found;
    }

    public double estimateFwhm(Image image, PhotometrySession session) throws PhotometryException {
        estimateProfiles(image, session);
        return session.getFwhm();
    }

    public PhotometryReport run(Image image, PhotometrySession session) throws PhotometryException {
        FwhmEstimate[] estimates = estimateProfiles(image, session);
        PsfGeometry geometry = new PsfGeometry(session.getFwhm());
        log.info("PSF photometry with {}", geometry);

        List<PhotometryResult> targets;
        List<PhotometryResult> comparisons;
        try {
            targets = photometryService.fitAll(image, geometry, session.stars(StarRole.TARGET), exec);
            comparisons = photometryService.fitAll(image, geometry, session.stars(StarRole.COMPARISON), exec);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PhotometryException("PSF photometry was interrupted", e);
        }
        PhotometryReport partial = new PhotometryReport(estimates[0], estimates[1], geometry, targets, comparisons, null);

        MagnitudeResult magnitude;
        try {
            magnitude = magnitudeService.fromResults(targets.get(0), comparisons.get(0), session.getComparisonMagnitude());
        } catch (FitFailedException e) {
            log.error("Magnitude calculation aborted: {}", e.getMessage());
            throw new FitFailedException(e.getMessage(), partial);
        } catch (PreconditionException e) {
            log.error("Magnitude calculation aborted: {}", e.getMessage());
            throw new PhotometryException(e.getMessage(), e, partial);
        }
        return partial.withMagnitude(magnitude);
    }

    private FwhmEstimate[] estimateProfiles(Image image, PhotometrySession session) throws PhotometryException {
        StarCandidate target = session.activeStar(StarRole.TARGET);
        StarCandidate comparison = session.activeStar(StarRole.COMPARISON);

        FwhmEstimate t = fwhmService.estimate(image, target.x, target.y, patchSize, StarRole.TARGET);
        FwhmEstimate c;
        try {
            c = fwhmService.estimate(image, comparison.x, comparison.y, patchSize, StarRole.COMPARISON);
        } catch (PreconditionException e) {
            throw new PreconditionException(e.getMessage(), PhotometryReport.fwhmOnly(t, null));
        }
        double fwhm;
        try {
            fwhm = fwhmService.combine(t, c);
        } catch (FwhmEstimationException e) {
            log.error("FWHM estimation aborted: {}", e.getMessage());
            throw new FwhmEstimationException(e.getMessage(), PhotometryReport.fwhmOnly(t, c));
        }
        session.setFwhm(fwhm);
        log.info("PSF FWHM: {}", String.format(Locale.US, "%.3f", fwhm));
        return new FwhmEstimate[] {t, c};
    }

    @Override
    public void close() {
        if (exec == null) return;
        exec.shutdown();
        try {
            if (!exec.awaitTermination(10, TimeUnit.SECONDS)) exec.shutdownNow();
        } catch (InterruptedException e) {
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
