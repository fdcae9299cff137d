package com.astropsf.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Everything one pipeline run produced. A partial report handed back with a
 * failure has no magnitude; one from the FWHM stage also lacks the geometry,
 * the per-star results and possibly the comparison estimate.
 */
public final class PhotometryReport {
    public final FwhmEstimate targetFwhm;
    public final FwhmEstimate comparisonFwhm;
    public final PsfGeometry geometry;
    public final List<PhotometryResult> targetResults;
    public final List<PhotometryResult> comparisonResults;
    public final MagnitudeResult magnitude;

    public PhotometryReport(FwhmEstimate targetFwhm, FwhmEstimate comparisonFwhm, PsfGeometry geometry,
                            List<PhotometryResult> targetResults, List<PhotometryResult> comparisonResults,
                            MagnitudeResult magnitude) {
        this.targetFwhm = targetFwhm;
        this.comparisonFwhm = comparisonFwhm;
        this.geometry = geometry;
        this.targetResults = Collections.unmodifiableList(new ArrayList<>(targetResults));
        this.comparisonResults = Collections.unmodifiableList(new ArrayList<>(comparisonResults));
        this.magnitude = magnitude;
    }

    public static PhotometryReport fwhmOnly(FwhmEstimate targetFwhm, FwhmEstimate comparisonFwhm) {
        return new PhotometryReport(targetFwhm, comparisonFwhm, null,
                Collections.<PhotometryResult>emptyList(), Collections.<PhotometryResult>emptyList(), null);
    }

    public boolean isComplete() {
        return magnitude != null;
    }

    public PhotometryReport withMagnitude(MagnitudeResult m) {
        return new PhotometryReport(targetFwhm, comparisonFwhm, geometry, targetResults, comparisonResults, m);
    }
}
