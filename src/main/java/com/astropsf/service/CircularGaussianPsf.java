package com.astropsf.service;

import com.astropsf.model.FwhmEstimate;

public final class CircularGaussianPsf {

    private final double fwhm;
    private final double twoSigmaSq;
    private final double norm;

    public CircularGaussianPsf(double fwhm) {
        if (!(fwhm > 0) || Double.isInfinite(fwhm)) {
            throw new IllegalArgumentException("fwhm must be positive (was " + fwhm + ")");
        }
        double sigma = fwhm / FwhmEstimate.SIGMA_TO_FWHM;
        this.fwhm = fwhm;
        this.twoSigmaSq = 2 * sigma * sigma;
        this.norm = 1.0 / (Math.PI * twoSigmaSq);
    }

    public double getFwhm() {
        return fwhm;
    }

    public double peakFraction() {
        return norm;
    }

    public double evaluate(double px, double py, double x0, double y0, double flux) {
        double dx = px - x0;
        double dy = py - y0;
        return flux * norm * Math.exp(-(dx * dx + dy * dy) / twoSigmaSq);
    }
}
