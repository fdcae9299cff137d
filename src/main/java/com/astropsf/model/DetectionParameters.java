package com.astropsf.model;

import com.astropsf.exception.ConfigurationException;

public final class DetectionParameters {
    public final double fwhm;
    public final double threshold;
    public final double sigmaClip;

    public DetectionParameters(double fwhm, double threshold, double sigmaClip) throws ConfigurationException {
        this.fwhm = AppConfig.requirePositive("fwhm", fwhm);
        this.threshold = AppConfig.requirePositive("threshold", threshold);
        this.sigmaClip = AppConfig.requirePositive("sigma_clip", sigmaClip);
    }

    public static DetectionParameters from(AppConfig config) throws ConfigurationException {
        return new DetectionParameters(config.getFwhmSeed(), config.getThreshold(), config.getSigmaClip());
    }
}
