package com.astropsf.model;

import java.util.Locale;

// a failed axis holds NaN
public final class FwhmEstimate {

    public static final double SIGMA_TO_FWHM = 2.3548;

    public final StarRole role;
    public final int centerX;
    public final int centerY;
    public final double fwhmX;
    public final double fwhmY;
    public final double sigmaX;
    public final double sigmaY;
    public final boolean successX;
    public final boolean successY;

    public FwhmEstimate(StarRole role, int centerX, int centerY, double sigmaX, boolean successX, double sigmaY, boolean successY) {
        this.role = role;
        this.centerX = centerX;
        this.centerY = centerY;
        this.successX = successX;
        this.successY = successY;
        this.sigmaX = successX ? Math.abs(sigmaX) : Double.NaN;
        this.sigmaY = successY ? Math.abs(sigmaY) : Double.NaN;
        this.fwhmX = SIGMA_TO_FWHM * this.sigmaX;
        this.fwhmY = SIGMA_TO_FWHM * this.sigmaY;
    }

    public boolean isAnyValid() {
        return successX || successY;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s FWHM_x=%.3f FWHM_y=%.3f", role.label(), fwhmX, fwhmY);
    }
}
