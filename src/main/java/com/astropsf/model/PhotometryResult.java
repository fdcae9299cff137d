package com.astropsf.model;

import java.util.Locale;

public final class PhotometryResult {
    public final StarRole role;
    public final int index;          // position in the role's star list
    public final double initialX;
    public final double initialY;
    public final double x;
    public final double y;
    public final double flux;
    public final double localBackground;
    public final boolean success;
    public final String message;     // null when successful

    public PhotometryResult(StarRole role, int index, double initialX, double initialY,
                            double x, double y, double flux, double localBackground,
                            boolean success, String message) {
        this.role = role;
        this.index = index;
        this.initialX = initialX;
        this.initialY = initialY;
        this.x = x;
        this.y = y;
        this.flux = flux;
        this.localBackground = localBackground;
        this.success = success && Double.isFinite(flux) && flux > 0;
        this.message = this.success ? null : (message != null ? message : "non-physical flux " + flux);
    }

    public static PhotometryResult failed(StarRole role, int index, double initialX, double initialY, String message) {
        return new PhotometryResult(role, index, initialX, initialY, Double.NaN, Double.NaN, Double.NaN, Double.NaN, false, message);
    }

    public String describe() {
        return role.label() + " #" + index;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%s x=%.3f y=%.3f flux=%.3f bkg=%.3f %s",
                describe(), x, y, flux, localBackground, success ? "OK" : "FAILED (" + message + ")");
    }
}
