package com.astropsf.model;

import java.util.Locale;

public final class PsfGeometry {
    public final double fwhm;
    public final int fitSize;           // odd, round(6 * fwhm) bumped to odd
    public final double apertureRadius; // 2 * fwhm, seeds the flux
    public final int annulusInner;      // round(2 * fwhm)
    public final int annulusOuter;      // round(4 * fwhm)

    public PsfGeometry(double fwhm) {
        if (!(fwhm > 0) || Double.isInfinite(fwhm)) {
            throw new IllegalArgumentException("fwhm must be positive (was " + fwhm + ")");
        }
        this.fwhm = fwhm;
        this.fitSize = ensureOdd((int) Math.round(fwhm * 6));
        this.apertureRadius = fwhm * 2;
        this.annulusInner = (int) Math.round(fwhm * 2);
        this.annulusOuter = Math.max(annulusInner + 1, (int) Math.round(fwhm * 4));
    }

    public static int ensureOdd(int n) {
        return n % 2 == 1 ? n : n + 1;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "fwhm=%.3f fit=%dx%d aperture=%.2f annulus=[%d,%d)",
                fwhm, fitSize, fitSize, apertureRadius, annulusInner, annulusOuter);
    }
}
