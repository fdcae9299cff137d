package com.astropsf.model;

import java.util.Locale;

public final class MagnitudeResult {
    public final double targetMagnitude;
    public final double comparisonMagnitude;
    public final double fluxRatio;        // target / comparison
    public final double targetFlux;
    public final double comparisonFlux;

    public MagnitudeResult(double targetMagnitude, double comparisonMagnitude, double targetFlux, double comparisonFlux) {
        this.targetMagnitude = targetMagnitude;
        this.comparisonMagnitude = comparisonMagnitude;
        this.targetFlux = targetFlux;
        this.comparisonFlux = comparisonFlux;
        this.fluxRatio = targetFlux / comparisonFlux;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "m_target=%.3f (m_comp=%.3f, ratio=%.4f)", targetMagnitude, comparisonMagnitude, fluxRatio);
    }
}
