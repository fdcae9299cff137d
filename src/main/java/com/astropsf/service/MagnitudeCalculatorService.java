package com.astropsf.service;

import com.astropsf.exception.FitFailedException;
import com.astropsf.exception.PreconditionException;
import com.astropsf.model.MagnitudeResult;
import com.astropsf.model.PhotometryResult;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// m_target = m_comp - 2.5 log10(F_target / F_comp)
public class MagnitudeCalculatorService {

    private static final Logger log = LoggerFactory.getLogger(MagnitudeCalculatorService.class);

    public MagnitudeResult calculate(double targetFlux, double comparisonFlux, double comparisonMagnitude)
            throws PreconditionException {
        if (!Double.isFinite(comparisonMagnitude)) {
            throw new PreconditionException("Comparison magnitude must be finite (was " + comparisonMagnitude + ")");
        }
        if (!Double.isFinite(comparisonFlux) || comparisonFlux <= 0) {
            throw new PreconditionException("Comparison flux must be finite and positive (was " + comparisonFlux + ")");
        }
        if (!Double.isFinite(targetFlux)) {
            throw new PreconditionException("Target flux must be finite (was " + targetFlux + ")");
        }
        if (targetFlux <= 0) {
            throw new PreconditionException("Target flux " + targetFlux + " is not positive; its magnitude is undefined");
        }
        double m = comparisonMagnitude - 2.5 * Math.log10(targetFlux / comparisonFlux);
        MagnitudeResult result = new MagnitudeResult(m, comparisonMagnitude, targetFlux, comparisonFlux);
        log.info("Target apparent magnitude: {}", String.format(Locale.US, "%.3f", m));
        return result;
    }

    public MagnitudeResult fromResults(PhotometryResult target, PhotometryResult comparison, double comparisonMagnitude)
            throws PreconditionException, FitFailedException {
        requireSuccess(target);
        requireSuccess(comparison);
        return calculate(target.flux, comparison.flux, comparisonMagnitude);
    }

    private static void requireSuccess(PhotometryResult r) throws FitFailedException {
        if (!r.success) {
            throw new FitFailedException("PSF fit of " + r.describe() + " failed (" + r.message + "); magnitude not computed");
        }
    }
}
