package com.astropsf.exception;

import com.astropsf.model.PhotometryReport;

public class FwhmEstimationException extends PhotometryException {

    public FwhmEstimationException(String message) {
        super(message);
    }

    public FwhmEstimationException(String message, PhotometryReport partialReport) {
        super(message, null, partialReport);
    }
}
