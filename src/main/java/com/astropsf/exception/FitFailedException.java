package com.astropsf.exception;

import com.astropsf.model.PhotometryReport;

public class FitFailedException extends PhotometryException {

    public FitFailedException(String message) {
        super(message);
    }

    public FitFailedException(String message, PhotometryReport partialReport) {
        super(message, null, partialReport);
    }
}
