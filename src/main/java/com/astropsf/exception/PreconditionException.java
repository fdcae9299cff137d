package com.astropsf.exception;

import com.astropsf.model.PhotometryReport;

// Inputs the core cannot work with: a patch leaving the image, a missing star list, a non-positive flux.
public class PreconditionException extends PhotometryException {

    public PreconditionException(String message) {
        super(message);
    }

    public PreconditionException(String message, PhotometryReport partialReport) {
        super(message, null, partialReport);
    }
}
