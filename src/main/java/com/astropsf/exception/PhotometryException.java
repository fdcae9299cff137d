package com.astropsf.exception;

import com.astropsf.model.PhotometryReport;

/**
 * Base of every failure the photometry core reports to its caller.
 * A pipeline step that fails after producing intermediate values attaches them
 * as a partial report so the front end can still show them.
 */
public class PhotometryException extends Exception {

    private final transient PhotometryReport partialReport;

    public PhotometryException(String message) {
        this(message, null, null);
    }

    public PhotometryException(String message, Throwable cause) {
        this(message, cause, null);
    }

    public PhotometryException(String message, Throwable cause, PhotometryReport partialReport) {
        super(message, cause);
        this.partialReport = partialReport;
    }

    public PhotometryReport getPartialReport() {
        return partialReport;
    }
}
