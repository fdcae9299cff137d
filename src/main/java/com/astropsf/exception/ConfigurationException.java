package com.astropsf.exception;

public class ConfigurationException extends PhotometryException {

    public ConfigurationException(String message) {
        super(message);
    }
}
