package com.agonyforge.perpscanner.exception;

/**
 * Thrown at startup when the scanner configuration cannot be used.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }
}
