package com.uberlite.radius.config;

/**
 * Raised when the edge-length table or tuning parameters cannot support a query.
 */
public class RadiusSearchConfigurationException extends IllegalStateException {

    public RadiusSearchConfigurationException(String message) {
        super(message);
    }

    public RadiusSearchConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
