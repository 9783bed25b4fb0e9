package com.genway.exception;

import com.genway.model.ErrorKind;

/**
 * Missing or invalid configuration. Never retried.
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super(ErrorKind.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorKind.CONFIGURATION, message, cause);
    }
}
