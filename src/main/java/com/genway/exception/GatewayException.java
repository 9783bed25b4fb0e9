package com.genway.exception;

import com.genway.model.ErrorKind;

/**
 * Base class for gateway failures. Every failure carries an {@link ErrorKind}
 * so retry and reporting code can branch on it without instanceof chains.
 */
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;

    public GatewayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
