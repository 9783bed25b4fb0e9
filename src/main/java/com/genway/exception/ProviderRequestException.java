package com.genway.exception;

import com.genway.model.ErrorKind;

/**
 * Upstream call failed: non-2xx status, malformed body, timeout or connection error.
 * The raw body is kept for diagnostics.
 */
public class ProviderRequestException extends GatewayException {

    private final String provider;
    private final Integer statusCode;
    private final String rawBody;

    public ProviderRequestException(String provider, ErrorKind kind, Integer statusCode,
                                    String message, String rawBody) {
        super(kind, message);
        this.provider = provider;
        this.statusCode = statusCode;
        this.rawBody = rawBody;
    }

    public ProviderRequestException(String provider, ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
        this.provider = provider;
        this.statusCode = null;
        this.rawBody = null;
    }

    public static ProviderRequestException httpStatus(String provider, int status, String rawBody) {
        return new ProviderRequestException(
                provider,
                ErrorKind.fromStatus(status),
                status,
                provider + " API request failed with status " + status + ": " + rawBody,
                rawBody);
    }

    public static ProviderRequestException malformed(String provider, String detail, String rawBody) {
        return new ProviderRequestException(
                provider,
                ErrorKind.MALFORMED_RESPONSE,
                null,
                "Invalid " + provider + " response format: " + detail,
                rawBody);
    }

    public String getProvider() {
        return provider;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public String getRawBody() {
        return rawBody;
    }
}
