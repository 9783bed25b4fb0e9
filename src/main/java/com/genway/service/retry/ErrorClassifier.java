package com.genway.service.retry;

import com.genway.exception.GatewayException;
import com.genway.model.ErrorKind;
import io.netty.handler.timeout.ReadTimeoutException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Maps any failure to an {@link ErrorKind}.
 */
@Component
public class ErrorClassifier {

    public ErrorKind classify(Throwable error) {
        if (error == null) {
            return ErrorKind.INTERNAL;
        }
        if (error instanceof GatewayException) {
            ErrorKind kind = ((GatewayException) error).getKind();
            return kind != null ? kind : ErrorKind.INTERNAL;
        }
        if (error instanceof TimeoutException || isReadTimeout(error)) {
            return ErrorKind.TIMEOUT;
        }
        if (error instanceof WebClientResponseException) {
            return ErrorKind.fromStatus(((WebClientResponseException) error).getStatusCode().value());
        }
        if (error instanceof WebClientRequestException || error instanceof IOException) {
            return ErrorKind.CONNECTION;
        }
        return ErrorKind.INTERNAL;
    }

    /**
     * True when Netty's read timeout is the error or one of its causes, as when a response
     * timeout surfaces wrapped in a {@link WebClientRequestException}.
     */
    public static boolean isReadTimeout(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof ReadTimeoutException) {
                return true;
            }
        }
        return false;
    }
}
