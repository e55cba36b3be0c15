package io.netorca.sdk.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Base exception for NetOrca SDK errors.
 *
 * <p>Carries the HTTP status NetOrca answered with, if the request got that
 * far, and the parsed error body (or other details) as context.
 */
public class NetOrcaException extends RuntimeException {

    private static final int NO_RESPONSE = 0;

    private final int statusCode;
    private final Map<String, Object> context;

    public NetOrcaException(String message) {
        this(message, NO_RESPONSE, null, null);
    }

    public NetOrcaException(String message, Throwable cause) {
        this(message, NO_RESPONSE, cause, null);
    }

    public NetOrcaException(String message, int statusCode, Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.context = context == null || context.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    /**
     * HTTP status of the response that caused this error, or {@code 0} when
     * no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * The HTTP status, if NetOrca answered at all.
     */
    public OptionalInt status() {
        return reachedServer() ? OptionalInt.of(statusCode) : OptionalInt.empty();
    }

    /**
     * Whether NetOrca received the request and answered it.
     */
    public boolean reachedServer() {
        return statusCode > NO_RESPONSE;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
