package io.netorca.sdk.exception;

import java.util.Map;

/**
 * Exception thrown when NetOrca answers with a non-success status.
 */
public class ServerException extends NetOrcaException {

    public ServerException(String message, int statusCode, Map<String, Object> context) {
        super(message, statusCode, null, context);
    }

    public static ServerException fromResponse(String method, String url, int statusCode, Map<String, Object> body) {
        String detail = body.get("detail") instanceof String d ? ": " + d : "";
        String kind = statusCode >= 500 ? "Server error" : "Client error";
        return new ServerException(
            kind + " " + statusCode + " from " + method + " " + url + detail,
            statusCode,
            body
        );
    }

    public boolean isServerSide() {
        return getStatusCode() >= 500;
    }
}
