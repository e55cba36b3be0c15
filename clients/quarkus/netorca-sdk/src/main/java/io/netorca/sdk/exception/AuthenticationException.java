package io.netorca.sdk.exception;

/**
 * Exception thrown when no usable token could be obtained, or the server
 * rejected the token it was given.
 */
public class AuthenticationException extends NetOrcaException {

    public AuthenticationException(String message) {
        super(message, 401, null, null);
    }

    public AuthenticationException(String message, int statusCode, Throwable cause) {
        super(message, statusCode, cause, null);
    }

    public static AuthenticationException tokenRejected(int statusCode) {
        return new AuthenticationException("Token rejected by NetOrca (HTTP " + statusCode + ")", statusCode, null);
    }

    public static AuthenticationException missingToken() {
        return new AuthenticationException("Authentication response did not contain a token");
    }

    /**
     * The login endpoint refused the credentials. DRF answers 400 for bad
     * credentials, some deployments 401 or 403.
     */
    public static AuthenticationException loginRejected(NetOrcaException cause) {
        return new AuthenticationException(
            "Login rejected by NetOrca (HTTP " + cause.getStatusCode() + ")",
            cause.getStatusCode(),
            cause
        );
    }
}
