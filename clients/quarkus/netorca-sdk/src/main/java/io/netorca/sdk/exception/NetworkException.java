package io.netorca.sdk.exception;

/**
 * Exception thrown when a request could not be completed at the transport level.
 */
public class NetworkException extends NetOrcaException {

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    public static NetworkException requestFailed(String method, String url, Throwable cause) {
        return new NetworkException(method + " " + url + " failed: " + cause.getMessage(), cause);
    }

    public static NetworkException interrupted(String method, String url, InterruptedException cause) {
        return new NetworkException(method + " " + url + " was interrupted", cause);
    }
}
