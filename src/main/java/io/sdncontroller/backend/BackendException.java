package io.sdncontroller.backend;

/**
 * Transport-level failure of a backend call.
 */
public class BackendException extends Exception {

    private final int statusCode;

    public BackendException(String message) {
        this(message, -1, null);
    }

    public BackendException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public BackendException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public BackendException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the controller, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
