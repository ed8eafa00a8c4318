package io.sdncontroller.exceptions;

/**
 * Wraps a failed backend call. The cause carries the transport detail.
 */
public class BackendUnavailableException extends NetworkControllerException {

    public BackendUnavailableException(String message) {
        super(message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
