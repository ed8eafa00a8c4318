package io.sdncontroller.exceptions;

/**
 * Base class for failures surfaced by the network controller to its callers.
 */
public class NetworkControllerException extends Exception {

    public NetworkControllerException(String message) {
        super(message);
    }

    public NetworkControllerException(String message, Throwable cause) {
        super(message, cause);
    }
}
