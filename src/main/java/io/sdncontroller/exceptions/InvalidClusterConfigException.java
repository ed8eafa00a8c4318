package io.sdncontroller.exceptions;

/**
 * Thrown when a cluster definition cannot be turned into a usable cluster. Registry construction is aborted.
 */
public class InvalidClusterConfigException extends NetworkControllerException {

    public InvalidClusterConfigException(String message) {
        super(message);
    }

    public InvalidClusterConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
