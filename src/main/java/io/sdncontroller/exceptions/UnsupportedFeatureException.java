package io.sdncontroller.exceptions;

/**
 * Thrown for requests the backend cannot honour.
 */
public class UnsupportedFeatureException extends NetworkControllerException {

    public UnsupportedFeatureException(String message) {
        super(message);
    }
}
