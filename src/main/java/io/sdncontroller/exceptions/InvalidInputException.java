package io.sdncontroller.exceptions;

/**
 * Thrown when request attributes fail validation.
 */
public class InvalidInputException extends NetworkControllerException {

    public InvalidInputException(String message) {
        super("Invalid input for operation: " + message);
    }
}
