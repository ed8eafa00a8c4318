package io.sdncontroller.backend;

/**
 * The controller answered, but the requested resource does not exist.
 */
public class BackendResourceNotFoundException extends BackendException {

    public BackendResourceNotFoundException(String path) {
        super("Resource not found on backend: " + path, 404);
    }
}
