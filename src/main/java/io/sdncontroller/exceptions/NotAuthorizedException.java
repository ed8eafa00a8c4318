package io.sdncontroller.exceptions;

/**
 * Thrown when the policy check for an action fails.
 */
public class NotAuthorizedException extends NetworkControllerException {

    private final String action;

    public NotAuthorizedException(String action) {
        super("Policy does not allow " + action + " to be performed");
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
