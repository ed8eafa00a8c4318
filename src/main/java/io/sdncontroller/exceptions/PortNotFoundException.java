package io.sdncontroller.exceptions;

/**
 * Thrown when a port that must exist cannot be found.
 */
public class PortNotFoundException extends NetworkControllerException {

    private final String portId;

    public PortNotFoundException(String portId) {
        super("Port " + portId + " could not be found");
        this.portId = portId;
    }

    public String getPortId() {
        return portId;
    }
}
