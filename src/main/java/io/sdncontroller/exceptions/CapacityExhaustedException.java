package io.sdncontroller.exceptions;

/**
 * Thrown when no backend switch of a network has room for another port and fragmentation is not allowed.
 */
public class CapacityExhaustedException extends NetworkControllerException {

    private final String networkId;

    public CapacityExhaustedException(String networkId) {
        super("Maximum number of logical ports reached for logical network " + networkId);
        this.networkId = networkId;
    }

    public String getNetworkId() {
        return networkId;
    }
}
