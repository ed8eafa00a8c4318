package io.sdncontroller.exceptions;

/**
 * Thrown when a network that must exist cannot be found.
 */
public class NetworkNotFoundException extends NetworkControllerException {

    private final String networkId;

    public NetworkNotFoundException(String networkId) {
        super("Network " + networkId + " could not be found");
        this.networkId = networkId;
    }

    public String getNetworkId() {
        return networkId;
    }
}
