package io.sdncontroller.exceptions;

/**
 * Thrown when no configured cluster serves the requested zone.
 */
public class UnknownZoneException extends NetworkControllerException {

    private final String zone;

    public UnknownZoneException(String zone) {
        super("Unable to find cluster config entry for zone: " + zone);
        this.zone = zone;
    }

    public String getZone() {
        return zone;
    }
}
