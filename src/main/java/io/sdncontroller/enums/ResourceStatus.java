package io.sdncontroller.enums;

/**
 * Operational status derived from the backend fabric status of a switch or port.
 */
public enum ResourceStatus {
    ACTIVE,
    DOWN;

    public static ResourceStatus fromFabricStatus(boolean up) {
        return up ? ACTIVE : DOWN;
    }
}
