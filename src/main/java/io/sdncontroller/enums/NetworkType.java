package io.sdncontroller.enums;

/**
 * Provider network types accepted by the controller.
 *
 * FLAT and VLAN are bridged onto a physical L2 domain; GRE and STT are overlays.
 */
public enum NetworkType {
    FLAT("flat"),
    VLAN("vlan"),
    GRE("gre"),
    STT("stt");

    private final String value;

    NetworkType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Bridged switches are held to the stricter port ceiling and may be fragmented.
     */
    public boolean isBridged() {
        return this == FLAT || this == VLAN;
    }

    public static NetworkType fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (NetworkType type : NetworkType.values()) {
            if (type.value.equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null; // Unknown types are reported by the caller
    }
}
