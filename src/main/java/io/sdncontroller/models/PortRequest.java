package io.sdncontroller.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Create or update request for a port. A null field means "not specified".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortRequest {

    @JsonProperty("network_id")
    private String networkId;

    @JsonProperty("tenant_id")
    private String tenantId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("device_id")
    private String deviceId;

    @JsonProperty("device_owner")
    private String deviceOwner;

    @JsonProperty("admin_state_up")
    private Boolean adminStateUp;

    @JsonProperty("mac_address")
    private String macAddress;

    @JsonProperty("fixed_ips")
    private List<FixedIp> fixedIps;

    @JsonProperty("port_security_enabled")
    private Boolean portSecurityEnabled;

    @JsonProperty("zone_id")
    private String zoneId;
}
