package io.sdncontroller.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.sdncontroller.enums.ResourceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Logical port record. Ids and MAC addresses are assigned locally.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Port {

    @JsonProperty("id")
    private String id;

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
    @Builder.Default
    private boolean adminStateUp = true;

    @JsonProperty("mac_address")
    private String macAddress;

    @JsonProperty("fixed_ips")
    @Builder.Default
    private List<FixedIp> fixedIps = new ArrayList<>();

    @JsonProperty("port_security_enabled")
    private Boolean portSecurityEnabled;

    @JsonProperty("status")
    private ResourceStatus status;

    // Cluster the backend port was created on; null for records created before it was stored
    @JsonProperty("cluster_name")
    private String clusterName;

    public void setFixedIps(List<FixedIp> fixedIps) {
        this.fixedIps = fixedIps != null ? fixedIps : new ArrayList<>();
    }
}
