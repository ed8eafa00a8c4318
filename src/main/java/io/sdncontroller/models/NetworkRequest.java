package io.sdncontroller.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

/**
 * Create or update request for a network. A null field means "not specified".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetworkRequest {

    @JsonProperty("name")
    private String name;

    @JsonProperty("tenant_id")
    private String tenantId;

    @JsonProperty("admin_state_up")
    private Boolean adminStateUp;

    @JsonProperty("shared")
    private Boolean shared;

    @JsonProperty("provider:network_type")
    private String networkType;

    @JsonProperty("provider:physical_network")
    private String physicalNetwork;

    @JsonProperty("provider:segmentation_id")
    private Integer segmentationId;

    @JsonProperty("port_security_enabled")
    private Boolean portSecurityEnabled;

    // Zone hint used to pick the target cluster
    @JsonProperty("zone_id")
    private String zoneId;

    public boolean hasProviderAttributes() {
        return networkType != null || physicalNetwork != null || segmentationId != null;
    }
}
