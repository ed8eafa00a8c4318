package io.sdncontroller.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.sdncontroller.enums.ResourceStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Logical network record.
 *
 * The id is the uuid of the backend switch created for the network. Status,
 * provider attributes and the port security flag are projections added by the
 * engine and are not owned by the network table itself.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Network {

    @JsonProperty("id")
    private String id;

    @JsonProperty("tenant_id")
    private String tenantId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("admin_state_up")
    @Builder.Default
    private boolean adminStateUp = true;

    @JsonProperty("shared")
    private boolean shared;

    @JsonProperty("status")
    private ResourceStatus status;

    @JsonProperty("provider:network_type")
    private String networkType;

    @JsonProperty("provider:physical_network")
    private String physicalNetwork;

    @JsonProperty("provider:segmentation_id")
    private Integer segmentationId;

    @JsonProperty("port_security_enabled")
    private Boolean portSecurityEnabled;
}
