package io.sdncontroller.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.sdncontroller.enums.NetworkType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Provider binding of a network: how it maps onto physical transport.
 * The physical network is the transport zone uuid on the backend.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NetworkBinding {

    @JsonProperty("network_id")
    private String networkId;

    @JsonProperty("binding_type")
    private NetworkType bindingType;

    @JsonProperty("physical_network")
    private String physicalNetwork;

    @JsonProperty("vlan_id")
    private Integer vlanId;
}
