package io.sdncontroller.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A fixed IP assignment of a port.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FixedIp {

    @JsonProperty("subnet_id")
    private String subnetId;

    @JsonProperty("ip_address")
    private String ipAddress;
}
