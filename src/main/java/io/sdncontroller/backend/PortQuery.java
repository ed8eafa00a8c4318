package io.sdncontroller.backend;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

import static io.sdncontroller.config.Constants.WILDCARD_SWITCH;

/**
 * Bulk port query. Device ids are given raw; they are hashed before they reach the backend.
 */
@Value
@Builder
public class PortQuery {

    @Builder.Default
    String switchUuid = WILDCARD_SWITCH;

    @Singular
    List<String> deviceIds;

    @Singular
    List<String> tenantIds;
}
