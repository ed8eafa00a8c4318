package io.sdncontroller.backend;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.sdncontroller.config.Constants.PATH_LPORT;
import static io.sdncontroller.config.Constants.PATH_LSWITCH;
import static io.sdncontroller.config.Constants.TAG_SCOPE_LOGICAL_PORT;

/**
 * Logical port as observed on the backend. The logical-port-id tag joins it
 * to the local port record.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BackendPort {

    @JsonProperty("uuid")
    private String uuid;

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("tags")
    private List<BackendTag> tags = new ArrayList<>();

    @JsonProperty("admin_status_enabled")
    private boolean adminStatusEnabled;

    @JsonProperty("_relations")
    private Relations relations;

    // e.g. /ws.v1/lswitch/{switch}/lport/{port}
    @JsonProperty("_href")
    private String href;

    public BackendPort(String uuid, String switchUuid, String displayName, List<BackendTag> tags,
                       boolean adminStatusEnabled, boolean fabricStatusUp) {
        this.uuid = uuid;
        this.displayName = displayName;
        this.tags = new ArrayList<>(tags);
        this.adminStatusEnabled = adminStatusEnabled;
        this.relations = new Relations(new PortStatus(fabricStatusUp));
        this.href = PATH_LSWITCH + "/" + switchUuid + "/" + PATH_LPORT + "/" + uuid;
    }

    @JsonIgnore
    public Optional<String> getLogicalPortId() {
        return Tags.find(tags, TAG_SCOPE_LOGICAL_PORT);
    }

    /**
     * Uuid of the switch owning this port, parsed from its href.
     */
    @JsonIgnore
    public String getSwitchUuid() {
        if (href == null) {
            return null;
        }
        String[] parts = href.split("/");
        for (int i = 0; i < parts.length - 1; i++) {
            if ("lswitch".equals(parts[i])) {
                return parts[i + 1];
            }
        }
        return null;
    }

    @JsonIgnore
    public boolean isFabricStatusUp() {
        return relations != null && relations.getPortStatus() != null
                && relations.getPortStatus().isFabricStatusUp();
    }

    public void setTags(List<BackendTag> tags) {
        this.tags = tags != null ? tags : new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Relations {
        @JsonProperty("LogicalPortStatus")
        private PortStatus portStatus;

        public Relations(PortStatus portStatus) {
            this.portStatus = portStatus;
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PortStatus {
        @JsonProperty("fabric_status_up")
        private boolean fabricStatusUp;

        public PortStatus(boolean fabricStatusUp) {
            this.fabricStatusUp = fabricStatusUp;
        }
    }
}
