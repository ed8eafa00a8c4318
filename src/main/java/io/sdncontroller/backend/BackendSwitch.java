package io.sdncontroller.backend;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.sdncontroller.config.Constants.TAG_SCOPE_MULTI_SWITCH;
import static io.sdncontroller.config.Constants.TAG_SCOPE_NETWORK;

/**
 * Logical switch as observed on the backend. The primary switch of a network
 * has the network's id as uuid; fragments carry the network id as a tag.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BackendSwitch {

    @JsonProperty("uuid")
    private String uuid;

    @JsonProperty("display_name")
    private String displayName;

    @JsonProperty("tags")
    private List<BackendTag> tags = new ArrayList<>();

    @JsonProperty("_relations")
    private Relations relations;

    public BackendSwitch(String uuid, String displayName, List<BackendTag> tags, boolean fabricStatus, int portCount) {
        this.uuid = uuid;
        this.displayName = displayName;
        this.tags = new ArrayList<>(tags);
        this.relations = new Relations(new SwitchStatus(fabricStatus, portCount));
    }

    @JsonIgnore
    public Optional<String> getTag(String scope) {
        return Tags.find(tags, scope);
    }

    @JsonIgnore
    public boolean isMultiSwitch() {
        return getTag(TAG_SCOPE_MULTI_SWITCH).isPresent();
    }

    /**
     * Id of the network this switch belongs to: the fragment tag when present, else its own uuid.
     */
    @JsonIgnore
    public String getNetworkId() {
        return getTag(TAG_SCOPE_NETWORK).orElse(uuid);
    }

    @JsonIgnore
    public boolean isFabricUp() {
        return relations != null && relations.getSwitchStatus() != null
                && relations.getSwitchStatus().isFabricStatus();
    }

    @JsonIgnore
    public int getPortCount() {
        return relations != null && relations.getSwitchStatus() != null
                ? relations.getSwitchStatus().getLportCount() : 0;
    }

    public void setTags(List<BackendTag> tags) {
        this.tags = tags != null ? tags : new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Relations {
        @JsonProperty("LogicalSwitchStatus")
        private SwitchStatus switchStatus;

        public Relations(SwitchStatus switchStatus) {
            this.switchStatus = switchStatus;
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SwitchStatus {
        @JsonProperty("fabric_status")
        private boolean fabricStatus;

        @JsonProperty("lport_count")
        private int lportCount;

        public SwitchStatus(boolean fabricStatus, int lportCount) {
            this.fabricStatus = fabricStatus;
            this.lportCount = lportCount;
        }
    }
}
