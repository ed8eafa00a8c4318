package io.sdncontroller.backend;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A scope/value tag attached to a backend resource.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BackendTag {

    @JsonProperty("scope")
    private String scope;

    @JsonProperty("tag")
    private String tag;
}
