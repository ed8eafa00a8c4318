package io.sdncontroller.auth;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

import static io.sdncontroller.config.Constants.ROLE_ADMIN;

/**
 * Caller identity for one API request.
 */
@Value
@Builder
public class RequestContext {

    String tenantId;
    boolean admin;
    @Singular
    Set<String> roles;

    public static RequestContext admin() {
        return RequestContext.builder().admin(true).role(ROLE_ADMIN).build();
    }

    public static RequestContext tenant(String tenantId) {
        return RequestContext.builder().tenantId(tenantId).build();
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
