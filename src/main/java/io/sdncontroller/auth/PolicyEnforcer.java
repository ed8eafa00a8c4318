package io.sdncontroller.auth;

import io.sdncontroller.exceptions.NotAuthorizedException;

/**
 * Authorization checks on actions against a resource owned by a tenant.
 */
public interface PolicyEnforcer {

    /**
     * @param ownerTenantId tenant owning the target resource, may be null
     * @return whether the caller may perform the action
     */
    boolean check(RequestContext context, String action, String ownerTenantId);

    /**
     * Same as {@link #check} but fails when the action is not allowed.
     */
    default void enforce(RequestContext context, String action, String ownerTenantId)
            throws NotAuthorizedException {
        if (!check(context, action, ownerTenantId)) {
            throw new NotAuthorizedException(action);
        }
    }
}
