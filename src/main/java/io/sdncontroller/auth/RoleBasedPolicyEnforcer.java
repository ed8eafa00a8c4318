package io.sdncontroller.auth;

import com.google.common.collect.ImmutableMap;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static io.sdncontroller.config.Constants.*;

/**
 * Policy with two rules: admin only, and admin or owner of the target.
 * Actions without a rule are allowed.
 */
@Slf4j
public class RoleBasedPolicyEnforcer implements PolicyEnforcer {

    enum Rule {
        ADMIN_ONLY,
        ADMIN_OR_OWNER
    }

    private static final Map<String, Rule> DEFAULT_RULES = ImmutableMap.of(
            ACTION_PROVIDER_NETWORK_VIEW, Rule.ADMIN_ONLY,
            ACTION_PROVIDER_NETWORK_SET, Rule.ADMIN_ONLY,
            ACTION_PORT_SECURITY_CREATE, Rule.ADMIN_OR_OWNER,
            ACTION_PORT_SECURITY_UPDATE, Rule.ADMIN_OR_OWNER);

    private final Map<String, Rule> rules;

    public RoleBasedPolicyEnforcer() {
        this(DEFAULT_RULES);
    }

    RoleBasedPolicyEnforcer(Map<String, Rule> rules) {
        this.rules = ImmutableMap.copyOf(rules);
    }

    @Override
    public boolean check(RequestContext context, String action, String ownerTenantId) {
        Rule rule = rules.get(action);
        if (rule == null) {
            return true;
        }
        boolean admin = context.isAdmin() || context.hasRole(ROLE_ADMIN);
        boolean allowed;
        switch (rule) {
            case ADMIN_ONLY:
                allowed = admin;
                break;
            case ADMIN_OR_OWNER:
                allowed = admin || (ownerTenantId != null && ownerTenantId.equals(context.getTenantId()));
                break;
            default:
                allowed = false;
        }
        if (!allowed) {
            log.debug("Policy denied {} for tenant {}", action, context.getTenantId());
        }
        return allowed;
    }
}
