package io.sdncontroller.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_CONTROLLER_ID = "network-controller";
    public static final int DEFAULT_MAX_LP_PER_OVERLAY_LS = 5000;
    public static final int DEFAULT_MAX_LP_PER_BRIDGED_LS = 64;
    public static final int DEFAULT_CONCURRENT_CONNECTIONS = 3;
    public static final int DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_RETRIES = 2;
    public static final int DEFAULT_REDIRECTS = 2;

    // Backend resource paths
    public static final String API_PREFIX = "/ws.v1";
    public static final String PATH_LOGIN = API_PREFIX + "/login";
    public static final String PATH_LSWITCH = API_PREFIX + "/lswitch";
    public static final String PATH_LPORT = "lport";
    public static final String PATH_ATTACHMENT = "attachment";
    public static final String PATH_STATUS = "status";
    public static final String WILDCARD_SWITCH = "*";

    // Backend query parameters
    public static final int QUERY_PAGE_LENGTH = 1000;
    public static final String PARAM_PAGE_LENGTH = "_page_length";
    public static final String PARAM_PAGE_CURSOR = "_page_cursor";
    public static final String RELATION_SWITCH_STATUS = "LogicalSwitchStatus";
    public static final String RELATION_PORT_STATUS = "LogicalPortStatus";
    public static final String SWITCH_QUERY_FIELDS = "uuid,display_name,fabric_status,tags";
    public static final String PORT_QUERY_FIELDS = "tags,admin_status_enabled,display_name,fabric_status_up";

    // Backend tag scopes
    public static final String TAG_SCOPE_TENANT = "tenant-id";
    public static final String TAG_SCOPE_NETWORK = "network-id";
    public static final String TAG_SCOPE_LOGICAL_PORT = "logical-port-id";
    public static final String TAG_SCOPE_DEVICE = "device-id";
    public static final String TAG_SCOPE_MULTI_SWITCH = "multi-switch";
    public static final String TAG_SCOPE_VERSION = "controller-version";
    public static final String CONTROLLER_VERSION = "1.0";

    // Backend attachment and transport types
    public static final String ATTACHMENT_VIF = "VifAttachment";
    public static final String TRANSPORT_TYPE_BRIDGE = "bridge";
    public static final String TRANSPORT_TYPE_OVERLAY = "stt";

    // Fragment switch naming: <network name>-ext-<fragment count>
    public static final String FRAGMENT_NAME_FORMAT = "%s-ext-%d";

    // Provider segmentation range
    public static final int MIN_SEGMENTATION_ID = 1;
    public static final int MAX_SEGMENTATION_ID = 4094;

    // Policy actions
    public static final String ACTION_PROVIDER_NETWORK_VIEW = "extension:provider_network:view";
    public static final String ACTION_PROVIDER_NETWORK_SET = "extension:provider_network:set";
    public static final String ACTION_PORT_SECURITY_CREATE = "create_port:port_security_enabled";
    public static final String ACTION_PORT_SECURITY_UPDATE = "update_port:port_security_enabled";
    public static final String ROLE_ADMIN = "admin";

    // Record filter fields
    public static final String FILTER_ID = "id";
    public static final String FILTER_TENANT_ID = "tenant_id";
    public static final String FILTER_NETWORK_ID = "network_id";
    public static final String FILTER_DEVICE_ID = "device_id";
    public static final String FILTER_NAME = "name";

    // MAC addresses handed out by the record store
    public static final String MAC_PREFIX = "fa:16:3e";
}
