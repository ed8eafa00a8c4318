package io.sdncontroller.backend;

import com.google.common.io.BaseEncoding;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Optional;

import static io.sdncontroller.config.Constants.*;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Factories and lookups for the tags the controller puts on backend resources.
 */
public final class Tags {

    private Tags() {
        // Utility class
    }

    public static BackendTag tenant(String tenantId) {
        return new BackendTag(TAG_SCOPE_TENANT, tenantId);
    }

    public static BackendTag network(String networkId) {
        return new BackendTag(TAG_SCOPE_NETWORK, networkId);
    }

    public static BackendTag logicalPort(String portId) {
        return new BackendTag(TAG_SCOPE_LOGICAL_PORT, portId);
    }

    public static BackendTag device(String deviceId) {
        return new BackendTag(TAG_SCOPE_DEVICE, hashDeviceId(deviceId));
    }

    public static BackendTag multiSwitch() {
        return new BackendTag(TAG_SCOPE_MULTI_SWITCH, "True");
    }

    public static BackendTag version() {
        return new BackendTag(TAG_SCOPE_VERSION, CONTROLLER_VERSION);
    }

    /**
     * Device ids are stored as a SHA-1 hex digest to keep tag values short.
     */
    public static String hashDeviceId(String deviceId) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            byte[] hash = digest.digest((deviceId == null ? "" : deviceId).getBytes(UTF_8));
            return BaseEncoding.base16().lowerCase().encode(hash);
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-1
            throw new IllegalStateException("SHA-1 digest unavailable", e);
        }
    }

    public static Optional<String> find(Collection<BackendTag> tags, String scope) {
        if (tags == null) {
            return Optional.empty();
        }
        return tags.stream()
                .filter(t -> scope.equals(t.getScope()))
                .map(BackendTag::getTag)
                .findFirst();
    }
}
