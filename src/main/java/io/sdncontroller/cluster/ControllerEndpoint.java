package io.sdncontroller.cluster;

import io.sdncontroller.exceptions.InvalidClusterConfigException;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.net.URI;

/**
 * Connection descriptor for one SDN controller of a cluster.
 */
@Value
@Builder
public class ControllerEndpoint {

    private static final int CONNECTION_FIELDS = 8;

    String address;
    int port;
    String user;
    @ToString.Exclude
    String password;
    int requestTimeout;
    int httpTimeout;
    int retries;
    int redirects;
    String defaultTzUuid;
    String clusterUuid;
    String zone;
    @Builder.Default
    boolean secure = true;

    public URI baseUri() {
        return URI.create((secure ? "https" : "http") + "://" + address + ":" + port);
    }

    /**
     * Parse a connection string of the form
     * {@code ip:port:user:password:request_timeout:http_timeout:retries:redirects}.
     * Timeouts are in seconds and must be positive.
     */
    public static ControllerEndpoint parse(String connection, String defaultTzUuid, String clusterUuid,
                                           String zone, boolean secure) throws InvalidClusterConfigException {
        if (connection == null || connection.isBlank()) {
            throw new InvalidClusterConfigException("Empty controller connection");
        }
        String[] args = connection.trim().split(":", -1);
        if (args.length != CONNECTION_FIELDS) {
            throw new InvalidClusterConfigException("Invalid connection parameters for controller "
                    + mask(connection) + ": expected " + CONNECTION_FIELDS + " fields, got " + args.length);
        }
        if (args[0].isBlank()) {
            throw new InvalidClusterConfigException("Missing address in controller connection " + mask(connection));
        }
        if (args[2].isBlank() || args[3].isBlank()) {
            throw new InvalidClusterConfigException("Missing credentials in controller connection " + mask(connection));
        }
        try {
            int port = Integer.parseInt(args[1].trim());
            if (port < 1 || port > 65535) {
                throw new InvalidClusterConfigException("Port out of range in controller connection " + mask(connection));
            }
            int requestTimeout = Integer.parseInt(args[4].trim());
            int httpTimeout = Integer.parseInt(args[5].trim());
            if (requestTimeout <= 0 || httpTimeout <= 0) {
                throw new InvalidClusterConfigException("Timeouts must be positive in controller connection "
                        + mask(connection));
            }
            int retries = Integer.parseInt(args[6].trim());
            int redirects = Integer.parseInt(args[7].trim());
            if (retries < 0 || redirects < 0) {
                throw new InvalidClusterConfigException("Retries and redirects must not be negative in controller "
                        + "connection " + mask(connection));
            }
            return ControllerEndpoint.builder()
                    .address(args[0].trim())
                    .port(port)
                    .user(args[2])
                    .password(args[3])
                    .requestTimeout(requestTimeout)
                    .httpTimeout(httpTimeout)
                    .retries(retries)
                    .redirects(redirects)
                    .defaultTzUuid(defaultTzUuid)
                    .clusterUuid(clusterUuid)
                    .zone(zone)
                    .secure(secure)
                    .build();
        } catch (NumberFormatException e) {
            throw new InvalidClusterConfigException("Invalid connection parameters for controller "
                    + mask(connection), e);
        }
    }

    /**
     * Connection string with the password field blanked out, for logs and errors.
     */
    static String mask(String connection) {
        String[] args = connection.split(":", -1);
        if (args.length < 4) {
            return connection;
        }
        args[3] = "****";
        return String.join(":", args);
    }
}
