package io.sdncontroller.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static io.sdncontroller.config.Constants.*;

/**
 * Configuration for the network controller.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * Cluster sections are kept as read from YAML; they are validated when the
 * {@link io.sdncontroller.cluster.ClusterRegistry} is built from them.
 */
@Slf4j
@Getter
public class NetworkControllerConfig {

    private final String controllerId;
    private final int maxLpPerOverlayLs;
    private final int maxLpPerBridgedLs;
    private final int concurrentConnections;
    private final String defaultClusterName;
    private final boolean strictConsistency;
    private final List<ClusterSection> clusters;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "NETWORK_CONTROLLER_CONFIG_FILE";

    public NetworkControllerConfig() {
        this(System.getenv(EXTERNAL_CONFIG_ENV_VAR));
    }

    public NetworkControllerConfig(String externalConfigPath) {
        ConfigModel config = loadYamlConfig(externalConfigPath);

        this.controllerId = parseControllerId(config);
        this.maxLpPerOverlayLs = parsePositive(controllerSection(config).getMax_lp_per_overlay_ls(),
                "max_lp_per_overlay_ls", DEFAULT_MAX_LP_PER_OVERLAY_LS);
        this.maxLpPerBridgedLs = parsePositive(controllerSection(config).getMax_lp_per_bridged_ls(),
                "max_lp_per_bridged_ls", DEFAULT_MAX_LP_PER_BRIDGED_LS);
        this.concurrentConnections = parsePositive(controllerSection(config).getConcurrent_connections(),
                "concurrent_connections", DEFAULT_CONCURRENT_CONNECTIONS);
        this.defaultClusterName = blankToNull(controllerSection(config).getDefault_cluster_name());
        this.strictConsistency = Boolean.TRUE.equals(controllerSection(config).getStrict_consistency());
        this.clusters = config.getClusters() != null ? List.copyOf(config.getClusters()) : List.of();

        log.info("Loaded network controller config - {} cluster(s), default cluster: {}, "
                + "max ports overlay/bridged: {}/{}", clusters.size(), defaultClusterName,
                maxLpPerOverlayLs, maxLpPerBridgedLs);
    }

    private ConfigModel loadYamlConfig(String externalConfigPath) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check for an external config file path
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified: {}", externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try {
            ConfigModel config = yaml.load(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }

    private static ControllerSection controllerSection(ConfigModel config) {
        return config.getController() != null ? config.getController() : new ControllerSection();
    }

    private String parseControllerId(ConfigModel config) {
        String id = blankToNull(controllerSection(config).getId());
        return id != null ? id : DEFAULT_CONTROLLER_ID;
    }

    private int parsePositive(Integer value, String key, int defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            log.warn("Ignoring non-positive value {} for {}, using default {}", value, key, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private ControllerSection controller;
        private List<ClusterSection> clusters;
    }

    @Data
    public static class ControllerSection {
        private String id;
        private Integer max_lp_per_overlay_ls;
        private Integer max_lp_per_bridged_ls;
        private Integer concurrent_connections;
        private String default_cluster_name;
        private Boolean strict_consistency;
    }

    /**
     * One named controller cluster. Each controller connection is
     * {@code ip:port:user:password:request_timeout:http_timeout:retries:redirects}.
     */
    @Data
    public static class ClusterSection {
        private String name;
        private String default_tz_uuid;
        private String cluster_uuid;
        private String zone_id;
        private Boolean use_https;
        private List<String> controller_connection = new ArrayList<>();
    }
}
