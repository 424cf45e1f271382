package io.edgesim.standalone.config;

import java.nio.file.Path;
import java.util.List;

/**
 * Root configuration for the standalone edge simulator.
 *
 * <p>
 * Every field has a default; an empty YAML file yields a working server with
 * no behaviors and no origins. Use {@link #builder()} to construct instances.
 *
 * @param host                   bind address for the HTTP server
 * @param port                   listen port, {@code 0} for an ephemeral port
 * @param cacheDir               directory of the durable response cache
 * @param cacheKeyHeaders        request headers included in the cache fingerprint
 * @param originConnectTimeoutMs TCP connect timeout for origin fetches
 * @param originReadTimeoutMs    response timeout for origin fetches
 * @param distributionDomainName simulated distribution domain handed to handlers
 * @param distributionId         simulated distribution id handed to handlers
 * @param behaviors              handler registrations, in file order
 * @param origins                origin map, in file order
 * @param strictRegistration     reject duplicate (pattern, stage) registrations
 * @param loggingFormat          {@code text} or {@code json}
 * @param loggingLevel           root log level
 * @param adminReloadPath        path of the {@code POST} reload endpoint
 */
public record EdgeConfig(
        String host,
        int port,
        String cacheDir,
        List<String> cacheKeyHeaders,
        int originConnectTimeoutMs,
        int originReadTimeoutMs,
        String distributionDomainName,
        String distributionId,
        List<BehaviorConfig> behaviors,
        List<OriginMapping> origins,
        boolean strictRegistration,
        String loggingFormat,
        String loggingLevel,
        String adminReloadPath) {

    /** Default cache directory: {@code <java.io.tmpdir>/edge-sim}. */
    public static final String DEFAULT_CACHE_DIR =
            Path.of(System.getProperty("java.io.tmpdir"), "edge-sim").toString();

    public EdgeConfig {
        cacheKeyHeaders = List.copyOf(cacheKeyHeaders);
        behaviors = List.copyOf(behaviors);
        origins = List.copyOf(origins);
    }

    /** Creates a new builder with defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link EdgeConfig}. */
    public static final class Builder {
        private String host = "0.0.0.0";
        private int port = 8080;
        private String cacheDir = DEFAULT_CACHE_DIR;
        private List<String> cacheKeyHeaders = List.of();
        private int originConnectTimeoutMs = 5000;
        private int originReadTimeoutMs = 30000;
        private String distributionDomainName = "d111111abcdef8.cloudfront.net";
        private String distributionId = "EDFDVBD6EXAMPLE";
        private List<BehaviorConfig> behaviors = List.of();
        private List<OriginMapping> origins = List.of();
        private boolean strictRegistration;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";
        private String adminReloadPath = "/__edge/reload";

        Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder cacheDir(String cacheDir) {
            this.cacheDir = cacheDir;
            return this;
        }

        public Builder cacheKeyHeaders(List<String> cacheKeyHeaders) {
            this.cacheKeyHeaders = cacheKeyHeaders;
            return this;
        }

        public Builder originConnectTimeoutMs(int originConnectTimeoutMs) {
            this.originConnectTimeoutMs = originConnectTimeoutMs;
            return this;
        }

        public Builder originReadTimeoutMs(int originReadTimeoutMs) {
            this.originReadTimeoutMs = originReadTimeoutMs;
            return this;
        }

        public Builder distributionDomainName(String distributionDomainName) {
            this.distributionDomainName = distributionDomainName;
            return this;
        }

        public Builder distributionId(String distributionId) {
            this.distributionId = distributionId;
            return this;
        }

        public Builder behaviors(List<BehaviorConfig> behaviors) {
            this.behaviors = behaviors;
            return this;
        }

        public Builder origins(List<OriginMapping> origins) {
            this.origins = origins;
            return this;
        }

        public Builder strictRegistration(boolean strictRegistration) {
            this.strictRegistration = strictRegistration;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public Builder adminReloadPath(String adminReloadPath) {
            this.adminReloadPath = adminReloadPath;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if a timeout or the port is out of range
         */
        public EdgeConfig build() {
            if (port < 0 || port > 65535) {
                throw new ConfigLoadException("server.port must be between 0 and 65535, got " + port);
            }
            if (originConnectTimeoutMs <= 0 || originReadTimeoutMs <= 0) {
                throw new ConfigLoadException("Origin timeouts must be positive: connect-timeout-ms="
                        + originConnectTimeoutMs + ", read-timeout-ms=" + originReadTimeoutMs);
            }
            if (adminReloadPath == null || !adminReloadPath.startsWith("/")) {
                throw new ConfigLoadException("admin.reload-path must start with '/', got " + adminReloadPath);
            }
            return new EdgeConfig(
                    host,
                    port,
                    cacheDir,
                    cacheKeyHeaders,
                    originConnectTimeoutMs,
                    originReadTimeoutMs,
                    distributionDomainName,
                    distributionId,
                    behaviors,
                    origins,
                    strictRegistration,
                    loggingFormat,
                    loggingLevel,
                    adminReloadPath);
        }
    }
}
