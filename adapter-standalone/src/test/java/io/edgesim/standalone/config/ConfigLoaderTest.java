package io.edgesim.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader}: YAML mapping, defaults, the {@code EDGE_*}
 * overlay and error paths.
 */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    @TempDir
    Path tempDir;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class.getClassLoader().getResource(name).toURI());
    }

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("edge-sim.yaml");
        Files.writeString(file, yaml);
        return file;
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        @DisplayName("Minimal config → every default applied")
        void minimalConfig_allDefaults() throws Exception {
            EdgeConfig config = ConfigLoader.load(fixture("config/minimal-config.yaml"), NO_ENV::get);

            assertThat(config.host()).isEqualTo("0.0.0.0");
            assertThat(config.port()).isEqualTo(8080);
            assertThat(config.cacheDir()).isEqualTo(EdgeConfig.DEFAULT_CACHE_DIR);
            assertThat(config.cacheKeyHeaders()).isEmpty();
            assertThat(config.originConnectTimeoutMs()).isEqualTo(5000);
            assertThat(config.originReadTimeoutMs()).isEqualTo(30000);
            assertThat(config.distributionDomainName()).isEqualTo("d111111abcdef8.cloudfront.net");
            assertThat(config.distributionId()).isEqualTo("EDFDVBD6EXAMPLE");
            assertThat(config.behaviors()).isEmpty();
            assertThat(config.origins()).isEmpty();
            assertThat(config.strictRegistration()).isFalse();
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
            assertThat(config.adminReloadPath()).isEqualTo("/__edge/reload");
        }

        @Test
        @DisplayName("Empty file → defaults, no error")
        void emptyFile_defaults() throws Exception {
            EdgeConfig config = ConfigLoader.load(write(""), NO_ENV::get);

            assertThat(config.port()).isEqualTo(8080);
            assertThat(config.behaviors()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Full config")
    class FullConfig {

        @Test
        @DisplayName("Every section mapped")
        void fullConfig_allFieldsPopulated() throws Exception {
            EdgeConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), NO_ENV::get);

            assertThat(config.host()).isEqualTo("127.0.0.1");
            assertThat(config.port()).isEqualTo(9191);
            assertThat(config.cacheDir()).isEqualTo("/tmp/edge-sim-test-cache");
            assertThat(config.cacheKeyHeaders()).containsExactly("Accept", "Accept-Language");
            assertThat(config.originConnectTimeoutMs()).isEqualTo(1500);
            assertThat(config.originReadTimeoutMs()).isEqualTo(2500);
            assertThat(config.distributionDomainName()).isEqualTo("dtest.cloudfront.net");
            assertThat(config.distributionId()).isEqualTo("ETEST");
            assertThat(config.strictRegistration()).isTrue();
            assertThat(config.loggingFormat()).isEqualTo("json");
            assertThat(config.loggingLevel()).isEqualTo("DEBUG");
            assertThat(config.adminReloadPath()).isEqualTo("/admin/reload");
        }

        @Test
        @DisplayName("Behaviors keep file order; missing pattern defaults to *")
        void behaviors_inOrderWithDefaultPattern() throws Exception {
            EdgeConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), NO_ENV::get);

            assertThat(config.behaviors())
                    .containsExactly(
                            new BehaviorConfig(
                                    "/hello", "viewer-request", "io.edgesim.standalone.fixtures.HelloHandler"),
                            new BehaviorConfig("*", "viewer-response", "io.edgesim.standalone.fixtures.StampHandler"));
        }

        @Test
        @DisplayName("Origins carry the default flag")
        void origins_defaultFlag() throws Exception {
            EdgeConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), NO_ENV::get);

            assertThat(config.origins())
                    .containsExactly(
                            new OriginMapping("/api/*", "http://localhost:3000", false),
                            new OriginMapping("/static/*", "http://localhost:4000", true));
        }

        @Test
        @DisplayName("key-headers accepts a comma-separated string")
        void keyHeaders_commaString() throws IOException {
            EdgeConfig config = ConfigLoader.load(write("""
                    cache:
                      key-headers: "Accept, X-Device ,"
                    """), NO_ENV::get);

            assertThat(config.cacheKeyHeaders()).containsExactly("Accept", "X-Device");
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvOverlay {

        @Test
        @DisplayName("EDGE_* variables override YAML values")
        void envOverridesYaml() throws Exception {
            Map<String, String> env = new HashMap<>();
            env.put("EDGE_HOST", "10.0.0.1");
            env.put("EDGE_PORT", "0");
            env.put("EDGE_CACHE_DIR", "/var/cache/edge");
            env.put("EDGE_CACHE_KEY_HEADERS", "Authorization,Accept");
            env.put("EDGE_ORIGIN_CONNECT_TIMEOUT_MS", "100");
            env.put("EDGE_ORIGIN_READ_TIMEOUT_MS", "200");
            env.put("EDGE_DISTRIBUTION_DOMAIN_NAME", "denv.cloudfront.net");
            env.put("EDGE_DISTRIBUTION_ID", "EENV");
            env.put("EDGE_REGISTRATION_STRICT", "false");
            env.put("EDGE_LOG_FORMAT", "text");
            env.put("EDGE_LOG_LEVEL", "WARN");
            env.put("EDGE_ADMIN_RELOAD_PATH", "/_reload");

            EdgeConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), env::get);

            assertThat(config.host()).isEqualTo("10.0.0.1");
            assertThat(config.port()).isZero();
            assertThat(config.cacheDir()).isEqualTo("/var/cache/edge");
            assertThat(config.cacheKeyHeaders()).containsExactly("Authorization", "Accept");
            assertThat(config.originConnectTimeoutMs()).isEqualTo(100);
            assertThat(config.originReadTimeoutMs()).isEqualTo(200);
            assertThat(config.distributionDomainName()).isEqualTo("denv.cloudfront.net");
            assertThat(config.distributionId()).isEqualTo("EENV");
            assertThat(config.strictRegistration()).isFalse();
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("WARN");
            assertThat(config.adminReloadPath()).isEqualTo("/_reload");
            // behaviors have no env override
            assertThat(config.behaviors()).hasSize(2);
        }

        @Test
        @DisplayName("Blank variables are treated as unset")
        void blankEnv_ignored() throws Exception {
            Map<String, String> env = Map.of("EDGE_PORT", "   ", "EDGE_HOST", "");

            EdgeConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), env::get);

            assertThat(config.port()).isEqualTo(9191);
            assertThat(config.host()).isEqualTo("127.0.0.1");
        }

        @Test
        @DisplayName("Non-integer EDGE_PORT → ConfigLoadException naming the variable")
        void badIntEnv_throws() throws Exception {
            Path config = fixture("config/minimal-config.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(config, Map.of("EDGE_PORT", "http")::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("EDGE_PORT")
                    .hasMessageContaining("http");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Missing file → ConfigLoadException with --config hint")
        void missingFile_throws() {
            Path missing = tempDir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found")
                    .hasMessageContaining("--config");
        }

        @Test
        @DisplayName("Malformed YAML → parse error")
        void invalidYaml_throws() throws IOException {
            Path file = write("server:\n  port: [unclosed\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        @DisplayName("Scalar root → rejected")
        void scalarRoot_throws() throws IOException {
            Path file = write("just a string\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("must be a mapping");
        }

        @Test
        @DisplayName("Behavior without event-type → indexed error")
        void behaviorMissingEventType_throws() throws IOException {
            Path file = write("""
                    behaviors:
                      - pattern: /a
                        event-type: viewer-request
                        handler: com.example.A
                      - pattern: /b
                        handler: com.example.B
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("behaviors[1] is missing 'event-type'");
        }

        @Test
        @DisplayName("Origin without target → indexed error")
        void originMissingTarget_throws() throws IOException {
            Path file = write("""
                    origins:
                      - path-pattern: /api/*
                    """);

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("origins[0] is missing 'target'");
        }

        @Test
        @DisplayName("Port out of range → rejected")
        void portOutOfRange_throws() throws IOException {
            Path file = write("server:\n  port: 70000\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("server.port");
        }

        @Test
        @DisplayName("Reload path without leading slash → rejected")
        void relativeReloadPath_throws() throws IOException {
            Path file = write("admin:\n  reload-path: reload\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("admin.reload-path");
        }
    }

    @Nested
    @DisplayName("Config path resolution")
    class ResolvePath {

        @Test
        void noArgs_defaultFile() {
            assertThat(ConfigLoader.resolveConfigPath(new String[0])).isEqualTo(Path.of("edge-sim.yaml"));
        }

        @Test
        void configFlag_usesFollowingArgument() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--verbose", "--config", "/etc/edge.yaml"}))
                    .isEqualTo(Path.of("/etc/edge.yaml"));
        }

        @Test
        void configFlagWithoutValue_throws() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("--config");
        }
    }

    @Test
    @DisplayName("Lists in the built config are immutable")
    void builtConfig_immutableLists() throws Exception {
        EdgeConfig config = ConfigLoader.load(fixture("config/full-config.yaml"), NO_ENV::get);

        assertThatThrownBy(() -> config.behaviors().add(new BehaviorConfig("*", "viewer-request", "x")))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
