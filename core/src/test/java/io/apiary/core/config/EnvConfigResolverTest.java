package io.apiary.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.apiary.core.error.ConfigurationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("EnvConfigResolver")
class EnvConfigResolverTest {

    @TempDir
    Path tempDir;

    private Path write(String name, String yaml) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    @DisplayName("Loading disabled → empty config")
    void disabledIsEmpty() {
        assertThat(EnvConfigResolver.resolve(false)).isSameAs(EnvConfig.EMPTY);
        assertThat(EnvConfig.EMPTY.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Missing settings file → environment only")
    void missingFileUsesEnvironment() {
        EnvConfig config = EnvConfigResolver.resolve(tempDir.resolve("absent.yaml"), Map.of("HTTP_PROXY", "http://p:3128"));

        assertThat(config.values()).containsExactly(Map.entry("HTTP_PROXY", "http://p:3128"));
    }

    @Test
    @DisplayName("Settings file values override environment values")
    void fileOverridesEnvironment() throws IOException {
        Path file = write("apiary.yaml", """
                DOMAINTOOLS_API_KEY: from-file
                IPQS_API_KEY: ipqs-key
                """);

        EnvConfig config = EnvConfigResolver.resolve(file,
                Map.of("DOMAINTOOLS_API_KEY", "from-env", "HOME", "/home/me"));

        assertThat(config.get("DOMAINTOOLS_API_KEY")).contains("from-file");
        assertThat(config.get("IPQS_API_KEY")).contains("ipqs-key");
        assertThat(config.get("HOME")).contains("/home/me");
    }

    @Test
    @DisplayName("Scalars are stringified, nested values are ignored")
    void scalarsOnly() throws IOException {
        Path file = write("apiary.yaml", """
                TIMEOUT: 30
                VERBOSE: true
                NESTED:
                  key: value
                LIST:
                  - a
                """);

        EnvConfig config = EnvConfigResolver.resolve(file, Map.of());

        assertThat(config.get("TIMEOUT")).contains("30");
        assertThat(config.get("VERBOSE")).contains("true");
        assertThat(config.get("NESTED")).isEmpty();
        assertThat(config.get("LIST")).isEmpty();
    }

    @Test
    @DisplayName("Empty settings file → environment only")
    void emptyFile() throws IOException {
        Path file = write("apiary.yaml", "");

        assertThat(EnvConfigResolver.resolve(file, Map.of("A", "1")).values()).containsOnlyKeys("A");
    }

    @Test
    @DisplayName("Malformed YAML → ConfigurationException naming the file")
    void malformedYaml() throws IOException {
        Path file = write("broken.yaml", "key: [unclosed\n");

        assertThatThrownBy(() -> EnvConfigResolver.resolve(file, Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("broken.yaml");
    }

    @Test
    @DisplayName("Non-mapping root → ConfigurationException")
    void nonMappingRoot() throws IOException {
        Path file = write("list.yaml", "- a\n- b\n");

        assertThatThrownBy(() -> EnvConfigResolver.resolve(file, Map.of()))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("key/value mapping");
    }

    @Nested
    @DisplayName("Settings file location")
    class ConfigPath {

        @Test
        @DisplayName("APIARY_CONFIG points at the file")
        void explicitPath() {
            Path path = EnvConfigResolver.resolveConfigPath(Map.of("APIARY_CONFIG", " /etc/apiary/settings.yaml "));

            assertThat(path).isEqualTo(Path.of("/etc/apiary/settings.yaml"));
        }

        @Test
        @DisplayName("Unset or blank → apiary.yaml in the working directory")
        void defaultPath() {
            assertThat(EnvConfigResolver.resolveConfigPath(Map.of())).isEqualTo(Path.of("apiary.yaml"));
            assertThat(EnvConfigResolver.resolveConfigPath(Map.of("APIARY_CONFIG", "  "))).isEqualTo(Path.of("apiary.yaml"));
        }
    }

    @Nested
    @DisplayName("EnvConfig lookups")
    class Lookups {

        @Test
        @DisplayName("Blank values count as absent")
        void blankIsAbsent() {
            EnvConfig config = new EnvConfig(Map.of("KEY", "  "));

            assertThat(config.get("KEY")).isEmpty();
        }

        @Test
        @DisplayName("getEitherCase prefers the literal key, then lowercase")
        void eitherCase() {
            assertThat(new EnvConfig(Map.of("http_proxy", "lower")).getEitherCase("HTTP_PROXY")).contains("lower");
            assertThat(new EnvConfig(Map.of("HTTP_PROXY", "upper", "http_proxy", "lower"))
                    .getEitherCase("HTTP_PROXY")).contains("upper");
        }
    }
}
