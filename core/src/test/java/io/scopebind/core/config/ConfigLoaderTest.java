package io.scopebind.core.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader}: YAML mapping from classpath fixtures, defaults for missing
 * keys, the environment variable overlay and the error paths.
 */
class ConfigLoaderTest {

    private static final Function<String, String> NO_ENV = name -> null;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    @Nested
    @DisplayName("YAML mapping")
    class YamlMapping {

        @Test
        void fullConfigPopulatesEveryField() throws Exception {
            BindingsConfig config = ConfigLoader.load(fixture("full.yaml"), NO_ENV);

            assertThat(config.collectionComponent()).isEqualTo("app:repeater");
            assertThat(config.maxExpressionLength()).isEqualTo(2000);
            assertThat(config.maxNestingDepth()).isEqualTo(16);
            assertThat(config.effectCalls()).containsExactlyInAnyOrder("setState", "navigate");
        }

        @Test
        void partialConfigKeepsDefaults() throws Exception {
            BindingsConfig config = ConfigLoader.load(fixture("partial.yaml"), NO_ENV);

            assertThat(config.maxNestingDepth()).isEqualTo(8);
            assertThat(config.collectionComponent()).isEqualTo(BindingsConfig.DEFAULT.collectionComponent());
            assertThat(config.maxExpressionLength()).isEqualTo(BindingsConfig.DEFAULT.maxExpressionLength());
            assertThat(config.effectCalls()).isEmpty();
        }

        @Test
        void emptyFileYieldsDefaults(@TempDir Path dir) throws Exception {
            Path empty = Files.writeString(dir.resolve("empty.yaml"), "");

            assertThat(ConfigLoader.load(empty, NO_ENV)).isEqualTo(BindingsConfig.DEFAULT);
        }

        @Test
        void classpathDefaultMatchesBuiltInDefaults() {
            assertThat(ConfigLoader.loadDefault(NO_ENV)).isEqualTo(BindingsConfig.DEFAULT);
        }
    }

    @Nested
    @DisplayName("Environment overlay")
    class EnvironmentOverlay {

        @Test
        void envOverridesYaml() throws Exception {
            Map<String, String> env = Map.of(
                    "SCOPEBIND_COLLECTION_COMPONENT", " ui:list ",
                    "SCOPEBIND_EXPRESSION_MAX_DEPTH", "4",
                    "SCOPEBIND_EFFECT_CALLS", "setState, ,openModal");

            BindingsConfig config = ConfigLoader.load(fixture("full.yaml"), env::get);

            assertThat(config.collectionComponent()).isEqualTo("ui:list");
            assertThat(config.maxNestingDepth()).isEqualTo(4);
            assertThat(config.maxExpressionLength()).isEqualTo(2000);
            assertThat(config.effectCalls()).containsExactlyInAnyOrder("setState", "openModal");
        }

        @Test
        void blankEnvValuesAreIgnored() throws Exception {
            Map<String, String> env = Map.of("SCOPEBIND_EXPRESSION_MAX_LENGTH", "   ");

            assertThat(ConfigLoader.load(fixture("full.yaml"), env::get).maxExpressionLength())
                    .isEqualTo(2000);
        }

        @Test
        void envAppliesWithoutConfigFile() {
            Map<String, String> env = Map.of("SCOPEBIND_EXPRESSION_MAX_LENGTH", "500");

            assertThat(ConfigLoader.loadDefault(env::get).maxExpressionLength()).isEqualTo(500);
        }

        @Test
        void nonIntegerEnvValueIsRejected() throws Exception {
            Map<String, String> env = Map.of("SCOPEBIND_EXPRESSION_MAX_DEPTH", "deep");

            assertThatThrownBy(() -> ConfigLoader.load(fixture("full.yaml"), env::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("SCOPEBIND_EXPRESSION_MAX_DEPTH must be an integer");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void missingFileIsRejected(@TempDir Path dir) {
            Path missing = dir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessage("Configuration file not found: " + missing);
        }

        @Test
        void invalidYamlIsRejected() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("invalid.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Failed to parse YAML configuration");
        }

        @Test
        void outOfRangeValueIsRejected() throws Exception {
            assertThatThrownBy(() -> ConfigLoader.load(fixture("bad-value.yaml"), NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Invalid configuration")
                    .hasMessageContaining("maxLength must be positive")
                    .hasCauseInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void scalarRootIsRejected(@TempDir Path dir) throws Exception {
            Path scalar = Files.writeString(dir.resolve("scalar.yaml"), "just text\n");

            assertThatThrownBy(() -> ConfigLoader.load(scalar, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageStartingWith("Configuration root must be a mapping");
        }

        @Test
        void effectCallsMustBeAList(@TempDir Path dir) throws Exception {
            Path file = Files.writeString(dir.resolve("calls.yaml"), "expressions:\n  effect-calls: setState\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("expressions.effect-calls must be a list");
        }

        @Test
        void fractionalNumberIsRejected(@TempDir Path dir) throws Exception {
            Path file = Files.writeString(dir.resolve("depth.yaml"), "expressions:\n  max-depth: 2.5\n");

            assertThatThrownBy(() -> ConfigLoader.load(file, NO_ENV))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("max-depth must be an integer");
        }
    }
}
