package com.patternsentinel.core.config;

import com.patternsentinel.core.model.AnomalyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for {@link EngineConfigLoader}.
 */
class EngineConfigLoaderTest {

    @Test
    @DisplayName("Should load overrides from classpath and keep defaults for omitted keys")
    void shouldLoadFromClasspath() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.getMaxHistory()).isEqualTo(500);
        assertThat(config.getRegistryCapacity()).isEqualTo(20);
        assertThat(config.getMinPointsBasic()).isEqualTo(10);
        assertThat(config.getInfoZ()).isEqualTo(1.5);
        assertThat(config.getWarningZ()).isEqualTo(3.0);
        assertThat(config.getDriftWindow()).isEqualTo(24);
        assertThat(config.getDetectionIntervalSeconds()).isEqualTo(60);
    }

    @Test
    @DisplayName("Should normalise detector ids and enable only the listed detectors")
    void shouldEnableListedDetectors() {
        EngineConfig config = EngineConfigLoader.fromClasspath("test-engine.yml");

        assertThat(config.getDetectors()).containsExactly("spike", "flatline");
        assertThat(config.isDetectorEnabled(AnomalyType.SPIKE)).isTrue();
        assertThat(config.isDetectorEnabled(AnomalyType.FLATLINE)).isTrue();
        assertThat(config.isDetectorEnabled(AnomalyType.CORRELATION)).isFalse();
    }

    @Test
    @DisplayName("Bundled engine.yml should match the built-in defaults")
    void bundledConfigShouldMatchDefaults() {
        EngineConfig bundled = EngineConfigLoader.fromClasspath(EngineConfigLoader.DEFAULT_RESOURCE);
        EngineConfig defaults = new EngineConfig();

        assertThat(bundled.getMaxHistory()).isEqualTo(defaults.getMaxHistory());
        assertThat(bundled.getRegistryCapacity()).isEqualTo(defaults.getRegistryCapacity());
        assertThat(bundled.getMinPointsSeasonal()).isEqualTo(defaults.getMinPointsSeasonal());
        assertThat(bundled.getCorrelationBreakThreshold()).isEqualTo(defaults.getCorrelationBreakThreshold());
        assertThat(bundled.getDetectors()).containsExactlyElementsOf(defaults.getDetectors());
    }

    @Test
    @DisplayName("Should fall back to defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        EngineConfig config = EngineConfigLoader.fromClasspath("empty-engine.yml");

        assertThat(config.getMaxHistory()).isEqualTo(2016);
        assertThat(config.getRegistryCapacity()).isEqualTo(500);
        assertThat(config.getDetectors()).hasSize(AnomalyType.values().length);
    }

    @Test
    @DisplayName("Should report every violation of an invalid document at once")
    void shouldRejectInvalidDocument() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("invalid-engine.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("maxHistory")
                .hasMessageContaining("z thresholds")
                .hasMessageContaining("teleport");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> EngineConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("engine.yml");
        Files.writeString(file, "maxHistory: 100\nflatlineThreshold: 6\n");

        EngineConfig config = EngineConfigLoader.fromFile(file.toString());

        assertThat(config.getMaxHistory()).isEqualTo(100);
        assertThat(config.getFlatlineThreshold()).isEqualTo(6);
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        String missing = dir.resolve("missing.yml").toString();
        assertThatThrownBy(() -> EngineConfigLoader.fromFile(missing))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject duplicate keys")
    void shouldRejectDuplicateKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("dup.yml");
        Files.writeString(file, "maxHistory: 100\nmaxHistory: 200\n");

        assertThatThrownBy(() -> EngineConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed engine settings")
                .hasMessageContaining("dup.yml");
    }

    @Test
    @DisplayName("Should name the source when a key is unknown")
    void shouldRejectUnknownKeyWithOrigin(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("typo.yml");
        Files.writeString(file, "maxHistroy: 100\n");

        assertThatThrownBy(() -> EngineConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("typo.yml")
                .hasMessageContaining("maxHistroy");
    }

    @Test
    @DisplayName("Should resolve the bundled settings when no path is configured")
    void loadShouldUseBundledResource() {
        assumeTrue(System.getenv(EngineConfigLoader.ENV_CONFIG_PATH) == null);

        EngineConfig config = EngineConfigLoader.load();

        assertThat(config.getMaxHistory()).isEqualTo(new EngineConfig().getMaxHistory());
    }
}
