package fr.lapetina.streamflow.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static ByteArrayInputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load settings from the classpath")
    void shouldLoadFromClasspath() {
        ConfigLoader loader = new ConfigLoader("test-config.yaml");

        FlowSettings settings = loader.load();

        assertThat(settings.getFlow().getMaxConcurrent()).isEqualTo(8);
        assertThat(settings.getFlow().getCpuMultiplier()).isEqualTo(50);
        assertThat(settings.getRetry().getMaxAttempts()).isEqualTo(2);
        assertThat(settings.getRetry().getBackoffMultiplier()).isEqualTo(1.5);
        assertThat(settings.getCircuitBreaker().getFailureThreshold()).isEqualTo(2);
        assertThat(settings.getBatch().getSeparator()).isEqualTo("|");
        assertThat(settings.getMetrics().isEnabled()).isFalse();
        assertThat(loader.getCurrentConfig()).isSameAs(settings);
    }

    @Test
    @DisplayName("should prefer a file on disk")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("flow.yaml");
        Files.writeString(file, "rateLimit:\n  rate: 42\n  perMs: 500\n");

        FlowSettings settings = new ConfigLoader(file.toString()).load();

        assertThat(settings.getRateLimit().getRate()).isEqualTo(42);
        assertThat(settings.getRateLimit().getPerMs()).isEqualTo(500);
        assertThat(settings.getRetry().getMaxAttempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("should ship defaults in the bundled configuration")
    void shouldLoadBundledDefaults() {
        FlowSettings bundled = new ConfigLoader("stream-flow.yaml").load();
        FlowSettings defaults = ConfigLoader.createDefault();

        assertThat(bundled.getBatch().getSeparator()).isEqualTo(defaults.getBatch().getSeparator());
        assertThat(bundled.getCache().getTtlMs()).isEqualTo(defaults.getCache().getTtlMs());
        assertThat(bundled.getMetrics().getPrefix()).isEqualTo("stream_flow");
    }

    @Test
    @DisplayName("should return defaults for an empty document")
    void shouldDefaultOnEmptyDocument() {
        FlowSettings settings = new ConfigLoader("unused.yaml").loadFromStream(yaml(""));

        assertThat(settings.getRetry().getMaxAttempts()).isEqualTo(3);
        assertThat(settings.getCache().getTtlMs()).isEqualTo(3_600_000L);
        assertThat(settings.getFlow().getMaxConcurrent()).isZero();
    }

    @Test
    @DisplayName("should reject unknown properties and missing files")
    void shouldRejectInvalidConfiguration() {
        ConfigLoader loader = new ConfigLoader("does-not-exist.yaml");

        assertThatThrownBy(() -> loader.loadFromStream(yaml("retry:\n  attempts: 3\n")))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("Invalid configuration");
        assertThatThrownBy(loader::load)
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }
}
