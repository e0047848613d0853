package fr.lapetina.streamflow.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads {@link FlowSettings} from YAML.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Loading from an arbitrary stream
 * - Empty documents, which yield the defaults
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final AtomicReference<FlowSettings> currentConfig = new AtomicReference<>();
    private final Path configPath;
    private final LoaderOptions loaderOptions = new LoaderOptions();

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public FlowSettings load() {
        FlowSettings config = loadFromPath();
        currentConfig.set(config);
        return config;
    }

    private FlowSettings loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private FlowSettings loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public FlowSettings loadFromStream(InputStream inputStream) {
        FlowSettings config = parse(inputStream, "stream");
        currentConfig.set(config);
        return config;
    }

    private FlowSettings parse(InputStream is, String source) {
        try {
            // Yaml instances are not thread-safe
            Yaml yaml = new Yaml(new Constructor(FlowSettings.class, loaderOptions));
            FlowSettings config = yaml.load(is);
            return config != null ? config : createDefault();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the last loaded configuration, or null before the first load.
     */
    public FlowSettings getCurrentConfig() {
        return currentConfig.get();
    }

    /**
     * Creates a default configuration.
     */
    public static FlowSettings createDefault() {
        return new FlowSettings();
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
