package fr.lapetina.streamflow.flow.convert;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;

import java.io.ByteArrayInputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Map;

/**
 * YAML converters backed by SnakeYAML. Output types are loaded as JavaBeans.
 */
public class YamlConverter {

    private final LoaderOptions loaderOptions;
    private final DumperOptions dumperOptions;

    public YamlConverter() {
        this.loaderOptions = new LoaderOptions();
        this.dumperOptions = new DumperOptions();
        this.dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    }

    public InputConverter input(Object value) {
        return () -> {
            Yaml yaml = new Yaml(dumperOptions);
            // Beans are dumped as plain maps so loading them back needs no global tag
            String text = isBean(value)
                    ? yaml.dumpAs(value, Tag.MAP, DumperOptions.FlowStyle.BLOCK)
                    : yaml.dump(value);
            return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
        };
    }

    private static boolean isBean(Object value) {
        return value != null
                && !(value instanceof Map)
                && !(value instanceof Collection)
                && !(value instanceof CharSequence)
                && !(value instanceof Number)
                && !(value instanceof Boolean)
                && !value.getClass().isArray();
    }

    public <T> OutputConverter<T> output(Class<T> type) {
        return stream -> {
            // Yaml instances are not thread-safe
            Yaml yaml = new Yaml(new Constructor(type, loaderOptions));
            return yaml.loadAs(new InputStreamReader(stream, StandardCharsets.UTF_8), type);
        };
    }
}
