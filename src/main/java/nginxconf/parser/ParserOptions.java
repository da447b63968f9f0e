package nginxconf.parser;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Tunables of the parser and printers, optionally read from {@value #RESOURCE} on the classpath.
 */
@Slf4j
@Value
@Builder(toBuilder = true)
public class ParserOptions {

    public static final String RESOURCE = "nginx-conf-parser.yml";

    @Builder.Default
    String includeDirective = "include";

    @Builder.Default
    String indent = "  ";

    @Builder.Default
    boolean logWarnings = true;

    public static ParserOptions defaults() {
        return ParserOptions.builder().build();
    }

    public static ParserOptions load() {
        try (InputStream in = ParserOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.debug("{} not found on classpath, using defaults", RESOURCE);
                return defaults();
            }
            Object document = new Yaml().load(in);
            return fromDocument(document);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
    }

    public static ParserOptions fromYaml(String yaml) {
        Object document = new Yaml().load(yaml);
        return fromDocument(document);
    }

    private static ParserOptions fromDocument(Object document) {
        ParserOptions.ParserOptionsBuilder builder = ParserOptions.builder();
        if (document == null) {
            return builder.build();
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Parser options must be a YAML mapping, got " + document.getClass().getSimpleName());
        }

        for (Map.Entry<?, ?> entry : ((Map<?, ?>) document).entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "includeDirective":
                    builder.includeDirective(requireType(key, value, String.class));
                    break;
                case "indent":
                    builder.indent(requireType(key, value, String.class));
                    break;
                case "logWarnings":
                    builder.logWarnings(requireType(key, value, Boolean.class));
                    break;
                default:
                    log.debug("Ignoring unknown parser option '{}'", key);
                    break;
            }
        }
        return builder.build();
    }

    private static <T> T requireType(String key, Object value, Class<T> type) {
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException("Parser option '" + key + "' must be a " + type.getSimpleName() + ", got " + value);
        }
        return type.cast(value);
    }
}
