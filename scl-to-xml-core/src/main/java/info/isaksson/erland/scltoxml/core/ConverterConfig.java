package info.isaksson.erland.scltoxml.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Loads {@link ConverterOptions} from an optional YAML file.
 *
 * <pre>
 * uidStart: 21
 * engineeringVersion: V18
 * reflowLongCalls: true
 * reflowWidth: 120
 * globalConstantPattern: "(?i)gc_\\w*"
 * globalConstants: [MAX_AXES]
 * </pre>
 *
 * A missing or unreadable file yields the defaults; keys left out or holding invalid values keep
 * their default value.
 */
public final class ConverterConfig {

    private static final Logger log = LoggerFactory.getLogger(ConverterConfig.class);

    public static final String CONFIG_FILE_NAME = "scl-to-xml.yml";

    private ConverterConfig() {}

    /** Reads {@value #CONFIG_FILE_NAME} from the working directory when present. */
    public static ConverterOptions load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static ConverterOptions load(Path configPath) {
        ConverterOptions options = new ConverterOptions();
        if (configPath == null || !Files.isRegularFile(configPath)) {
            return options;
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yaml = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yaml != null) {
                apply(yaml, options);
            }
            log.debug("Loaded {} from {}", options, configPath);
        } catch (IOException e) {
            log.warn("Could not read {}; using defaults: {}", configPath, e.getMessage());
            return new ConverterOptions();
        }
        return options;
    }

    private static void apply(YamlConfig yaml, ConverterOptions options) {
        if (yaml.uidStart != null && yaml.uidStart >= 0) options.uidStart = yaml.uidStart;
        if (yaml.engineeringVersion != null && !yaml.engineeringVersion.isBlank()) {
            options.engineeringVersion = yaml.engineeringVersion.trim();
        }
        if (yaml.reflowLongCalls != null) options.reflowLongCalls = yaml.reflowLongCalls;
        if (yaml.reflowWidth != null && yaml.reflowWidth > 0) options.reflowWidth = yaml.reflowWidth;
        // An explicit empty string turns pattern matching off.
        if (yaml.globalConstantPattern != null) {
            try {
                if (!yaml.globalConstantPattern.isBlank()) Pattern.compile(yaml.globalConstantPattern);
                options.globalConstantPattern = yaml.globalConstantPattern;
            } catch (PatternSyntaxException e) {
                log.warn("Ignoring invalid globalConstantPattern '{}'; keeping '{}': {}",
                        yaml.globalConstantPattern, options.globalConstantPattern, e.getDescription());
            }
        }
        if (yaml.globalConstants != null) options.globalConstants = List.copyOf(yaml.globalConstants);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class YamlConfig {
        public Integer uidStart;
        public String engineeringVersion;
        public Boolean reflowLongCalls;
        public Integer reflowWidth;
        public String globalConstantPattern;
        public List<String> globalConstants;
    }
}
