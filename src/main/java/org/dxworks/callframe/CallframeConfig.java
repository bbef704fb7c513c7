package org.dxworks.callframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.callframe.analyzer.MethodAttribution;
import org.dxworks.callframe.render.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Optional settings read from {@code callframe-config.yml} in the working directory.
 * Missing keys, invalid values or an unreadable file fall back to the defaults.
 */
public class CallframeConfig {

    private static final Logger log = LoggerFactory.getLogger(CallframeConfig.class);

    static final String CONFIG_FILE_NAME = "callframe-config.yml";
    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final OutputFormat DEFAULT_OUTPUT_FORMAT = OutputFormat.DOT;
    private static final MethodAttribution DEFAULT_METHOD_ATTRIBUTION = MethodAttribution.GLOBAL;

    private final int maxFileLines;
    private final OutputFormat outputFormat;
    private final MethodAttribution methodAttribution;

    private CallframeConfig(int maxFileLines, OutputFormat outputFormat, MethodAttribution methodAttribution) {
        this.maxFileLines = maxFileLines;
        this.outputFormat = outputFormat;
        this.methodAttribution = methodAttribution;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public MethodAttribution getMethodAttribution() {
        return methodAttribution;
    }

    public static CallframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CallframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                OutputFormat effectiveOutputFormat = OutputFormat.fromName(yamlConfig.outputFormat)
                        .orElse(DEFAULT_OUTPUT_FORMAT);
                return new CallframeConfig(effectiveMaxFileLines, effectiveOutputFormat,
                        parseAttribution(yamlConfig.methodAttribution));
            }
        } catch (IOException e) {
            log.warn("Ignoring unreadable {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static CallframeConfig defaults() {
        return new CallframeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_OUTPUT_FORMAT, DEFAULT_METHOD_ATTRIBUTION);
    }

    public static CallframeConfig with(int maxFileLines, OutputFormat outputFormat, MethodAttribution methodAttribution) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new CallframeConfig(effectiveMaxFileLines,
                outputFormat != null ? outputFormat : DEFAULT_OUTPUT_FORMAT,
                methodAttribution != null ? methodAttribution : DEFAULT_METHOD_ATTRIBUTION);
    }

    private static MethodAttribution parseAttribution(String value) {
        if (value == null) {
            return DEFAULT_METHOD_ATTRIBUTION;
        }
        try {
            return MethodAttribution.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown methodAttribution '{}', using {}", value, DEFAULT_METHOD_ATTRIBUTION);
            return DEFAULT_METHOD_ATTRIBUTION;
        }
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public String outputFormat;
        public String methodAttribution;
    }
}
