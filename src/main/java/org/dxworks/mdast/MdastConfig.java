package org.dxworks.mdast;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class MdastConfig {

    private static final Logger log = LoggerFactory.getLogger(MdastConfig.class);

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "mdast-config.yml";
    private static final List<String> DEFAULT_EXTENSIONS = List.of("md", "markdown", "rmd");
    private static final boolean DEFAULT_INCLUDE_PLAIN_TEXT = false;

    private final int maxFileLines;
    private final List<String> extensions;
    private final boolean includePlainText;

    private MdastConfig(int maxFileLines, List<String> extensions, boolean includePlainText) {
        this.maxFileLines = maxFileLines;
        this.extensions = extensions;
        this.includePlainText = includePlainText;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean isIncludePlainText() {
        return includePlainText;
    }

    public boolean accepts(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot >= 0 && extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    public static MdastConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MdastConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return with(
                        yamlConfig.maxFileLines != null ? yamlConfig.maxFileLines : 0,
                        yamlConfig.extensions,
                        yamlConfig.includePlainText != null ? yamlConfig.includePlainText : DEFAULT_INCLUDE_PLAIN_TEXT);
            }
        } catch (IOException e) {
            log.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static MdastConfig with(int maxFileLines, List<String> extensions, boolean includePlainText) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        List<String> effectiveExtensions = new ArrayList<>();
        if (extensions != null) {
            for (String extension : extensions) {
                if (extension == null || extension.isBlank()) continue;
                String normalized = extension.trim().toLowerCase(Locale.ROOT);
                effectiveExtensions.add(normalized.startsWith(".") ? normalized.substring(1) : normalized);
            }
        }
        if (effectiveExtensions.isEmpty()) {
            effectiveExtensions.addAll(DEFAULT_EXTENSIONS);
        }
        return new MdastConfig(effectiveMaxFileLines, List.copyOf(effectiveExtensions), includePlainText);
    }

    public static MdastConfig defaults() {
        return new MdastConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_EXTENSIONS, DEFAULT_INCLUDE_PLAIN_TEXT);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public List<String> extensions;
        public Boolean includePlainText;
    }
}
