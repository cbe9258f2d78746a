package org.dxworks.codetracer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class CodetracerConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final long DEFAULT_REWRITE_TIMEOUT_SECONDS = 120;
    private static final String CONFIG_FILE_NAME = "codetracer-config.yml";

    private static final List<String> DEFAULT_EXCLUDED_DIRECTORIES = List.of(
            "node_modules", ".git", "dist", "build", "coverage", "__pycache__",
            ".venv", "venv", ".next", "target");
    private static final List<String> DEFAULT_ROUTE_METHODS = List.of(
            "get", "post", "put", "patch", "delete", "options", "head", "all");
    private static final List<String> DEFAULT_INSTRUMENTATION_MARKERS = List.of("handit");

    private final int maxFileLines;
    private final Set<String> excludedDirectories;
    private final Set<String> routeMethods;
    private final List<String> instrumentationMarkers;
    private final List<String> rewriteCommand;
    private final long rewriteTimeoutSeconds;

    private CodetracerConfig(int maxFileLines,
                             Set<String> excludedDirectories,
                             Set<String> routeMethods,
                             List<String> instrumentationMarkers,
                             List<String> rewriteCommand,
                             long rewriteTimeoutSeconds) {
        this.maxFileLines = maxFileLines;
        this.excludedDirectories = excludedDirectories;
        this.routeMethods = routeMethods;
        this.instrumentationMarkers = instrumentationMarkers;
        this.rewriteCommand = rewriteCommand;
        this.rewriteTimeoutSeconds = rewriteTimeoutSeconds;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public Set<String> getExcludedDirectories() {
        return excludedDirectories;
    }

    public Set<String> getRouteMethods() {
        return routeMethods;
    }

    public List<String> getInstrumentationMarkers() {
        return instrumentationMarkers;
    }

    public List<String> getRewriteCommand() {
        return rewriteCommand;
    }

    public boolean hasRewriteCommand() {
        return !rewriteCommand.isEmpty();
    }

    public long getRewriteTimeoutSeconds() {
        return rewriteTimeoutSeconds;
    }

    public static CodetracerConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CodetracerConfig load(Path configPath) {
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
                long effectiveTimeout = (yamlConfig.rewriteTimeoutSeconds != null && yamlConfig.rewriteTimeoutSeconds > 0)
                        ? yamlConfig.rewriteTimeoutSeconds
                        : DEFAULT_REWRITE_TIMEOUT_SECONDS;

                return new CodetracerConfig(
                        effectiveMaxFileLines,
                        toSet(orDefault(yamlConfig.excludedDirectories, DEFAULT_EXCLUDED_DIRECTORIES)),
                        toSet(orDefault(yamlConfig.routeMethods, DEFAULT_ROUTE_METHODS)),
                        List.copyOf(orDefault(yamlConfig.instrumentationMarkers, DEFAULT_INSTRUMENTATION_MARKERS)),
                        yamlConfig.rewriteCommand != null ? List.copyOf(yamlConfig.rewriteCommand) : List.of(),
                        effectiveTimeout);
            }
        } catch (IOException e) {
            System.err.println("Warning: Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static CodetracerConfig defaults() {
        return new CodetracerConfig(
                DEFAULT_MAX_FILE_LINES,
                toSet(DEFAULT_EXCLUDED_DIRECTORIES),
                toSet(DEFAULT_ROUTE_METHODS),
                DEFAULT_INSTRUMENTATION_MARKERS,
                List.of(),
                DEFAULT_REWRITE_TIMEOUT_SECONDS);
    }

    public static CodetracerConfig with(int maxFileLines, List<String> instrumentationMarkers, List<String> rewriteCommand) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new CodetracerConfig(
                effectiveMaxFileLines,
                toSet(DEFAULT_EXCLUDED_DIRECTORIES),
                toSet(DEFAULT_ROUTE_METHODS),
                List.copyOf(instrumentationMarkers),
                List.copyOf(rewriteCommand),
                DEFAULT_REWRITE_TIMEOUT_SECONDS);
    }

    private static List<String> orDefault(List<String> configured, List<String> fallback) {
        if (configured == null || configured.isEmpty()) {
            return fallback;
        }
        List<String> cleaned = new ArrayList<>();
        for (String value : configured) {
            if (value != null && !value.isBlank()) {
                cleaned.add(value.trim());
            }
        }
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    private static Set<String> toSet(List<String> values) {
        return java.util.Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public List<String> excludedDirectories;
        public List<String> routeMethods;
        public List<String> instrumentationMarkers;
        public List<String> rewriteCommand;
        public Long rewriteTimeoutSeconds;
    }
}
