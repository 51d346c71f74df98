package org.dxworks.jsxforge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class CompilerConfig {

    private static final Logger LOG = LoggerFactory.getLogger(CompilerConfig.class);

    private static final String CONFIG_FILE_NAME = "jsxforge-config.yml";
    private static final String DEFAULT_PARTIAL_PREFIX = "partials/";
    private static final boolean DEFAULT_PRETTY_PRINT = false;
    private static final boolean DEFAULT_VALIDATE_OUTPUT = true;
    private static final Dialect DEFAULT_DIALECT = Dialect.HANDLEBARS;

    private final Set<String> passthroughComponents;
    private final String partialPrefix;
    private final boolean prettyPrint;
    private final boolean validateOutput;
    private final Dialect defaultDialect;

    private CompilerConfig(Set<String> passthroughComponents, String partialPrefix, boolean prettyPrint,
                           boolean validateOutput, Dialect defaultDialect) {
        this.passthroughComponents = Set.copyOf(passthroughComponents);
        this.partialPrefix = partialPrefix;
        this.prettyPrint = prettyPrint;
        this.validateOutput = validateOutput;
        this.defaultDialect = defaultDialect;
    }

    /**
     * PascalCase tags kept as plain elements instead of becoming includes.
     */
    public Set<String> getPassthroughComponents() {
        return passthroughComponents;
    }

    public String getPartialPrefix() {
        return partialPrefix;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public boolean isValidateOutput() {
        return validateOutput;
    }

    public Dialect getDefaultDialect() {
        return defaultDialect;
    }

    public static CompilerConfig defaults() {
        return new CompilerConfig(Set.of(), DEFAULT_PARTIAL_PREFIX, DEFAULT_PRETTY_PRINT,
                DEFAULT_VALIDATE_OUTPUT, DEFAULT_DIALECT);
    }

    public static CompilerConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CompilerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                Set<String> passthrough = new LinkedHashSet<>();
                if (yamlConfig.passthroughComponents != null) {
                    for (String name : yamlConfig.passthroughComponents) {
                        if (name != null && !name.isBlank()) passthrough.add(name.trim());
                    }
                }
                String effectivePartialPrefix = (yamlConfig.partialPrefix != null)
                        ? yamlConfig.partialPrefix
                        : DEFAULT_PARTIAL_PREFIX;
                boolean effectivePrettyPrint = (yamlConfig.prettyPrint != null)
                        ? yamlConfig.prettyPrint
                        : DEFAULT_PRETTY_PRINT;
                boolean effectiveValidateOutput = (yamlConfig.validateOutput != null)
                        ? yamlConfig.validateOutput
                        : DEFAULT_VALIDATE_OUTPUT;

                return new CompilerConfig(passthrough, effectivePartialPrefix, effectivePrettyPrint,
                        effectiveValidateOutput, dialectOrDefault(yamlConfig.defaultDialect, configPath));
            }
        } catch (IOException e) {
            LOG.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    private static Dialect dialectOrDefault(String name, Path configPath) {
        if (name == null) return DEFAULT_DIALECT;
        try {
            return Dialect.fromName(name);
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown defaultDialect '{}' in {}, using {}", name, configPath, DEFAULT_DIALECT.getName());
            return DEFAULT_DIALECT;
        }
    }

    public static CompilerConfig with(Set<String> passthroughComponents, String partialPrefix, boolean prettyPrint,
                                      boolean validateOutput, Dialect defaultDialect) {
        return new CompilerConfig(
                passthroughComponents != null ? passthroughComponents : Set.of(),
                partialPrefix != null ? partialPrefix : DEFAULT_PARTIAL_PREFIX,
                prettyPrint,
                validateOutput,
                defaultDialect != null ? defaultDialect : DEFAULT_DIALECT);
    }

    private static class YamlConfig {
        public List<String> passthroughComponents;
        public String partialPrefix;
        public Boolean prettyPrint;
        public Boolean validateOutput;
        public String defaultDialect;
    }
}
