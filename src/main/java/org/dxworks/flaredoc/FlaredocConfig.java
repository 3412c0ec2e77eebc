package org.dxworks.flaredoc;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.flaredoc.converter.AsciidocConverter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class FlaredocConfig {

    private static final String CONFIG_FILE_NAME = "flaredoc-config.yml";
    private static final String DEFAULT_SNIPPET_DEFINITIONS_FILE = "snippets.adoc";
    private static final boolean DEFAULT_PARALLEL = false;

    private final List<String> knownSnippets;
    private final String snippetDefinitionsFile;
    private final String outputExtension;
    private final boolean parallel;

    private FlaredocConfig(List<String> knownSnippets, String snippetDefinitionsFile,
                           String outputExtension, boolean parallel) {
        this.knownSnippets = List.copyOf(knownSnippets);
        this.snippetDefinitionsFile = snippetDefinitionsFile;
        this.outputExtension = outputExtension;
        this.parallel = parallel;
    }

    /** Snippet names defined outside this run; references to them are not re-converted. */
    public List<String> getKnownSnippets() {
        return knownSnippets;
    }

    public String getSnippetDefinitionsFile() {
        return snippetDefinitionsFile;
    }

    public String getOutputExtension() {
        return outputExtension;
    }

    public boolean isParallel() {
        return parallel;
    }

    public static FlaredocConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static FlaredocConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                List<String> knownSnippets = yamlConfig.knownSnippets != null
                        ? yamlConfig.knownSnippets
                        : List.of();
                String snippetDefinitionsFile = isPresent(yamlConfig.snippetDefinitionsFile)
                        ? yamlConfig.snippetDefinitionsFile.trim()
                        : DEFAULT_SNIPPET_DEFINITIONS_FILE;
                String outputExtension = isPresent(yamlConfig.outputExtension)
                        ? normalizeExtension(yamlConfig.outputExtension)
                        : AsciidocConverter.DEFAULT_OUTPUT_EXTENSION;
                boolean parallel = yamlConfig.parallel != null ? yamlConfig.parallel : DEFAULT_PARALLEL;

                return new FlaredocConfig(knownSnippets, snippetDefinitionsFile, outputExtension, parallel);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static FlaredocConfig defaults() {
        return new FlaredocConfig(List.of(), DEFAULT_SNIPPET_DEFINITIONS_FILE,
                AsciidocConverter.DEFAULT_OUTPUT_EXTENSION, DEFAULT_PARALLEL);
    }

    public static FlaredocConfig with(List<String> knownSnippets, boolean parallel) {
        return new FlaredocConfig(knownSnippets, DEFAULT_SNIPPET_DEFINITIONS_FILE,
                AsciidocConverter.DEFAULT_OUTPUT_EXTENSION, parallel);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private static String normalizeExtension(String extension) {
        String trimmed = extension.trim();
        return trimmed.startsWith(".") ? trimmed : "." + trimmed;
    }

    private static class YamlConfig {
        public List<String> knownSnippets;
        public String snippetDefinitionsFile;
        public String outputExtension;
        public Boolean parallel;
    }
}
