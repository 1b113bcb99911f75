package org.dxworks.pycscope;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class PycscopeConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    public static final String CONFIG_FILE_NAME = "pycscope-config.yml";
    private static final boolean DEFAULT_STRINGS_AS_SYMBOLS = false;
    private static final String DEFAULT_INDEX_FILE_NAME = "cscope.out";

    private final int maxFileLines;
    private final boolean stringsAsSymbols;
    private final String indexFileName;

    private PycscopeConfig(int maxFileLines, boolean stringsAsSymbols, String indexFileName) {
        this.maxFileLines = maxFileLines;
        this.stringsAsSymbols = stringsAsSymbols;
        this.indexFileName = indexFileName;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public boolean isStringsAsSymbols() {
        return stringsAsSymbols;
    }

    public String getIndexFileName() {
        return indexFileName;
    }

    public static PycscopeConfig load(Path configPath) {
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
                boolean effectiveStringsAsSymbols = (yamlConfig.stringsAsSymbols != null)
                        ? yamlConfig.stringsAsSymbols
                        : DEFAULT_STRINGS_AS_SYMBOLS;
                String effectiveIndexFileName = (yamlConfig.indexFileName != null && !yamlConfig.indexFileName.isBlank())
                        ? yamlConfig.indexFileName
                        : DEFAULT_INDEX_FILE_NAME;

                return new PycscopeConfig(effectiveMaxFileLines, effectiveStringsAsSymbols, effectiveIndexFileName);
            }
        } catch (IOException e) {
            System.err.println("pycscope: ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static PycscopeConfig defaults() {
        return new PycscopeConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_STRINGS_AS_SYMBOLS, DEFAULT_INDEX_FILE_NAME);
    }

    /**
     * Applies command line settings on top of this configuration.
     */
    public PycscopeConfig with(CommandLineOptions options) {
        boolean strings = stringsAsSymbols || options.isStringsAsSymbols();
        String indexFile = options.getIndexFileName() != null ? options.getIndexFileName() : indexFileName;
        return new PycscopeConfig(maxFileLines, strings, indexFile);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Boolean stringsAsSymbols;
        public String indexFileName;
    }
}
