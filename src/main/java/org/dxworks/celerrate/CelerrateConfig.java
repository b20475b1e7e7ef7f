package org.dxworks.celerrate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.mapper.ReportingMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CelerrateConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final String CONFIG_FILE_NAME = "celerrate-config.yml";
    private static final ReportingMode DEFAULT_REPORTING = ReportingMode.LENIENT;

    private final String dialectTag;
    private final ReportingMode reporting;
    private final int maxFileLines;

    private CelerrateConfig(String dialectTag, ReportingMode reporting, int maxFileLines) {
        this.dialectTag = dialectTag;
        this.reporting = reporting;
        this.maxFileLines = maxFileLines;
    }

    /**
     * Requested dialect tag. It is resolved when mapping, so an unknown tag still maps with
     * a fallback warning.
     */
    public String getDialectTag() {
        return dialectTag;
    }

    public ReportingMode getReporting() {
        return reporting;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public static CelerrateConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CelerrateConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                String dialect = (yamlConfig.dialect != null && !yamlConfig.dialect.isBlank())
                        ? yamlConfig.dialect.trim()
                        : Dialect.latest().getTag();
                ReportingMode reporting = ReportingMode.fromName(yamlConfig.reporting).orElse(DEFAULT_REPORTING);
                int maxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                return new CelerrateConfig(dialect, reporting, maxFileLines);
            }
        } catch (IOException e) {
            System.err.println("Could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static CelerrateConfig with(String dialectTag, ReportingMode reporting, int maxFileLines) {
        String effectiveDialect = dialectTag != null ? dialectTag : Dialect.latest().getTag();
        ReportingMode effectiveReporting = reporting != null ? reporting : DEFAULT_REPORTING;
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new CelerrateConfig(effectiveDialect, effectiveReporting, effectiveMaxFileLines);
    }

    private static CelerrateConfig defaults() {
        return new CelerrateConfig(Dialect.latest().getTag(), DEFAULT_REPORTING, DEFAULT_MAX_FILE_LINES);
    }

    private static class YamlConfig {
        public String dialect;
        public String reporting;
        public Integer maxFileLines;
    }
}
