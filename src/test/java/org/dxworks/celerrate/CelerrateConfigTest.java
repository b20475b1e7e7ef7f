package org.dxworks.celerrate;

import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.mapper.ReportingMode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CelerrateConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void load_missingFileGivesDefaults() {
        CelerrateConfig config = CelerrateConfig.load(tempDir.resolve("celerrate-config.yml"));

        assertEquals(Dialect.latest().getTag(), config.getDialectTag());
        assertEquals(ReportingMode.LENIENT, config.getReporting());
        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void load_readsAllSettings() throws IOException {
        Path file = tempDir.resolve("celerrate-config.yml");
        Files.writeString(file, "dialect: \"7.4\"\nreporting: STRICT\nmaxFileLines: 500\n");

        CelerrateConfig config = CelerrateConfig.load(file);

        assertEquals("7.4", config.getDialectTag());
        assertEquals(ReportingMode.STRICT, config.getReporting());
        assertEquals(500, config.getMaxFileLines());
    }

    @Test
    void load_invalidValuesFallBackPerSetting() throws IOException {
        Path file = tempDir.resolve("celerrate-config.yml");
        Files.writeString(file, "dialect: \"  \"\nreporting: noisy\nmaxFileLines: -3\n");

        CelerrateConfig config = CelerrateConfig.load(file);

        assertEquals(Dialect.latest().getTag(), config.getDialectTag());
        assertEquals(ReportingMode.LENIENT, config.getReporting());
        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void load_unknownDialectTagIsKeptForResolution() throws IOException {
        Path file = tempDir.resolve("celerrate-config.yml");
        Files.writeString(file, "dialect: \"9.9\"\n");

        assertEquals("9.9", CelerrateConfig.load(file).getDialectTag());
    }

    @Test
    void load_unreadableYamlGivesDefaults() throws IOException {
        Path file = tempDir.resolve("celerrate-config.yml");
        Files.writeString(file, "maxFileLines: [not, a, number\n");

        CelerrateConfig config = CelerrateConfig.load(file);

        assertEquals(20000, config.getMaxFileLines());
    }

    @Test
    void with_fillsMissingValues() {
        CelerrateConfig config = CelerrateConfig.with(null, null, 0);

        assertEquals(Dialect.latest().getTag(), config.getDialectTag());
        assertEquals(ReportingMode.LENIENT, config.getReporting());
        assertEquals(20000, config.getMaxFileLines());
    }
}
