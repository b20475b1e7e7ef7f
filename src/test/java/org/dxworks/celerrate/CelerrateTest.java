package org.dxworks.celerrate;

import org.dxworks.celerrate.diagnostics.Diagnostic;
import org.dxworks.celerrate.diagnostics.DiagnosticCode;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.mapper.MappingResult;
import org.dxworks.celerrate.mapper.ReportingMode;
import org.dxworks.celerrate.model.ExpressionStatement;
import org.dxworks.celerrate.model.InlineHtml;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class CelerrateTest {

    @TempDir
    Path tempDir;

    @Test
    void mapFile_stripsByteOrderMark() throws IOException {
        Path file = tempDir.resolve("bom.php");
        Files.write(file, "\uFEFF<?php\nfoo();\n".getBytes(StandardCharsets.UTF_8));

        MappingResult result = Celerrate.mapFile(file, Dialect.PHP_8_2);

        assertTrue(result.getDiagnostics().isEmpty(), () -> result.getDiagnostics().toString());
        assertEquals(1, result.getRoot().statements.size());
        assertTrue(result.getRoot().statements.get(0) instanceof ExpressionStatement);
    }

    @Test
    void map_inlineHtmlBeforeOpeningTag() {
        MappingResult result = Celerrate.map("<h1>Title</h1>\n<?php echo 1;\n", Dialect.PHP_8_2);

        assertTrue(result.getRoot().statements.get(0) instanceof InlineHtml);
    }

    @Test
    void mapFiles_skipsLongAndMissingFiles() throws IOException {
        Path small = tempDir.resolve("a.php");
        Path large = tempDir.resolve("b.php");
        Path missing = tempDir.resolve("c.php");
        Files.writeString(small, "<?php\n$a = 1;\n");
        Files.writeString(large, "<?php\n$a = 1;\n$b = 2;\n$c = 3;\n$d = 4;\n");

        Map<Path, MappingResult> results = Celerrate.mapFiles(List.of(small, large, missing), Dialect.PHP_8_2, 3);

        assertEquals(1, results.size());
        assertTrue(results.containsKey(small));
    }

    @Test
    void map_unknownDialectTagFallsBackWithWarning() {
        MappingResult result = Celerrate.map("<?php\n$a = 1;\n", "9.9");

        assertEquals(Dialect.latest(), result.getDialect());
        assertFalse(result.hasErrors());
        assertEquals(1, result.getDiagnostics().size());
        Diagnostic warning = result.getDiagnostics().get(0);
        assertEquals(DiagnosticCode.DIALECT_FALLBACK, warning.getCode());
        assertEquals("Unknown dialect '9.9', using PHP 8.4", warning.getMessage());
    }

    @Test
    void map_knownDialectTag() {
        MappingResult result = Celerrate.map("<?php\n$a = 1;\n", "7.4");

        assertEquals(Dialect.PHP_7_4, result.getDialect());
        assertTrue(result.getDiagnostics().isEmpty());
    }

    @Test
    void map_syntaxErrorStillYieldsTree() {
        MappingResult result = Celerrate.map("<?php\nfunction ( {\n$a = 1;\n", Dialect.PHP_8_2);

        assertTrue(result.hasErrors());
        assertNotNull(result.getRoot());
    }

    @Test
    void mapFiles_configWithUnknownDialectKeepsFallbackWarning() throws IOException {
        Path configFile = tempDir.resolve("celerrate-config.yml");
        Files.writeString(configFile, "dialect: \"9.9\"\n");
        Path file = tempDir.resolve("a.php");
        Files.writeString(file, "<?php\n$a = 1;\n");

        Map<Path, MappingResult> results = Celerrate.mapFiles(List.of(file), CelerrateConfig.load(configFile));

        MappingResult result = results.get(file);
        assertEquals(Dialect.latest(), result.getDialect());
        assertEquals(1, result.getDiagnostics().size());
        assertEquals(DiagnosticCode.DIALECT_FALLBACK, result.getDiagnostics().get(0).getCode());
    }

    @Test
    void mapFiles_reportsFailuresByReportingMode() throws IOException {
        Path file = tempDir.resolve("warned.php");
        Files.writeString(file, "<?php\n$a = 1;\n");

        String strict = captureErr(() -> Celerrate.mapFiles(List.of(file), CelerrateConfig.with("9.9", ReportingMode.STRICT, 100)));
        String lenient = captureErr(() -> Celerrate.mapFiles(List.of(file), CelerrateConfig.with("9.9", ReportingMode.LENIENT, 100)));

        assertTrue(strict.contains("warned.php: 1 problem(s)"), strict);
        assertTrue(strict.contains(DiagnosticCode.DIALECT_FALLBACK.getCode()), strict);
        assertEquals("", lenient);
    }

    private static String captureErr(Runnable action) {
        PrintStream original = System.err;
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            action.run();
        } finally {
            System.setErr(original);
        }
        return captured.toString(StandardCharsets.UTF_8);
    }
}
