package org.dxworks.celerrate;

import org.dxworks.celerrate.cst.ConcreteNode;
import org.dxworks.celerrate.cst.PhpGrammar;
import org.dxworks.celerrate.cst.SourceText;
import org.dxworks.celerrate.diagnostics.Diagnostic;
import org.dxworks.celerrate.dialect.Dialect;
import org.dxworks.celerrate.dialect.DialectResolver;
import org.dxworks.celerrate.dialect.DialectSelection;
import org.dxworks.celerrate.mapper.MappingResult;
import org.dxworks.celerrate.mapper.NodeMapper;
import org.dxworks.celerrate.mapper.ReportingMode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Parses PHP source with tree-sitter and maps it to the typed tree.
 */
public class Celerrate {
    private static final NodeMapper MAPPER = new NodeMapper();

    private Celerrate() {
    }

    public static MappingResult map(String sourceCode, Dialect dialect) {
        return map(sourceCode, selectionOf(dialect));
    }

    /**
     * Maps under a dialect given by its version tag, such as {@code "8.1"}. Unknown tags map
     * under the newest dialect with a fallback warning.
     */
    public static MappingResult map(String sourceCode, String dialectTag) {
        return map(sourceCode, DialectResolver.getDefault().resolveTag(dialectTag));
    }

    private static MappingResult map(String sourceCode, DialectSelection selection) {
        SourceText source = new SourceText(sourceCode);
        ConcreteNode root = PhpGrammar.parse(source);
        return MAPPER.map(root, source, selection);
    }

    public static MappingResult mapFile(Path filePath, Dialect dialect) throws IOException {
        return mapFile(filePath, selectionOf(dialect));
    }

    private static MappingResult mapFile(Path filePath, DialectSelection selection) throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (sourceCode.startsWith("\uFEFF")) {
            sourceCode = sourceCode.substring(1);
        }

        return map(sourceCode, selection);
    }

    /**
     * Maps files under the settings in {@code celerrate-config.yml}.
     */
    public static Map<Path, MappingResult> mapFiles(Collection<Path> files) {
        return mapFiles(files, CelerrateConfig.load());
    }

    /**
     * Maps files under the given settings. An unknown dialect tag maps under the newest dialect
     * and every result carries the fallback warning. Diagnostics that count as failures under the
     * configured reporting mode are printed to standard error.
     */
    public static Map<Path, MappingResult> mapFiles(Collection<Path> files, CelerrateConfig config) {
        DialectSelection selection = DialectResolver.getDefault().resolveTag(config.getDialectTag());
        return mapFiles(files, selection, config.getMaxFileLines(), config.getReporting());
    }

    public static Map<Path, MappingResult> mapFiles(Collection<Path> files, Dialect dialect) {
        return mapFiles(files, dialect, CelerrateConfig.load().getMaxFileLines());
    }

    /**
     * Maps files in parallel. Files over {@code maxFileLines} are skipped and files that fail
     * are reported on standard error; neither appears in the result.
     */
    public static Map<Path, MappingResult> mapFiles(Collection<Path> files, Dialect dialect, int maxFileLines) {
        return mapFiles(files, selectionOf(dialect), maxFileLines, null);
    }

    private static Map<Path, MappingResult> mapFiles(Collection<Path> files, DialectSelection selection,
                                                     int maxFileLines, ReportingMode reporting) {
        Map<Path, MappingResult> results = new ConcurrentHashMap<>();
        files.parallelStream().forEach(file -> {
            if (!withinMaxLines(file, maxFileLines)) {
                synchronized (System.err) {
                    System.err.println("  Skipping " + file.getFileName() + ": more than " + maxFileLines + " lines");
                }
                return;
            }
            try {
                MappingResult result = mapFile(file, selection);
                results.put(file, result);
                if (reporting != null) {
                    reportFailures(file, result.failures(reporting));
                }
            } catch (Exception e) {
                synchronized (System.err) {
                    System.err.println("  Error mapping " + file.getFileName() + ": " + e.getMessage());
                }
            }
        });
        return new TreeMap<>(results);
    }

    private static void reportFailures(Path file, List<Diagnostic> failures) {
        if (failures.isEmpty()) return;
        synchronized (System.err) {
            System.err.println("  " + file.getFileName() + ": " + failures.size() + " problem(s)");
            for (Diagnostic failure : failures) {
                System.err.println("    " + failure);
            }
        }
    }

    private static DialectSelection selectionOf(Dialect dialect) {
        return new DialectSelection(dialect.getTag(), dialect, false);
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (Exception e) {
            // Unreadable files are let through so that mapFile reports the failure
            return true;
        }
    }
}
