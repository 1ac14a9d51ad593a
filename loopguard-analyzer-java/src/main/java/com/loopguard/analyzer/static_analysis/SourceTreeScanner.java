package com.loopguard.analyzer.static_analysis;

import com.loopguard.analyzer.report.ProjectScanReport;
import com.loopguard.analyzer.report.ScanReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs a {@link SourceAnalyzer} over every {@code .java} file under a root, in sorted path
 * order. Report contexts are paths relative to the root.
 */
public class SourceTreeScanner {

    private static final Logger log = LoggerFactory.getLogger(SourceTreeScanner.class);

    public ProjectScanReport scanTree(Path root, SourceAnalyzer analyzer) {
        Path absRoot = root.toAbsolutePath().normalize();
        if (Files.isRegularFile(absRoot)) {
            ScanReport single = analyzer.scanFile(absRoot, absRoot.getFileName().toString());
            return ProjectScanReport.of(absRoot.toString(), List.of(single));
        }
        if (!Files.isDirectory(absRoot)) {
            return ProjectScanReport.of(absRoot.toString(),
                List.of(ScanReport.failed(root.toString(), "File not found: " + root)));
        }

        List<Path> sources;
        try (Stream<Path> walk = Files.walk(absRoot)) {
            sources = walk.filter(p -> p.toString().endsWith(".java"))
                          .filter(Files::isRegularFile)
                          .sorted()
                          .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to walk source tree: " + absRoot, e);
        }

        log.info("Scanning {} source files under {}", sources.size(), absRoot);
        List<ScanReport> reports = new ArrayList<>(sources.size());
        for (Path source : sources) {
            reports.add(analyzer.scanFile(source, makeRelative(absRoot, source)));
        }
        return ProjectScanReport.of(absRoot.toString(), reports);
    }

    private static String makeRelative(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
