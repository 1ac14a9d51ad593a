package com.loopguard.analyzer.report;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.loopguard.api.BlockingViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;

/**
 * Serializes scan reports to JSON. Files are ordered by context and findings by line, so
 * repeated scans of the same tree produce identical output.
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private static final Comparator<BlockingViolation> BY_LINE =
        Comparator.comparingInt(BlockingViolation::line)
                  .thenComparing(v -> v.symbol() != null ? v.symbol() : "");

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    public String toJson(ProjectScanReport report) {
        return gson.toJson(sorted(report));
    }

    /**
     * Writes {@code report} to {@code outputFile}, creating parent directories.
     */
    public void write(ProjectScanReport report, Path outputFile) {
        Path parent = outputFile.toAbsolutePath().getParent();
        try {
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + parent, e);
        }
        try (Writer w = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
            gson.toJson(sorted(report), w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write report: " + e.getMessage(), e);
        }
        log.info("Scan report written: {}", outputFile);
    }

    static ProjectScanReport sorted(ProjectScanReport report) {
        List<ScanReport> files = report.files().stream()
            .map(f -> new ScanReport(f.context(),
                f.violations().stream().sorted(BY_LINE).toList(), f.summary(), f.error()))
            .sorted(Comparator.comparing(ScanReport::context))
            .toList();
        return new ProjectScanReport(report.root(), files, report.summary(), report.errors());
    }
}
