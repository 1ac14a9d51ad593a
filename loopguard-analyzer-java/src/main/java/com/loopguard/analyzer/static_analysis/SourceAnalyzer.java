package com.loopguard.analyzer.static_analysis;

import com.loopguard.analyzer.report.ScanReport;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Scans one unit of Java source and reports what it finds. Implementations never throw for
 * bad input: unreadable or unparsable sources produce an error report.
 */
public interface SourceAnalyzer {

    ScanReport scan(String sourceText, String contextLabel);

    default ScanReport scanFile(Path file) {
        return scanFile(file, file.toString());
    }

    default ScanReport scanFile(Path file, String contextLabel) {
        if (!Files.isRegularFile(file)) {
            return ScanReport.failed(contextLabel, "File not found: " + file);
        }
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException | RuntimeException e) {
            return ScanReport.failed(contextLabel, "Could not read file: " + file);
        }
        return scan(text, contextLabel);
    }
}
