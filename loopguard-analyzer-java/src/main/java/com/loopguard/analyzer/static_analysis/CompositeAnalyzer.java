package com.loopguard.analyzer.static_analysis;

import com.loopguard.analyzer.report.ScanReport;
import com.loopguard.api.BlockingViolation;

import java.util.*;

/**
 * Runs several analyzers over the same source and merges their findings. A finding of the
 * same kind, symbol and line reported by more than one analyzer is kept once. The first
 * error report wins.
 */
public class CompositeAnalyzer implements SourceAnalyzer {

    private final List<SourceAnalyzer> analyzers;

    public CompositeAnalyzer(SourceAnalyzer... analyzers) {
        this.analyzers = List.of(analyzers);
    }

    @Override
    public ScanReport scan(String sourceText, String contextLabel) {
        Map<String, BlockingViolation> merged = new LinkedHashMap<>();
        String context = contextLabel != null ? contextLabel : "unknown";
        for (SourceAnalyzer analyzer : analyzers) {
            ScanReport report = analyzer.scan(sourceText, context);
            if (report.hasError()) return report;
            for (BlockingViolation v : report.violations()) {
                merged.putIfAbsent(v.kind() + "|" + v.symbol() + "|" + v.line(), v);
            }
        }
        return ScanReport.of(context, new ArrayList<>(merged.values()));
    }
}
