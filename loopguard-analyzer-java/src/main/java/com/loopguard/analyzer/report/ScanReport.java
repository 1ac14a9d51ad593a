package com.loopguard.analyzer.report;

import com.google.gson.annotations.SerializedName;
import com.loopguard.api.BlockingViolation;

import java.util.List;

/**
 * Result of scanning one source unit. An error report has an empty violation list and a null
 * summary.
 */
public record ScanReport(
    @SerializedName("context")    String context,
    @SerializedName("violations") List<BlockingViolation> violations,
    @SerializedName("summary")    ScanSummary summary,
    @SerializedName("error")      String error
) {

    public ScanReport {
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    public static ScanReport of(String context, List<BlockingViolation> violations) {
        return new ScanReport(context, violations, ScanSummary.of(violations), null);
    }

    public static ScanReport failed(String context, String error) {
        return new ScanReport(context, List.of(), null, error);
    }

    public boolean hasError() {
        return error != null;
    }

    /** False for error reports: a source that could not be analysed is never declared safe. */
    public boolean isSafe() {
        return !hasError() && summary.safe();
    }

    public List<BlockingViolation> blocking() {
        return violations.stream().filter(BlockingViolation::isBlocking).toList();
    }
}
