package com.loopguard.analyzer.report;

import com.google.gson.annotations.SerializedName;
import com.loopguard.api.BlockingViolation;

import java.util.Collection;
import java.util.List;

/**
 * Finding counts of one scan. {@code safe} is true when no ERROR finding exists.
 */
public record ScanSummary(
    @SerializedName("total")    int total,
    @SerializedName("blocking") int blocking,
    @SerializedName("warnings") int warnings,
    @SerializedName("safe")     boolean safe
) {

    public static final ScanSummary EMPTY = new ScanSummary(0, 0, 0, true);

    public static ScanSummary of(List<BlockingViolation> violations) {
        int blocking = (int) violations.stream().filter(BlockingViolation::isBlocking).count();
        return new ScanSummary(violations.size(), blocking, violations.size() - blocking, blocking == 0);
    }

    public static ScanSummary merge(Collection<ScanSummary> summaries) {
        int total = 0;
        int blocking = 0;
        int warnings = 0;
        for (ScanSummary s : summaries) {
            total += s.total;
            blocking += s.blocking;
            warnings += s.warnings;
        }
        return new ScanSummary(total, blocking, warnings, blocking == 0);
    }
}
