package com.loopguard.analyzer.report;

import com.google.gson.annotations.SerializedName;

import java.util.List;
import java.util.Objects;

/**
 * Reports of every file scanned under one root, with the combined summary and the number of
 * files that could not be analysed.
 */
public record ProjectScanReport(
    @SerializedName("root")    String root,
    @SerializedName("files")   List<ScanReport> files,
    @SerializedName("summary") ScanSummary summary,
    @SerializedName("errors")  int errors
) {

    public static ProjectScanReport of(String root, List<ScanReport> files) {
        ScanSummary summary = ScanSummary.merge(files.stream()
            .map(ScanReport::summary)
            .filter(Objects::nonNull)
            .toList());
        int errors = (int) files.stream().filter(ScanReport::hasError).count();
        return new ProjectScanReport(root, List.copyOf(files), summary, errors);
    }

    public boolean hasBlockingFindings() {
        return summary.blocking() > 0;
    }
}
