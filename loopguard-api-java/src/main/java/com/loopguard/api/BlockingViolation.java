package com.loopguard.api;

import com.google.gson.annotations.SerializedName;

import java.util.Objects;

/**
 * One finding from static or runtime detection. Immutable; created per finding, aggregated
 * into a report and discarded once surfaced.
 *
 * @param kind       what was found
 * @param severity   {@link Severity#ERROR} for anything that freezes the loop
 * @param symbol     name of the offending construct, e.g. {@code Thread.sleep}
 * @param location   source line or captured frame
 * @param message    human-readable explanation
 * @param suggestion remediation hint
 */
public record BlockingViolation(
    @SerializedName("kind")       ViolationKind kind,
    @SerializedName("severity")   Severity severity,
    @SerializedName("symbol")     String symbol,
    @SerializedName("location")   SourceLocation location,
    @SerializedName("message")    String message,
    @SerializedName("suggestion") String suggestion
) {

    public BlockingViolation {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public boolean isBlocking() {
        return severity == Severity.ERROR;
    }

    public int line() {
        return location.line();
    }
}
