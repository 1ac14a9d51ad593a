package com.loopguard.api;

import com.google.gson.annotations.SerializedName;

/**
 * Where a finding was observed: a source file and line for static findings, or a captured
 * stack frame for runtime findings.
 *
 * @param file     source file path or label; {@code "unknown"} when not known
 * @param line     1-based line number; 0 when not known
 * @param function enclosing method for runtime frames; null for static findings
 */
public record SourceLocation(
    @SerializedName("file")     String file,
    @SerializedName("line")     int line,
    @SerializedName("function") String function
) {

    public static final SourceLocation UNKNOWN = new SourceLocation("unknown", 0, "unknown");

    public static SourceLocation ofSource(String file, int line) {
        return new SourceLocation(file != null ? file : "unknown", line, null);
    }

    public static SourceLocation ofFrame(StackTraceElement frame) {
        if (frame == null) return UNKNOWN;
        String file = frame.getFileName() != null ? frame.getFileName() : "unknown";
        return new SourceLocation(file, Math.max(frame.getLineNumber(), 0),
            frame.getClassName() + "." + frame.getMethodName());
    }

    public boolean isKnown() {
        return line > 0 || !"unknown".equals(file);
    }

    @Override
    public String toString() {
        String where = file + ":" + line;
        return function != null ? function + " (" + where + ")" : where;
    }
}
