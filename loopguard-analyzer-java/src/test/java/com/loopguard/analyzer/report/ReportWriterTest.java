package com.loopguard.analyzer.report;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.loopguard.api.BlockingViolation;
import com.loopguard.api.Severity;
import com.loopguard.api.SourceLocation;
import com.loopguard.api.ViolationKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReportWriterTest {

    private static BlockingViolation sleepAt(String file, int line) {
        return new BlockingViolation(ViolationKind.BLOCKING_CALL, Severity.ERROR, "Thread.sleep",
            SourceLocation.ofSource(file, line), "blocks", "schedule instead");
    }

    private static ProjectScanReport unsortedReport() {
        ScanReport b = ScanReport.of("b/B.java", List.of(sleepAt("b/B.java", 9), sleepAt("b/B.java", 3)));
        ScanReport a = ScanReport.of("a/A.java", List.of(sleepAt("a/A.java", 1)));
        ScanReport broken = ScanReport.failed("c/C.java", "Parse error: x");
        return ProjectScanReport.of("/src", List.of(b, broken, a));
    }

    @Test
    void outputIsSortedByFileThenLine() {
        JsonObject root = JsonParser.parseString(new ReportWriter().toJson(unsortedReport())).getAsJsonObject();
        JsonArray files = root.getAsJsonArray("files");
        assertEquals("a/A.java", files.get(0).getAsJsonObject().get("context").getAsString());
        assertEquals("b/B.java", files.get(1).getAsJsonObject().get("context").getAsString());
        assertEquals("c/C.java", files.get(2).getAsJsonObject().get("context").getAsString());

        JsonArray bViolations = files.get(1).getAsJsonObject().getAsJsonArray("violations");
        assertEquals(3, bViolations.get(0).getAsJsonObject().getAsJsonObject("location").get("line").getAsInt());
        assertEquals(9, bViolations.get(1).getAsJsonObject().getAsJsonObject("location").get("line").getAsInt());
    }

    @Test
    void jsonUsesSnakeCaseEnumNamesAndSummary() {
        JsonObject root = JsonParser.parseString(new ReportWriter().toJson(unsortedReport())).getAsJsonObject();
        JsonObject summary = root.getAsJsonObject("summary");
        assertEquals(3, summary.get("total").getAsInt());
        assertEquals(3, summary.get("blocking").getAsInt());
        assertFalse(summary.get("safe").getAsBoolean());
        assertEquals(1, root.get("errors").getAsInt());

        JsonObject violation = root.getAsJsonArray("files").get(0).getAsJsonObject()
            .getAsJsonArray("violations").get(0).getAsJsonObject();
        assertEquals("blocking_call", violation.get("kind").getAsString());
        assertEquals("error", violation.get("severity").getAsString());
    }

    @Test
    void errorReportHasNoSummary() {
        JsonObject root = JsonParser.parseString(new ReportWriter().toJson(unsortedReport())).getAsJsonObject();
        JsonObject broken = root.getAsJsonArray("files").get(2).getAsJsonObject();
        assertEquals("Parse error: x", broken.get("error").getAsString());
        assertFalse(broken.has("summary"));
        assertEquals(0, broken.getAsJsonArray("violations").size());
    }

    @Test
    void repeatedWritesAreIdentical(@TempDir Path dir) throws Exception {
        ReportWriter writer = new ReportWriter();
        Path first = dir.resolve("one/report.json");
        Path second = dir.resolve("two/report.json");
        writer.write(unsortedReport(), first);
        writer.write(unsortedReport(), second);
        assertTrue(Files.exists(first));
        assertEquals(Files.readString(first), Files.readString(second));
    }
}
