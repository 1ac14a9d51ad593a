package com.loopguard.analyzer.policy;

import com.loopguard.analyzer.report.ScanReport;
import com.loopguard.api.BlockingViolation;
import com.loopguard.api.Severity;
import com.loopguard.api.ViolationKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlobalStatePolicyCheckerTest {

    private static final Path FIXTURE_ROOT =
        Paths.get(System.getProperty("user.dir"))
             .getParent()
             .resolve("test-fixtures/blocking-service/src/main/java/com/loopguard/fixture");

    private final GlobalStatePolicyChecker checker = new GlobalStatePolicyChecker();

    private static List<String> symbols(ScanReport report) {
        return report.violations().stream().map(BlockingViolation::symbol).toList();
    }

    @Test
    void environmentAndPropertyAccessAreReported() {
        ScanReport report = checker.scan(
            "class Config {\n  String read() {\n    System.setProperty(\"a\", \"b\");\n"
                + "    return System.getenv(\"HOME\") + System.getProperties();\n  }\n}", "Config.java");
        assertEquals(List.of("System.setProperty", "System.getenv", "System.getProperties"), symbols(report));
        assertTrue(report.violations().stream().allMatch(v ->
            v.kind() == ViolationKind.GLOBAL_STATE_ACCESS && v.severity() == Severity.WARNING));
        assertTrue(report.violations().stream().allMatch(v -> v.suggestion() != null && !v.suggestion().isEmpty()));
        assertTrue(report.isSafe());
    }

    @Test
    void sessionAccessIsReported() {
        ScanReport report = checker.scan(
            "class Login { void f(Object request) { request.getSession(true); } }", "Login.java");
        assertEquals(List.of("HttpServletRequest.getSession"), symbols(report));
    }

    @Test
    void writesToStaticFieldsAreReported() {
        ScanReport report = checker.scan(
            "class Stats {\n"
                + "  static int hits;\n"
                + "  static String last;\n"
                + "  void record(String s) {\n"
                + "    hits++;\n"
                + "    Stats.last = s;\n"
                + "    --hits;\n"
                + "  }\n"
                + "}", "Stats.java");
        assertEquals(List.of("Stats.hits", "Stats.last", "Stats.hits"), symbols(report));
        assertEquals(List.of(5, 6, 7), report.violations().stream().map(BlockingViolation::line).toList());
        assertTrue(report.violations().stream().allMatch(v -> v.kind() == ViolationKind.STATIC_MUTABLE_ACCESS));
    }

    @Test
    void writesToInstanceAndFinalFieldsAreIgnored() {
        ScanReport report = checker.scan(
            "class Counter {\n"
                + "  int count;\n"
                + "  static final int[] LIMITS = {1};\n"
                + "  void inc() { count++; this.count = 2; int local = 0; local++; }\n"
                + "}", "Counter.java");
        assertTrue(report.violations().isEmpty(), () -> symbols(report).toString());
    }

    @Test
    void blockingCallsAreOutOfScope() {
        ScanReport report = checker.scan(
            "class A { void f() throws Exception { Thread.sleep(1); System.exit(0); } }", "A.java");
        assertTrue(report.violations().isEmpty());
    }

    @Test
    void staticThreadLocalIsReportedEvenWhenFinal() {
        ScanReport report = checker.scan(
            "class Holder { private static final ThreadLocal<String> USER = new ThreadLocal<>(); }", "Holder.java");
        assertEquals(List.of("Holder.USER"), symbols(report));
    }

    @Test
    void sessionHandlerFixtureHasFiveFindings() {
        ScanReport report = checker.scanFile(FIXTURE_ROOT.resolve("SessionHandler.java"));
        assertFalse(report.hasError(), report.error());
        assertEquals(List.of("SessionHandler.CURRENT_USER", "SessionHandler.requestCount",
                "Locale.setDefault", "System.setProperty", "System.getenv"), symbols(report));
        assertEquals(5, report.summary().warnings());
    }

    @Test
    void parseErrorIsReportedNotThrown() {
        ScanReport report = checker.scan("class {", "Broken.java");
        assertTrue(report.hasError());
    }
}
