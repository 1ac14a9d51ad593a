package com.loopguard.analyzer.policy;

import com.loopguard.analyzer.static_analysis.OperationRule;
import com.loopguard.analyzer.static_analysis.OperationTable;

import static com.loopguard.api.Severity.WARNING;
import static com.loopguard.api.ViolationKind.GLOBAL_STATE_ACCESS;

/**
 * Calls that read or write process-wide ambient state.
 */
final class GlobalStateOperations {

    static final OperationTable TABLE = OperationTable.builder()
        .staticCall(GLOBAL_STATE_ACCESS, WARNING, "java.lang.System",
            "Read environment and properties once at startup and inject them as configuration",
            "getenv", "getProperties")
        .staticCall(GLOBAL_STATE_ACCESS, WARNING, "java.lang.System",
            "Pass the value explicitly; system properties are shared by every request",
            "setProperty", "clearProperty", "setProperties")
        .staticCall(GLOBAL_STATE_ACCESS, WARNING, "java.util.Locale",
            "Pass a Locale to the formatting call instead of changing the default", "setDefault")
        .staticCall(GLOBAL_STATE_ACCESS, WARNING, "java.util.TimeZone",
            "Pass a ZoneId explicitly instead of changing the default", "setDefault")
        .instanceCall(GLOBAL_STATE_ACCESS, WARNING, "HttpServletRequest", "getSession",
            OperationRule.ANY_ARITY, "Keep session data in a request-scoped store keyed by session id")
        .build();

    private GlobalStateOperations() {}
}
