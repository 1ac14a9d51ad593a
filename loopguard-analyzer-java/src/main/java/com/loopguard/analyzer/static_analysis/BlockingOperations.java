package com.loopguard.analyzer.static_analysis;

import static com.loopguard.api.Severity.ERROR;
import static com.loopguard.api.Severity.WARNING;
import static com.loopguard.api.ViolationKind.BLOCKING_CALL;
import static com.loopguard.api.ViolationKind.GLOBAL_STATE_ACCESS;
import static com.loopguard.api.ViolationKind.UNSAFE_CALL;

/**
 * Operations known to stall a single-threaded event loop, and operations that are only
 * dangerous when many requests share one process.
 */
public final class BlockingOperations {

    private static final String USE_TIMER =
        "Schedule the continuation on the event loop instead of sleeping";
    private static final String USE_ASYNC_FILES =
        "Use AsynchronousFileChannel or move file I/O off the event loop";
    private static final String USE_ASYNC_NET =
        "Use a non-blocking client (NIO channels or an async HTTP client)";
    private static final String USE_ASYNC_PROCESS =
        "Use Process.onExit() and react to the returned CompletableFuture";
    private static final String USE_CALLBACK =
        "Register a callback (thenAccept/whenComplete) instead of waiting";
    private static final String USE_ASYNC_DB =
        "Use an asynchronous database driver or a bounded worker pool";
    private static final String NO_EXIT =
        "Never terminate the process from request code; return an error response";

    private static final OperationTable DEFAULT = OperationTable.builder()
        .staticCall(BLOCKING_CALL, ERROR, "java.lang.Thread", USE_TIMER, "sleep")
        .staticCall(BLOCKING_CALL, ERROR, "java.util.concurrent.TimeUnit", USE_TIMER, "sleep")
        .staticCall(BLOCKING_CALL, ERROR, "java.util.concurrent.locks.LockSupport", USE_CALLBACK,
            "park", "parkNanos", "parkUntil")
        .staticCall(BLOCKING_CALL, ERROR, "java.nio.file.Files", USE_ASYNC_FILES,
            "readAllBytes", "readAllLines", "readString", "lines", "write", "writeString", "copy",
            "newInputStream", "newOutputStream", "newBufferedReader", "newBufferedWriter")
        .construction(BLOCKING_CALL, ERROR, USE_ASYNC_FILES,
            "java.io.FileInputStream", "java.io.FileOutputStream", "java.io.FileReader",
            "java.io.FileWriter", "java.io.RandomAccessFile")
        .construction(BLOCKING_CALL, ERROR, USE_ASYNC_NET, "java.net.Socket", "java.net.ServerSocket")
        .instanceCall(BLOCKING_CALL, ERROR, "URL", "openStream", 0, USE_ASYNC_NET)
        .instanceCall(BLOCKING_CALL, ERROR, "URL", "openConnection", OperationRule.ANY_ARITY, USE_ASYNC_NET)
        .instanceCall(BLOCKING_CALL, ERROR, "Process", "waitFor", OperationRule.ANY_ARITY, USE_ASYNC_PROCESS)
        .instanceCall(BLOCKING_CALL, ERROR, "Runtime", "exec", OperationRule.ANY_ARITY, USE_ASYNC_PROCESS)
        .instanceCall(BLOCKING_CALL, ERROR, "Thread", "join", 0, USE_CALLBACK)
        .instanceCall(BLOCKING_CALL, ERROR, "CountDownLatch", "await", OperationRule.ANY_ARITY, USE_CALLBACK)
        .instanceCall(BLOCKING_CALL, ERROR, "ExecutorService", "awaitTermination",
            OperationRule.ANY_ARITY, USE_CALLBACK)
        .staticCall(BLOCKING_CALL, ERROR, "java.sql.DriverManager", USE_ASYNC_DB, "getConnection")
        .instanceCall(BLOCKING_CALL, ERROR, "Statement", "executeQuery", OperationRule.ANY_ARITY, USE_ASYNC_DB)
        .instanceCall(BLOCKING_CALL, ERROR, "Statement", "executeUpdate", OperationRule.ANY_ARITY, USE_ASYNC_DB)
        .staticCall(BLOCKING_CALL, ERROR, "java.lang.System", NO_EXIT, "exit")
        .instanceCall(BLOCKING_CALL, ERROR, "Runtime", "halt", OperationRule.ANY_ARITY, NO_EXIT)

        .staticCall(UNSAFE_CALL, WARNING, "java.lang.System",
            "Pass configuration explicitly; system properties are shared by every request",
            "setProperty", "clearProperty", "setProperties")
        .staticCall(UNSAFE_CALL, WARNING, "java.lang.System",
            "Write to a per-request stream instead of replacing the process streams",
            "setOut", "setErr", "setIn")
        .staticCall(UNSAFE_CALL, WARNING, "java.util.Locale",
            "Pass a Locale to the formatting call instead of changing the default", "setDefault")
        .staticCall(UNSAFE_CALL, WARNING, "java.util.TimeZone",
            "Pass a ZoneId explicitly instead of changing the default", "setDefault")
        .instanceCall(UNSAFE_CALL, WARNING, "HttpServletRequest", "getSession", OperationRule.ANY_ARITY,
            "Keep session data in a request-scoped store keyed by session id")
        .staticCall(UNSAFE_CALL, WARNING, "java.lang.Thread",
            "Install handlers once at startup, not per request", "setDefaultUncaughtExceptionHandler")
        .staticCall(UNSAFE_CALL, WARNING, "java.lang.System",
            "Let the memory guard decide when to collect", "gc")
        .staticCall(UNSAFE_CALL, WARNING, "java.lang.System",
            "Configure security once at startup", "setSecurityManager")

        .staticCall(GLOBAL_STATE_ACCESS, WARNING, "java.lang.System",
            "Read configuration once at startup and inject it", "getenv", "getProperties")
        .build();

    private BlockingOperations() {}

    public static OperationTable defaultTable() {
        return DEFAULT;
    }
}
