package com.loopguard.analyzer;

import com.loopguard.analyzer.policy.GlobalStatePolicyChecker;
import com.loopguard.analyzer.report.ProjectScanReport;
import com.loopguard.analyzer.report.ReportWriter;
import com.loopguard.analyzer.report.ScanReport;
import com.loopguard.analyzer.static_analysis.BlockingCodeScanner;
import com.loopguard.analyzer.static_analysis.CompositeAnalyzer;
import com.loopguard.analyzer.static_analysis.SourceAnalyzer;
import com.loopguard.analyzer.static_analysis.SourceTreeScanner;
import com.loopguard.api.BlockingViolation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point of the static analyzer.
 *
 * Usage:
 *   java -jar loopguard-analyzer-java.jar scan \
 *     --source <file-or-directory> \
 *     [--output <report.json>] \
 *     [--policy blocking|global-state|all]
 *
 * Exit codes: 0 no blocking findings, 3 blocking findings present, 2 usage error, 1 fatal error.
 */
public class AnalyzerMain {

    private static final Logger log = LoggerFactory.getLogger(AnalyzerMain.class);

    static final int EXIT_SAFE = 0;
    static final int EXIT_FATAL = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_BLOCKING = 3;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String[] args) {
        try {
            return run(args);
        } catch (UsageException e) {
            log.error("{}", e.getMessage());
            System.err.println("Usage: java -jar loopguard-analyzer-java.jar scan "
                + "--source <path> [--output <report.json>] [--policy blocking|global-state|all]");
            return EXIT_USAGE;
        } catch (Exception e) {
            log.error("Scan failed: {}", e.getMessage(), e);
            return EXIT_FATAL;
        }
    }

    static int run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("scan")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String source = null;
        String output = null;
        String policy = "blocking";

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--source" -> source = requireNext(args, i++, "--source");
                case "--output" -> output = requireNext(args, i++, "--output");
                case "--policy" -> policy = requireNext(args, i++, "--policy");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (source == null) throw new UsageException("--source is required");

        SourceAnalyzer analyzer = analyzerFor(policy);
        Path sourcePath = Paths.get(source);

        log.info("Scanning {} with policy '{}'", sourcePath, policy);
        ProjectScanReport report = new SourceTreeScanner().scanTree(sourcePath, analyzer);

        for (ScanReport file : report.files()) {
            if (file.hasError()) {
                log.warn("{}: {}", file.context(), file.error());
            }
            for (BlockingViolation v : file.violations()) {
                log.warn("{} [{}] {}", v.location(), v.severity(), v.message());
            }
        }
        log.info("Scan complete: {} findings, {} blocking, {} warnings, {} unreadable files",
            report.summary().total(), report.summary().blocking(),
            report.summary().warnings(), report.errors());

        if (output != null) {
            new ReportWriter().write(report, Paths.get(output));
        }
        return report.hasBlockingFindings() ? EXIT_BLOCKING : EXIT_SAFE;
    }

    static SourceAnalyzer analyzerFor(String policy) {
        return switch (policy) {
            case "blocking" -> new BlockingCodeScanner();
            case "global-state" -> new GlobalStatePolicyChecker();
            case "all" -> new CompositeAnalyzer(new BlockingCodeScanner(), new GlobalStatePolicyChecker());
            default -> throw new UsageException("Unknown policy: " + policy);
        };
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
