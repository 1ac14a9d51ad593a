package com.loopguard.analyzer.static_analysis;

import com.loopguard.analyzer.report.ScanReport;
import org.eclipse.jdt.core.dom.CompilationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parse-then-visit skeleton shared by the source analyzers. Parse failures and unexpected
 * parser exceptions become error reports.
 */
public abstract class AbstractSourceAnalyzer implements SourceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(AbstractSourceAnalyzer.class);

    private final JdtSourceParser parser;
    protected final OperationTable table;

    protected AbstractSourceAnalyzer(JdtSourceParser parser, OperationTable table) {
        this.parser = parser;
        this.table = table;
    }

    protected abstract OperationVisitor newVisitor(CompilationUnit unit, String context);

    @Override
    public ScanReport scan(String sourceText, String contextLabel) {
        String context = contextLabel != null ? contextLabel : "unknown";
        CompilationUnit unit;
        try {
            unit = parser.parse(sourceText, context);
        } catch (JdtSourceParser.SourceParseException e) {
            log.warn("Could not parse {}: {}", context, e.getMessage());
            return ScanReport.failed(context, "Parse error: " + e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Parser failed on {}", context, e);
            return ScanReport.failed(context, "Parse error: " + e);
        }

        OperationVisitor visitor = newVisitor(unit, context);
        unit.accept(visitor);
        ScanReport report = ScanReport.of(context, visitor.getViolations());
        log.debug("Scanned {}: {} findings", context, report.violations().size());
        return report;
    }
}
