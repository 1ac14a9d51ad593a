package com.loopguard.analyzer.static_analysis;

import org.eclipse.jdt.core.dom.CompilationUnit;

/**
 * Static Blocking Analyzer: reports calls that would stall the event loop, calls that change
 * process-wide state, static mutable fields and loops that never exit.
 */
public class BlockingCodeScanner extends AbstractSourceAnalyzer {

    public BlockingCodeScanner() {
        this(new JdtSourceParser(), BlockingOperations.defaultTable());
    }

    public BlockingCodeScanner(JdtSourceParser parser, OperationTable table) {
        super(parser, table);
    }

    @Override
    protected OperationVisitor newVisitor(CompilationUnit unit, String context) {
        return new BlockingCodeVisitor(unit, context, table);
    }
}
