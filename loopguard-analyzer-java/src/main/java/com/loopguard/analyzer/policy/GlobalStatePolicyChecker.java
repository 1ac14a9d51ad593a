package com.loopguard.analyzer.policy;

import com.loopguard.analyzer.static_analysis.AbstractSourceAnalyzer;
import com.loopguard.analyzer.static_analysis.JdtSourceParser;
import com.loopguard.analyzer.static_analysis.OperationVisitor;
import org.eclipse.jdt.core.dom.CompilationUnit;

/**
 * Global-State Policy Checker: flags code that reads or mutates process-wide state which
 * would leak between requests served by one long-lived process. All findings are warnings
 * and each carries a request-scoped alternative.
 */
public class GlobalStatePolicyChecker extends AbstractSourceAnalyzer {

    public GlobalStatePolicyChecker() {
        this(new JdtSourceParser());
    }

    public GlobalStatePolicyChecker(JdtSourceParser parser) {
        super(parser, GlobalStateOperations.TABLE);
    }

    @Override
    protected OperationVisitor newVisitor(CompilationUnit unit, String context) {
        return new GlobalStateVisitor(unit, context, table);
    }
}
