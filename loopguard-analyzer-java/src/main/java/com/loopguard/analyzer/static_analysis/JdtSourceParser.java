package com.loopguard.analyzer.static_analysis;

import org.eclipse.jdt.core.JavaCore;
import org.eclipse.jdt.core.compiler.IProblem;
import org.eclipse.jdt.core.dom.AST;
import org.eclipse.jdt.core.dom.ASTParser;
import org.eclipse.jdt.core.dom.CompilationUnit;

import java.util.Map;

/**
 * Wrapper around Eclipse JDT's ASTParser.
 * Parses a single unit of Java source text without binding resolution: every rule the
 * scanners apply is syntactic, so no classpath is needed.
 */
public class JdtSourceParser {

    private final Map<String, String> compilerOptions;

    public JdtSourceParser() {
        Map<String, String> options = JavaCore.getOptions();
        JavaCore.setComplianceOptions(JavaCore.VERSION_17, options);
        this.compilerOptions = options;
    }

    /**
     * Parse {@code sourceText} into a compilation unit.
     *
     * @throws SourceParseException if the text has syntax errors
     */
    public CompilationUnit parse(String sourceText, String unitLabel) {
        if (sourceText == null) {
            throw new SourceParseException("No source text for " + unitLabel);
        }
        ASTParser parser = ASTParser.newParser(AST.JLS17);
        parser.setKind(ASTParser.K_COMPILATION_UNIT);
        parser.setCompilerOptions(compilerOptions);
        parser.setResolveBindings(false);
        parser.setStatementsRecovery(false);
        parser.setSource(sourceText.toCharArray());

        CompilationUnit cu = (CompilationUnit) parser.createAST(null);
        for (IProblem problem : cu.getProblems()) {
            if (problem.isError()) {
                throw new SourceParseException(problem.getMessage()
                    + " (line " + problem.getSourceLineNumber() + ")");
            }
        }
        return cu;
    }

    public static class SourceParseException extends RuntimeException {
        public SourceParseException(String message) { super(message); }
    }
}
