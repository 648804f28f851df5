package org.dxworks.cobolscope.analyzer;

import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.model.PartialResult;

/**
 * One kind of analysis over an immutable program AST. Implementations hold no per-call state, so a single
 * instance may serve concurrent calls.
 */
public interface Analyzer<R extends PartialResult> {

    String name();

    R analyze(AstNode program, AnalysisContext context);
}
