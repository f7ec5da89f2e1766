package org.pragmatica.syntax;

/**
 * Base of statement views.
 */
public abstract sealed class StmtSyntax extends Syntax implements CodeBlockItem
    permits CodeBlockStmtSyntax, FallthroughStmtSyntax, BreakStmtSyntax {
    StmtSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }
}
