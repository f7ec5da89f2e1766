package org.pragmatica.syntax;

import java.util.Optional;

/**
 * {@code break} with an optional destination label.
 */
public final class BreakStmtSyntax extends StmtSyntax {
    private static final int BREAK_KEYWORD = 0;
    private static final int LABEL = 1;

    BreakStmtSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax breakKeyword() {
        return requiredChild(BREAK_KEYWORD, TokenSyntax.class);
    }

    public BreakStmtSyntax withBreakKeyword(TokenSyntax keyword) {
        return (BreakStmtSyntax) withChild(BREAK_KEYWORD, keyword);
    }

    public Optional<TokenSyntax> label() {
        return optionalChild(LABEL, TokenSyntax.class);
    }

    public BreakStmtSyntax withLabel(Optional<TokenSyntax> label) {
        return (BreakStmtSyntax) withOptionalChild(LABEL, label);
    }
}
