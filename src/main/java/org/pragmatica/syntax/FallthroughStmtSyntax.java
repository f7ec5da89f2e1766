package org.pragmatica.syntax;

public final class FallthroughStmtSyntax extends StmtSyntax {
    private static final int FALLTHROUGH_KEYWORD = 0;

    FallthroughStmtSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax fallthroughKeyword() {
        return requiredChild(FALLTHROUGH_KEYWORD, TokenSyntax.class);
    }

    public FallthroughStmtSyntax withFallthroughKeyword(TokenSyntax keyword) {
        return (FallthroughStmtSyntax) withChild(FALLTHROUGH_KEYWORD, keyword);
    }
}
