package org.pragmatica.syntax;

/**
 * Braced list of statements.
 */
public final class CodeBlockStmtSyntax extends StmtSyntax {
    private static final int LEFT_BRACE = 0;
    private static final int STATEMENTS = 1;
    private static final int RIGHT_BRACE = 2;

    CodeBlockStmtSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax leftBrace() {
        return requiredChild(LEFT_BRACE, TokenSyntax.class);
    }

    public CodeBlockStmtSyntax withLeftBrace(TokenSyntax leftBrace) {
        return (CodeBlockStmtSyntax) withChild(LEFT_BRACE, leftBrace);
    }

    public StmtListSyntax statements() {
        return requiredChild(STATEMENTS, StmtListSyntax.class);
    }

    public CodeBlockStmtSyntax withStatements(StmtListSyntax statements) {
        return (CodeBlockStmtSyntax) withChild(STATEMENTS, statements);
    }

    public CodeBlockStmtSyntax addingStatement(CodeBlockItem item) {
        return (CodeBlockStmtSyntax) withAppended(STATEMENTS, (Syntax) item);
    }

    public TokenSyntax rightBrace() {
        return requiredChild(RIGHT_BRACE, TokenSyntax.class);
    }

    public CodeBlockStmtSyntax withRightBrace(TokenSyntax rightBrace) {
        return (CodeBlockStmtSyntax) withChild(RIGHT_BRACE, rightBrace);
    }
}
