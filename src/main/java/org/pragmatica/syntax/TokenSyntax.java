package org.pragmatica.syntax;

import org.pragmatica.syntax.kind.TokenKind;
import org.pragmatica.syntax.tree.Trivia;

/**
 * View over a token: its kind, literal text and attached trivia.
 */
public final class TokenSyntax extends Syntax {
    TokenSyntax(RawToken raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    private RawToken token() {
        return (RawToken) raw();
    }

    @Override
    public TokenKind kind() {
        return token().kind();
    }

    public TokenKind tokenKind() {
        return token().kind();
    }

    /**
     * Literal token text without trivia; empty for a missing token.
     */
    public String tokenText() {
        return token().tokenText();
    }

    public Trivia leadingTrivia() {
        return token().leadingTrivia();
    }

    public Trivia trailingTrivia() {
        return token().trailingTrivia();
    }

    public boolean isKeyword() {
        return tokenKind().isKeyword();
    }

    public boolean isPunctuation() {
        return tokenKind().isPunctuation();
    }

    public TokenSyntax withLeadingTrivia(Trivia trivia) {
        return (TokenSyntax) replacingSelf(token().withLeadingTrivia(trivia));
    }

    public TokenSyntax withTrailingTrivia(Trivia trivia) {
        return (TokenSyntax) replacingSelf(token().withTrailingTrivia(trivia));
    }

    /**
     * Same token with different text. Keywords and punctuation only accept their own spelling.
     * A missing token given text becomes present.
     */
    public TokenSyntax withText(String text) {
        return (TokenSyntax) replacingSelf(token().withText(text));
    }
}
