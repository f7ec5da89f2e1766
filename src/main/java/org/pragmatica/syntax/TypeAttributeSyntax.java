package org.pragmatica.syntax;

import java.util.Optional;

/**
 * {@code @name} or {@code @name(balanced tokens)}.
 */
public final class TypeAttributeSyntax extends Syntax {
    private static final int AT_SIGN = 0;
    private static final int IDENTIFIER = 1;
    private static final int LEFT_PAREN = 2;
    private static final int BALANCED_TOKENS = 3;
    private static final int RIGHT_PAREN = 4;

    TypeAttributeSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax atSign() {
        return requiredChild(AT_SIGN, TokenSyntax.class);
    }

    public TypeAttributeSyntax withAtSign(TokenSyntax atSign) {
        return (TypeAttributeSyntax) withChild(AT_SIGN, atSign);
    }

    public TokenSyntax identifier() {
        return requiredChild(IDENTIFIER, TokenSyntax.class);
    }

    public TypeAttributeSyntax withIdentifier(TokenSyntax identifier) {
        return (TypeAttributeSyntax) withChild(IDENTIFIER, identifier);
    }

    public Optional<TokenSyntax> leftParen() {
        return optionalChild(LEFT_PAREN, TokenSyntax.class);
    }

    public TypeAttributeSyntax withLeftParen(Optional<TokenSyntax> leftParen) {
        return (TypeAttributeSyntax) withOptionalChild(LEFT_PAREN, leftParen);
    }

    public Optional<BalancedTokensSyntax> balancedTokens() {
        return optionalChild(BALANCED_TOKENS, BalancedTokensSyntax.class);
    }

    public TypeAttributeSyntax withBalancedTokens(Optional<BalancedTokensSyntax> tokens) {
        return (TypeAttributeSyntax) withOptionalChild(BALANCED_TOKENS, tokens);
    }

    public Optional<TokenSyntax> rightParen() {
        return optionalChild(RIGHT_PAREN, TokenSyntax.class);
    }

    public TypeAttributeSyntax withRightParen(Optional<TokenSyntax> rightParen) {
        return (TypeAttributeSyntax) withOptionalChild(RIGHT_PAREN, rightParen);
    }
}
