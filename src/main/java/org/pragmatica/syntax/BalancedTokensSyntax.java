package org.pragmatica.syntax;

/**
 * Raw tokens between the parentheses of an attribute argument list.
 */
public final class BalancedTokensSyntax extends SyntaxCollection<TokenSyntax, BalancedTokensSyntax> {
    BalancedTokensSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent, TokenSyntax.class, BalancedTokensSyntax.class);
    }
}
