package org.pragmatica.syntax;

/**
 * Tokens the parser could not fit into any known construct. Kept verbatim so the source still round-trips.
 */
public final class UnknownSyntax extends SyntaxCollection<TokenSyntax, UnknownSyntax> implements CodeBlockItem {
    UnknownSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent, TokenSyntax.class, UnknownSyntax.class);
    }
}
