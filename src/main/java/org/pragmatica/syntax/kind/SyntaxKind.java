package org.pragmatica.syntax.kind;

/**
 * Kind tag of a syntax node: either a terminal {@link TokenKind} or a {@link NodeKind} with a layout.
 */
public sealed interface SyntaxKind permits TokenKind, NodeKind {
    String name();

    boolean isToken();
}
