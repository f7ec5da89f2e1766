package org.pragmatica.syntax;

/**
 * Members between the braces of a type declaration.
 */
public final class DeclMembersSyntax extends SyntaxCollection<DeclSyntax, DeclMembersSyntax> {
    DeclMembersSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent, DeclSyntax.class, DeclMembersSyntax.class);
    }
}
