package org.pragmatica.syntax;

/**
 * Arguments of a generic argument clause.
 */
public final class GenericArgumentListSyntax extends SyntaxCollection<GenericArgumentSyntax, GenericArgumentListSyntax> {
    GenericArgumentListSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent, GenericArgumentSyntax.class, GenericArgumentListSyntax.class);
    }
}
