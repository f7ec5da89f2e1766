package org.pragmatica.syntax;

/**
 * Argument list of a function type.
 */
public final class TypeArgumentListSyntax extends SyntaxCollection<FunctionTypeArgumentSyntax, TypeArgumentListSyntax> {
    TypeArgumentListSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent, FunctionTypeArgumentSyntax.class, TypeArgumentListSyntax.class);
    }
}
