package org.pragmatica.syntax;

/**
 * Parameters of a generic parameter clause.
 */
public final class GenericParameterListSyntax extends SyntaxCollection<GenericParameterSyntax, GenericParameterListSyntax> {
    GenericParameterListSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent, GenericParameterSyntax.class, GenericParameterListSyntax.class);
    }
}
