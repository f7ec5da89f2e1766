package org.pragmatica.syntax;

/**
 * Elements of a tuple type.
 */
public final class TupleTypeElementListSyntax extends SyntaxCollection<TupleTypeElementSyntax, TupleTypeElementListSyntax> {
    TupleTypeElementListSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent, TupleTypeElementSyntax.class, TupleTypeElementListSyntax.class);
    }
}
