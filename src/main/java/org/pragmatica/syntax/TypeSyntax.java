package org.pragmatica.syntax;

/**
 * Base of type views. Any slot typed {@code TypeSyntax} accepts every subclass.
 */
public abstract sealed class TypeSyntax extends Syntax
    permits TypeIdentifierSyntax,
            TupleTypeSyntax,
            OptionalTypeSyntax,
            ImplicitlyUnwrappedOptionalTypeSyntax,
            MetatypeTypeSyntax,
            ArrayTypeSyntax,
            DictionaryTypeSyntax,
            FunctionTypeSyntax {
    TypeSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }
}
