package org.pragmatica.syntax;

/**
 * {@code (label: Type, Type)}; the empty tuple {@code ()} is the void type.
 */
public final class TupleTypeSyntax extends TypeSyntax {
    private static final int LEFT_PAREN = 0;
    private static final int ELEMENTS = 1;
    private static final int RIGHT_PAREN = 2;

    TupleTypeSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax leftParen() {
        return requiredChild(LEFT_PAREN, TokenSyntax.class);
    }

    public TupleTypeSyntax withLeftParen(TokenSyntax leftParen) {
        return (TupleTypeSyntax) withChild(LEFT_PAREN, leftParen);
    }

    public TupleTypeElementListSyntax elements() {
        return requiredChild(ELEMENTS, TupleTypeElementListSyntax.class);
    }

    public TupleTypeSyntax withElements(TupleTypeElementListSyntax elements) {
        return (TupleTypeSyntax) withChild(ELEMENTS, elements);
    }

    public TupleTypeSyntax addingElement(TupleTypeElementSyntax element) {
        return (TupleTypeSyntax) withAppended(ELEMENTS, element);
    }

    public TokenSyntax rightParen() {
        return requiredChild(RIGHT_PAREN, TokenSyntax.class);
    }

    public TupleTypeSyntax withRightParen(TokenSyntax rightParen) {
        return (TupleTypeSyntax) withChild(RIGHT_PAREN, rightParen);
    }
}
