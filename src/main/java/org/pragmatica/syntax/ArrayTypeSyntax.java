package org.pragmatica.syntax;

/**
 * Sugared array type {@code [Element]}.
 */
public final class ArrayTypeSyntax extends TypeSyntax {
    private static final int LEFT_SQUARE_BRACKET = 0;
    private static final int ELEMENT_TYPE = 1;
    private static final int RIGHT_SQUARE_BRACKET = 2;

    ArrayTypeSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax leftSquareBracket() {
        return requiredChild(LEFT_SQUARE_BRACKET, TokenSyntax.class);
    }

    public ArrayTypeSyntax withLeftSquareBracket(TokenSyntax bracket) {
        return (ArrayTypeSyntax) withChild(LEFT_SQUARE_BRACKET, bracket);
    }

    public TypeSyntax elementType() {
        return requiredChild(ELEMENT_TYPE, TypeSyntax.class);
    }

    public ArrayTypeSyntax withElementType(TypeSyntax elementType) {
        return (ArrayTypeSyntax) withChild(ELEMENT_TYPE, elementType);
    }

    public TokenSyntax rightSquareBracket() {
        return requiredChild(RIGHT_SQUARE_BRACKET, TokenSyntax.class);
    }

    public ArrayTypeSyntax withRightSquareBracket(TokenSyntax bracket) {
        return (ArrayTypeSyntax) withChild(RIGHT_SQUARE_BRACKET, bracket);
    }
}
