package org.pragmatica.syntax;

/**
 * Sugared dictionary type {@code [Key: Value]}.
 */
public final class DictionaryTypeSyntax extends TypeSyntax {
    private static final int LEFT_SQUARE_BRACKET = 0;
    private static final int KEY_TYPE = 1;
    private static final int COLON = 2;
    private static final int VALUE_TYPE = 3;
    private static final int RIGHT_SQUARE_BRACKET = 4;

    DictionaryTypeSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax leftSquareBracket() {
        return requiredChild(LEFT_SQUARE_BRACKET, TokenSyntax.class);
    }

    public DictionaryTypeSyntax withLeftSquareBracket(TokenSyntax bracket) {
        return (DictionaryTypeSyntax) withChild(LEFT_SQUARE_BRACKET, bracket);
    }

    public TypeSyntax keyType() {
        return requiredChild(KEY_TYPE, TypeSyntax.class);
    }

    public DictionaryTypeSyntax withKeyType(TypeSyntax keyType) {
        return (DictionaryTypeSyntax) withChild(KEY_TYPE, keyType);
    }

    public TokenSyntax colon() {
        return requiredChild(COLON, TokenSyntax.class);
    }

    public DictionaryTypeSyntax withColon(TokenSyntax colon) {
        return (DictionaryTypeSyntax) withChild(COLON, colon);
    }

    public TypeSyntax valueType() {
        return requiredChild(VALUE_TYPE, TypeSyntax.class);
    }

    public DictionaryTypeSyntax withValueType(TypeSyntax valueType) {
        return (DictionaryTypeSyntax) withChild(VALUE_TYPE, valueType);
    }

    public TokenSyntax rightSquareBracket() {
        return requiredChild(RIGHT_SQUARE_BRACKET, TokenSyntax.class);
    }

    public DictionaryTypeSyntax withRightSquareBracket(TokenSyntax bracket) {
        return (DictionaryTypeSyntax) withChild(RIGHT_SQUARE_BRACKET, bracket);
    }
}
