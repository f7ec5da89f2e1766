package org.pragmatica.syntax;

/**
 * {@code Type?}
 */
public final class OptionalTypeSyntax extends TypeSyntax {
    private static final int BASE_TYPE = 0;
    private static final int QUESTION_MARK = 1;

    OptionalTypeSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TypeSyntax baseType() {
        return requiredChild(BASE_TYPE, TypeSyntax.class);
    }

    public OptionalTypeSyntax withBaseType(TypeSyntax baseType) {
        return (OptionalTypeSyntax) withChild(BASE_TYPE, baseType);
    }

    public TokenSyntax questionMark() {
        return requiredChild(QUESTION_MARK, TokenSyntax.class);
    }

    public OptionalTypeSyntax withQuestionMark(TokenSyntax questionMark) {
        return (OptionalTypeSyntax) withChild(QUESTION_MARK, questionMark);
    }
}
