package org.pragmatica.syntax;

/**
 * {@code Type!}
 */
public final class ImplicitlyUnwrappedOptionalTypeSyntax extends TypeSyntax {
    private static final int BASE_TYPE = 0;
    private static final int EXCLAMATION_MARK = 1;

    ImplicitlyUnwrappedOptionalTypeSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TypeSyntax baseType() {
        return requiredChild(BASE_TYPE, TypeSyntax.class);
    }

    public ImplicitlyUnwrappedOptionalTypeSyntax withBaseType(TypeSyntax baseType) {
        return (ImplicitlyUnwrappedOptionalTypeSyntax) withChild(BASE_TYPE, baseType);
    }

    public TokenSyntax exclamationMark() {
        return requiredChild(EXCLAMATION_MARK, TokenSyntax.class);
    }

    public ImplicitlyUnwrappedOptionalTypeSyntax withExclamationMark(TokenSyntax exclamationMark) {
        return (ImplicitlyUnwrappedOptionalTypeSyntax) withChild(EXCLAMATION_MARK, exclamationMark);
    }
}
