package org.pragmatica.syntax;

import java.util.Optional;

/**
 * {@code Left == Right}
 */
public final class SameTypeRequirementSyntax extends GenericRequirementSyntax {
    private static final int LEFT_TYPE = 0;
    private static final int EQUALITY_TOKEN = 1;
    private static final int RIGHT_TYPE = 2;
    private static final int COMMA = 3;

    SameTypeRequirementSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    @Override
    public TypeIdentifierSyntax leftType() {
        return requiredChild(LEFT_TYPE, TypeIdentifierSyntax.class);
    }

    public SameTypeRequirementSyntax withLeftType(TypeIdentifierSyntax leftType) {
        return (SameTypeRequirementSyntax) withChild(LEFT_TYPE, leftType);
    }

    public TokenSyntax equalityToken() {
        return requiredChild(EQUALITY_TOKEN, TokenSyntax.class);
    }

    public SameTypeRequirementSyntax withEqualityToken(TokenSyntax equality) {
        return (SameTypeRequirementSyntax) withChild(EQUALITY_TOKEN, equality);
    }

    public TypeSyntax rightType() {
        return requiredChild(RIGHT_TYPE, TypeSyntax.class);
    }

    public SameTypeRequirementSyntax withRightType(TypeSyntax rightType) {
        return (SameTypeRequirementSyntax) withChild(RIGHT_TYPE, rightType);
    }

    @Override
    public Optional<TokenSyntax> comma() {
        return optionalChild(COMMA, TokenSyntax.class);
    }

    public SameTypeRequirementSyntax withComma(Optional<TokenSyntax> comma) {
        return (SameTypeRequirementSyntax) withOptionalChild(COMMA, comma);
    }
}
