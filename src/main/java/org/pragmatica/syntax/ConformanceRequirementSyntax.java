package org.pragmatica.syntax;

import java.util.Optional;

/**
 * {@code Left: Protocol}
 */
public final class ConformanceRequirementSyntax extends GenericRequirementSyntax {
    private static final int LEFT_TYPE = 0;
    private static final int COLON = 1;
    private static final int RIGHT_TYPE = 2;
    private static final int COMMA = 3;

    ConformanceRequirementSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    @Override
    public TypeIdentifierSyntax leftType() {
        return requiredChild(LEFT_TYPE, TypeIdentifierSyntax.class);
    }

    public ConformanceRequirementSyntax withLeftType(TypeIdentifierSyntax leftType) {
        return (ConformanceRequirementSyntax) withChild(LEFT_TYPE, leftType);
    }

    public TokenSyntax colon() {
        return requiredChild(COLON, TokenSyntax.class);
    }

    public ConformanceRequirementSyntax withColon(TokenSyntax colon) {
        return (ConformanceRequirementSyntax) withChild(COLON, colon);
    }

    public TypeIdentifierSyntax rightType() {
        return requiredChild(RIGHT_TYPE, TypeIdentifierSyntax.class);
    }

    public ConformanceRequirementSyntax withRightType(TypeIdentifierSyntax rightType) {
        return (ConformanceRequirementSyntax) withChild(RIGHT_TYPE, rightType);
    }

    @Override
    public Optional<TokenSyntax> comma() {
        return optionalChild(COMMA, TokenSyntax.class);
    }

    public ConformanceRequirementSyntax withComma(Optional<TokenSyntax> comma) {
        return (ConformanceRequirementSyntax) withOptionalChild(COMMA, comma);
    }
}
