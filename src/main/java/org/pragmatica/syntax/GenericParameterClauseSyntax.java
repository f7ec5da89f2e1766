package org.pragmatica.syntax;

/**
 * {@code <T, U: Equatable>}
 */
public final class GenericParameterClauseSyntax extends Syntax {
    private static final int LEFT_ANGLE = 0;
    private static final int PARAMETERS = 1;
    private static final int RIGHT_ANGLE = 2;

    GenericParameterClauseSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax leftAngle() {
        return requiredChild(LEFT_ANGLE, TokenSyntax.class);
    }

    public GenericParameterClauseSyntax withLeftAngle(TokenSyntax leftAngle) {
        return (GenericParameterClauseSyntax) withChild(LEFT_ANGLE, leftAngle);
    }

    public GenericParameterListSyntax parameters() {
        return requiredChild(PARAMETERS, GenericParameterListSyntax.class);
    }

    public GenericParameterClauseSyntax withParameters(GenericParameterListSyntax parameters) {
        return (GenericParameterClauseSyntax) withChild(PARAMETERS, parameters);
    }

    public GenericParameterClauseSyntax addingParameter(GenericParameterSyntax parameter) {
        return (GenericParameterClauseSyntax) withAppended(PARAMETERS, parameter);
    }

    public TokenSyntax rightAngle() {
        return requiredChild(RIGHT_ANGLE, TokenSyntax.class);
    }

    public GenericParameterClauseSyntax withRightAngle(TokenSyntax rightAngle) {
        return (GenericParameterClauseSyntax) withChild(RIGHT_ANGLE, rightAngle);
    }
}
