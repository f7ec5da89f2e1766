package org.pragmatica.syntax;

/**
 * {@code <Int, String>}
 */
public final class GenericArgumentClauseSyntax extends Syntax {
    private static final int LEFT_ANGLE = 0;
    private static final int ARGUMENTS = 1;
    private static final int RIGHT_ANGLE = 2;

    GenericArgumentClauseSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax leftAngle() {
        return requiredChild(LEFT_ANGLE, TokenSyntax.class);
    }

    public GenericArgumentClauseSyntax withLeftAngle(TokenSyntax leftAngle) {
        return (GenericArgumentClauseSyntax) withChild(LEFT_ANGLE, leftAngle);
    }

    public GenericArgumentListSyntax arguments() {
        return requiredChild(ARGUMENTS, GenericArgumentListSyntax.class);
    }

    public GenericArgumentClauseSyntax withArguments(GenericArgumentListSyntax arguments) {
        return (GenericArgumentClauseSyntax) withChild(ARGUMENTS, arguments);
    }

    public GenericArgumentClauseSyntax addingArgument(GenericArgumentSyntax argument) {
        return (GenericArgumentClauseSyntax) withAppended(ARGUMENTS, argument);
    }

    public TokenSyntax rightAngle() {
        return requiredChild(RIGHT_ANGLE, TokenSyntax.class);
    }

    public GenericArgumentClauseSyntax withRightAngle(TokenSyntax rightAngle) {
        return (GenericArgumentClauseSyntax) withChild(RIGHT_ANGLE, rightAngle);
    }
}
