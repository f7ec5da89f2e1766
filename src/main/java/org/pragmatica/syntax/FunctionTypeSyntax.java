package org.pragmatica.syntax;

import java.util.Optional;

/**
 * {@code @attrs (Args) throws -> Result}
 */
public final class FunctionTypeSyntax extends TypeSyntax {
    private static final int TYPE_ATTRIBUTES = 0;
    private static final int LEFT_PAREN = 1;
    private static final int ARGUMENTS = 2;
    private static final int RIGHT_PAREN = 3;
    private static final int THROWS_OR_RETHROWS = 4;
    private static final int ARROW = 5;
    private static final int RETURN_TYPE = 6;

    FunctionTypeSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public Optional<TypeAttributesSyntax> typeAttributes() {
        return optionalChild(TYPE_ATTRIBUTES, TypeAttributesSyntax.class);
    }

    public FunctionTypeSyntax withTypeAttributes(Optional<TypeAttributesSyntax> attributes) {
        return (FunctionTypeSyntax) withOptionalChild(TYPE_ATTRIBUTES, attributes);
    }

    public TokenSyntax leftParen() {
        return requiredChild(LEFT_PAREN, TokenSyntax.class);
    }

    public FunctionTypeSyntax withLeftParen(TokenSyntax leftParen) {
        return (FunctionTypeSyntax) withChild(LEFT_PAREN, leftParen);
    }

    public TypeArgumentListSyntax arguments() {
        return requiredChild(ARGUMENTS, TypeArgumentListSyntax.class);
    }

    public FunctionTypeSyntax withArguments(TypeArgumentListSyntax arguments) {
        return (FunctionTypeSyntax) withChild(ARGUMENTS, arguments);
    }

    public FunctionTypeSyntax addingArgument(FunctionTypeArgumentSyntax argument) {
        return (FunctionTypeSyntax) withAppended(ARGUMENTS, argument);
    }

    public TokenSyntax rightParen() {
        return requiredChild(RIGHT_PAREN, TokenSyntax.class);
    }

    public FunctionTypeSyntax withRightParen(TokenSyntax rightParen) {
        return (FunctionTypeSyntax) withChild(RIGHT_PAREN, rightParen);
    }

    /**
     * {@code throws} or {@code rethrows}, if the function type declares either.
     */
    public Optional<TokenSyntax> throwsOrRethrows() {
        return optionalChild(THROWS_OR_RETHROWS, TokenSyntax.class);
    }

    public FunctionTypeSyntax withThrowsOrRethrows(Optional<TokenSyntax> keyword) {
        return (FunctionTypeSyntax) withOptionalChild(THROWS_OR_RETHROWS, keyword);
    }

    public TokenSyntax arrow() {
        return requiredChild(ARROW, TokenSyntax.class);
    }

    public FunctionTypeSyntax withArrow(TokenSyntax arrow) {
        return (FunctionTypeSyntax) withChild(ARROW, arrow);
    }

    public TypeSyntax returnType() {
        return requiredChild(RETURN_TYPE, TypeSyntax.class);
    }

    public FunctionTypeSyntax withReturnType(TypeSyntax returnType) {
        return (FunctionTypeSyntax) withChild(RETURN_TYPE, returnType);
    }
}
