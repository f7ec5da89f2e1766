package org.pragmatica.syntax;

import java.util.Optional;

/**
 * {@code T} or {@code T: Inherited}, optionally followed by a comma.
 */
public final class GenericParameterSyntax extends Syntax {
    private static final int IDENTIFIER = 0;
    private static final int COLON = 1;
    private static final int INHERITED_TYPE = 2;
    private static final int COMMA = 3;

    GenericParameterSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax identifier() {
        return requiredChild(IDENTIFIER, TokenSyntax.class);
    }

    public GenericParameterSyntax withIdentifier(TokenSyntax identifier) {
        return (GenericParameterSyntax) withChild(IDENTIFIER, identifier);
    }

    public Optional<TokenSyntax> colon() {
        return optionalChild(COLON, TokenSyntax.class);
    }

    public GenericParameterSyntax withColon(Optional<TokenSyntax> colon) {
        return (GenericParameterSyntax) withOptionalChild(COLON, colon);
    }

    public Optional<TypeIdentifierSyntax> inheritedType() {
        return optionalChild(INHERITED_TYPE, TypeIdentifierSyntax.class);
    }

    public GenericParameterSyntax withInheritedType(Optional<TypeIdentifierSyntax> inheritedType) {
        return (GenericParameterSyntax) withOptionalChild(INHERITED_TYPE, inheritedType);
    }

    public Optional<TokenSyntax> comma() {
        return optionalChild(COMMA, TokenSyntax.class);
    }

    public GenericParameterSyntax withComma(Optional<TokenSyntax> comma) {
        return (GenericParameterSyntax) withOptionalChild(COMMA, comma);
    }
}
