package org.pragmatica.syntax;

import java.util.Optional;

/**
 * One argument of a function type, e.g. {@code _ name: inout Int,}.
 */
public final class FunctionTypeArgumentSyntax extends Syntax {
    private static final int EXTERNAL_NAME = 0;
    private static final int LOCAL_NAME = 1;
    private static final int TYPE_ATTRIBUTES = 2;
    private static final int INOUT_KEYWORD = 3;
    private static final int COLON = 4;
    private static final int TYPE = 5;
    private static final int COMMA = 6;

    FunctionTypeArgumentSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public Optional<TokenSyntax> externalName() {
        return optionalChild(EXTERNAL_NAME, TokenSyntax.class);
    }

    public FunctionTypeArgumentSyntax withExternalName(Optional<TokenSyntax> name) {
        return (FunctionTypeArgumentSyntax) withOptionalChild(EXTERNAL_NAME, name);
    }

    public Optional<TokenSyntax> localName() {
        return optionalChild(LOCAL_NAME, TokenSyntax.class);
    }

    public FunctionTypeArgumentSyntax withLocalName(Optional<TokenSyntax> name) {
        return (FunctionTypeArgumentSyntax) withOptionalChild(LOCAL_NAME, name);
    }

    public Optional<TypeAttributesSyntax> typeAttributes() {
        return optionalChild(TYPE_ATTRIBUTES, TypeAttributesSyntax.class);
    }

    public FunctionTypeArgumentSyntax withTypeAttributes(Optional<TypeAttributesSyntax> attributes) {
        return (FunctionTypeArgumentSyntax) withOptionalChild(TYPE_ATTRIBUTES, attributes);
    }

    public Optional<TokenSyntax> inoutKeyword() {
        return optionalChild(INOUT_KEYWORD, TokenSyntax.class);
    }

    public FunctionTypeArgumentSyntax withInoutKeyword(Optional<TokenSyntax> inout) {
        return (FunctionTypeArgumentSyntax) withOptionalChild(INOUT_KEYWORD, inout);
    }

    public Optional<TokenSyntax> colon() {
        return optionalChild(COLON, TokenSyntax.class);
    }

    public FunctionTypeArgumentSyntax withColon(Optional<TokenSyntax> colon) {
        return (FunctionTypeArgumentSyntax) withOptionalChild(COLON, colon);
    }

    public TypeSyntax type() {
        return requiredChild(TYPE, TypeSyntax.class);
    }

    public FunctionTypeArgumentSyntax withType(TypeSyntax type) {
        return (FunctionTypeArgumentSyntax) withChild(TYPE, type);
    }

    public Optional<TokenSyntax> comma() {
        return optionalChild(COMMA, TokenSyntax.class);
    }

    public FunctionTypeArgumentSyntax withComma(Optional<TokenSyntax> comma) {
        return (FunctionTypeArgumentSyntax) withOptionalChild(COMMA, comma);
    }
}
