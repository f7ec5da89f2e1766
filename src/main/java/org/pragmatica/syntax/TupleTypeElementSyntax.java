package org.pragmatica.syntax;

import java.util.Optional;

/**
 * One tuple element: {@code label: @attrs inout Type,} with everything but the type optional.
 */
public final class TupleTypeElementSyntax extends Syntax {
    private static final int LABEL = 0;
    private static final int COLON = 1;
    private static final int TYPE_ATTRIBUTES = 2;
    private static final int INOUT_KEYWORD = 3;
    private static final int TYPE = 4;
    private static final int COMMA = 5;

    TupleTypeElementSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public Optional<TokenSyntax> label() {
        return optionalChild(LABEL, TokenSyntax.class);
    }

    public TupleTypeElementSyntax withLabel(Optional<TokenSyntax> label) {
        return (TupleTypeElementSyntax) withOptionalChild(LABEL, label);
    }

    public Optional<TokenSyntax> colon() {
        return optionalChild(COLON, TokenSyntax.class);
    }

    public TupleTypeElementSyntax withColon(Optional<TokenSyntax> colon) {
        return (TupleTypeElementSyntax) withOptionalChild(COLON, colon);
    }

    public Optional<TypeAttributesSyntax> typeAttributes() {
        return optionalChild(TYPE_ATTRIBUTES, TypeAttributesSyntax.class);
    }

    public TupleTypeElementSyntax withTypeAttributes(Optional<TypeAttributesSyntax> attributes) {
        return (TupleTypeElementSyntax) withOptionalChild(TYPE_ATTRIBUTES, attributes);
    }

    public Optional<TokenSyntax> inoutKeyword() {
        return optionalChild(INOUT_KEYWORD, TokenSyntax.class);
    }

    public TupleTypeElementSyntax withInoutKeyword(Optional<TokenSyntax> inout) {
        return (TupleTypeElementSyntax) withOptionalChild(INOUT_KEYWORD, inout);
    }

    public TypeSyntax type() {
        return requiredChild(TYPE, TypeSyntax.class);
    }

    public TupleTypeElementSyntax withType(TypeSyntax type) {
        return (TupleTypeElementSyntax) withChild(TYPE, type);
    }

    public Optional<TokenSyntax> comma() {
        return optionalChild(COMMA, TokenSyntax.class);
    }

    public TupleTypeElementSyntax withComma(Optional<TokenSyntax> comma) {
        return (TupleTypeElementSyntax) withOptionalChild(COMMA, comma);
    }
}
