package org.pragmatica.syntax;

import java.util.Optional;

public final class GenericArgumentSyntax extends Syntax {
    private static final int TYPE = 0;
    private static final int COMMA = 1;

    GenericArgumentSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TypeSyntax type() {
        return requiredChild(TYPE, TypeSyntax.class);
    }

    public GenericArgumentSyntax withType(TypeSyntax type) {
        return (GenericArgumentSyntax) withChild(TYPE, type);
    }

    public Optional<TokenSyntax> comma() {
        return optionalChild(COMMA, TokenSyntax.class);
    }

    public GenericArgumentSyntax withComma(Optional<TokenSyntax> comma) {
        return (GenericArgumentSyntax) withOptionalChild(COMMA, comma);
    }
}
