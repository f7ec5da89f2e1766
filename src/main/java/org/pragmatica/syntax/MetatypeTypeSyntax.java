package org.pragmatica.syntax;

/**
 * {@code Type.Type} or {@code Type.Protocol}. The trailing name is an identifier token, not a type.
 */
public final class MetatypeTypeSyntax extends TypeSyntax {
    private static final int BASE_TYPE = 0;
    private static final int DOT = 1;
    private static final int TYPE_OR_PROTOCOL = 2;

    MetatypeTypeSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TypeSyntax baseType() {
        return requiredChild(BASE_TYPE, TypeSyntax.class);
    }

    public MetatypeTypeSyntax withBaseType(TypeSyntax baseType) {
        return (MetatypeTypeSyntax) withChild(BASE_TYPE, baseType);
    }

    public TokenSyntax dot() {
        return requiredChild(DOT, TokenSyntax.class);
    }

    public MetatypeTypeSyntax withDot(TokenSyntax dot) {
        return (MetatypeTypeSyntax) withChild(DOT, dot);
    }

    public TokenSyntax typeOrProtocol() {
        return requiredChild(TYPE_OR_PROTOCOL, TokenSyntax.class);
    }

    public MetatypeTypeSyntax withTypeOrProtocol(TokenSyntax typeOrProtocol) {
        return (MetatypeTypeSyntax) withChild(TYPE_OR_PROTOCOL, typeOrProtocol);
    }
}
