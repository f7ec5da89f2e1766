package org.pragmatica.syntax;

import java.util.Optional;

/**
 * Named type, possibly generic and possibly qualified: {@code Swift.Array<Int>}.
 * A qualified name is a chain: {@code Swift} with a dot and the child type {@code Array<Int>}.
 */
public final class TypeIdentifierSyntax extends TypeSyntax {
    private static final int IDENTIFIER = 0;
    private static final int GENERIC_ARGUMENT_CLAUSE = 1;
    private static final int DOT = 2;
    private static final int CHILD_TYPE = 3;

    TypeIdentifierSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    /**
     * Name token: an identifier, {@code Any} or {@code Self}.
     */
    public TokenSyntax identifier() {
        return requiredChild(IDENTIFIER, TokenSyntax.class);
    }

    public TypeIdentifierSyntax withIdentifier(TokenSyntax identifier) {
        return (TypeIdentifierSyntax) withChild(IDENTIFIER, identifier);
    }

    public Optional<GenericArgumentClauseSyntax> genericArgumentClause() {
        return optionalChild(GENERIC_ARGUMENT_CLAUSE, GenericArgumentClauseSyntax.class);
    }

    public TypeIdentifierSyntax withGenericArgumentClause(Optional<GenericArgumentClauseSyntax> clause) {
        return (TypeIdentifierSyntax) withOptionalChild(GENERIC_ARGUMENT_CLAUSE, clause);
    }

    public Optional<TokenSyntax> dot() {
        return optionalChild(DOT, TokenSyntax.class);
    }

    public TypeIdentifierSyntax withDot(Optional<TokenSyntax> dot) {
        return (TypeIdentifierSyntax) withOptionalChild(DOT, dot);
    }

    public Optional<TypeIdentifierSyntax> childType() {
        return optionalChild(CHILD_TYPE, TypeIdentifierSyntax.class);
    }

    public TypeIdentifierSyntax withChildType(Optional<TypeIdentifierSyntax> childType) {
        return (TypeIdentifierSyntax) withOptionalChild(CHILD_TYPE, childType);
    }
}
