package org.pragmatica.syntax;

import java.util.Optional;

/**
 * {@code typealias Name<Params> = Type}
 */
public final class TypealiasDeclSyntax extends DeclSyntax {
    private static final int TYPEALIAS_KEYWORD = 0;
    private static final int IDENTIFIER = 1;
    private static final int GENERIC_PARAMETER_CLAUSE = 2;
    private static final int EQUAL = 3;
    private static final int TYPE = 4;

    TypealiasDeclSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax typealiasKeyword() {
        return requiredChild(TYPEALIAS_KEYWORD, TokenSyntax.class);
    }

    public TypealiasDeclSyntax withTypealiasKeyword(TokenSyntax keyword) {
        return (TypealiasDeclSyntax) withChild(TYPEALIAS_KEYWORD, keyword);
    }

    public TokenSyntax identifier() {
        return requiredChild(IDENTIFIER, TokenSyntax.class);
    }

    public TypealiasDeclSyntax withIdentifier(TokenSyntax identifier) {
        return (TypealiasDeclSyntax) withChild(IDENTIFIER, identifier);
    }

    public Optional<GenericParameterClauseSyntax> genericParameterClause() {
        return optionalChild(GENERIC_PARAMETER_CLAUSE, GenericParameterClauseSyntax.class);
    }

    public TypealiasDeclSyntax withGenericParameterClause(Optional<GenericParameterClauseSyntax> clause) {
        return (TypealiasDeclSyntax) withOptionalChild(GENERIC_PARAMETER_CLAUSE, clause);
    }

    public TokenSyntax equal() {
        return requiredChild(EQUAL, TokenSyntax.class);
    }

    public TypealiasDeclSyntax withEqual(TokenSyntax equal) {
        return (TypealiasDeclSyntax) withChild(EQUAL, equal);
    }

    public TypeSyntax type() {
        return requiredChild(TYPE, TypeSyntax.class);
    }

    public TypealiasDeclSyntax withType(TypeSyntax type) {
        return (TypealiasDeclSyntax) withChild(TYPE, type);
    }
}
