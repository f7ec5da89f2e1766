package org.pragmatica.syntax;

import java.util.Optional;

/**
 * {@code struct Name<Params> where Requirements { members }}
 */
public final class StructDeclSyntax extends DeclSyntax {
    private static final int STRUCT_KEYWORD = 0;
    private static final int IDENTIFIER = 1;
    private static final int GENERIC_PARAMETER_CLAUSE = 2;
    private static final int GENERIC_WHERE_CLAUSE = 3;
    private static final int LEFT_BRACE = 4;
    private static final int MEMBERS = 5;
    private static final int RIGHT_BRACE = 6;

    StructDeclSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax structKeyword() {
        return requiredChild(STRUCT_KEYWORD, TokenSyntax.class);
    }

    public StructDeclSyntax withStructKeyword(TokenSyntax structKeyword) {
        return (StructDeclSyntax) withChild(STRUCT_KEYWORD, structKeyword);
    }

    public TokenSyntax identifier() {
        return requiredChild(IDENTIFIER, TokenSyntax.class);
    }

    public StructDeclSyntax withIdentifier(TokenSyntax identifier) {
        return (StructDeclSyntax) withChild(IDENTIFIER, identifier);
    }

    public Optional<GenericParameterClauseSyntax> genericParameterClause() {
        return optionalChild(GENERIC_PARAMETER_CLAUSE, GenericParameterClauseSyntax.class);
    }

    public StructDeclSyntax withGenericParameterClause(Optional<GenericParameterClauseSyntax> clause) {
        return (StructDeclSyntax) withOptionalChild(GENERIC_PARAMETER_CLAUSE, clause);
    }

    public Optional<GenericWhereClauseSyntax> genericWhereClause() {
        return optionalChild(GENERIC_WHERE_CLAUSE, GenericWhereClauseSyntax.class);
    }

    public StructDeclSyntax withGenericWhereClause(Optional<GenericWhereClauseSyntax> clause) {
        return (StructDeclSyntax) withOptionalChild(GENERIC_WHERE_CLAUSE, clause);
    }

    public TokenSyntax leftBrace() {
        return requiredChild(LEFT_BRACE, TokenSyntax.class);
    }

    public StructDeclSyntax withLeftBrace(TokenSyntax leftBrace) {
        return (StructDeclSyntax) withChild(LEFT_BRACE, leftBrace);
    }

    public DeclMembersSyntax members() {
        return requiredChild(MEMBERS, DeclMembersSyntax.class);
    }

    public StructDeclSyntax withMembers(DeclMembersSyntax members) {
        return (StructDeclSyntax) withChild(MEMBERS, members);
    }

    /**
     * Same declaration with one more member at the end.
     */
    public StructDeclSyntax addingMember(DeclSyntax member) {
        return (StructDeclSyntax) withAppended(MEMBERS, member);
    }

    public TokenSyntax rightBrace() {
        return requiredChild(RIGHT_BRACE, TokenSyntax.class);
    }

    public StructDeclSyntax withRightBrace(TokenSyntax rightBrace) {
        return (StructDeclSyntax) withChild(RIGHT_BRACE, rightBrace);
    }
}
