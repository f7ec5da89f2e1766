package org.pragmatica.syntax;

/**
 * {@code where T == Int, U: Hashable}
 */
public final class GenericWhereClauseSyntax extends Syntax {
    private static final int WHERE_KEYWORD = 0;
    private static final int REQUIREMENTS = 1;

    GenericWhereClauseSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public TokenSyntax whereKeyword() {
        return requiredChild(WHERE_KEYWORD, TokenSyntax.class);
    }

    public GenericWhereClauseSyntax withWhereKeyword(TokenSyntax keyword) {
        return (GenericWhereClauseSyntax) withChild(WHERE_KEYWORD, keyword);
    }

    public GenericRequirementListSyntax requirements() {
        return requiredChild(REQUIREMENTS, GenericRequirementListSyntax.class);
    }

    public GenericWhereClauseSyntax withRequirements(GenericRequirementListSyntax requirements) {
        return (GenericWhereClauseSyntax) withChild(REQUIREMENTS, requirements);
    }

    public GenericWhereClauseSyntax addingRequirement(GenericRequirementSyntax requirement) {
        return (GenericWhereClauseSyntax) withAppended(REQUIREMENTS, requirement);
    }
}
