package org.pragmatica.syntax;

/**
 * Requirements of a {@code where} clause.
 */
public final class GenericRequirementListSyntax extends SyntaxCollection<GenericRequirementSyntax, GenericRequirementListSyntax> {
    GenericRequirementListSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent, GenericRequirementSyntax.class, GenericRequirementListSyntax.class);
    }
}
