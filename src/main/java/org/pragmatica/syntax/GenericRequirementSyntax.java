package org.pragmatica.syntax;

import java.util.Optional;

/**
 * Base of generic where-clause requirements. Both variants start with a type identifier and may end with a comma.
 */
public abstract sealed class GenericRequirementSyntax extends Syntax
    permits SameTypeRequirementSyntax, ConformanceRequirementSyntax {
    GenericRequirementSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }

    public abstract TypeIdentifierSyntax leftType();

    public abstract Optional<TokenSyntax> comma();
}
