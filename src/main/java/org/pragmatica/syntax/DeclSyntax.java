package org.pragmatica.syntax;

/**
 * Base of declaration views.
 */
public abstract sealed class DeclSyntax extends Syntax implements CodeBlockItem
    permits StructDeclSyntax, TypealiasDeclSyntax {
    DeclSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent);
    }
}
