package org.pragmatica.syntax;

/**
 * Attributes in front of a type, e.g. {@code @escaping @autoclosure}.
 */
public final class TypeAttributesSyntax extends SyntaxCollection<TypeAttributeSyntax, TypeAttributesSyntax> {
    TypeAttributesSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent, TypeAttributeSyntax.class, TypeAttributesSyntax.class);
    }
}
