package org.pragmatica.syntax;

/**
 * Items of a code block. Elements are statements, declarations or unknown syntax,
 * so they are exposed as plain {@link Syntax} and checked against the shape on every edit.
 */
public final class StmtListSyntax extends SyntaxCollection<Syntax, StmtListSyntax> {
    StmtListSyntax(RawLayout raw, Syntax parent, int indexInParent) {
        super(raw, parent, indexInParent, Syntax.class, StmtListSyntax.class);
    }
}
