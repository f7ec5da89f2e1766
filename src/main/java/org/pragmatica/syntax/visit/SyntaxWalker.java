package org.pragmatica.syntax.visit;

import org.pragmatica.syntax.Syntax;
import org.pragmatica.syntax.TokenSyntax;
import org.pragmatica.syntax.tree.SourceLocation;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Depth-first walk over a tree, tracking line and column as the printed text is consumed.
 */
public final class SyntaxWalker {
    private final SyntaxVisitor visitor;
    private final String text;
    private SourceLocation cursor;
    private int offset;

    private SyntaxWalker(SyntaxVisitor visitor, String text, SourceLocation start) {
        this.visitor = visitor;
        this.text = text;
        this.cursor = start;
    }

    /**
     * Walk {@code node} as if its text started at the beginning of a source file.
     */
    public static void walk(Syntax node, SyntaxVisitor visitor) {
        walk(node, visitor, SourceLocation.START);
    }

    public static void walk(Syntax node, SyntaxVisitor visitor, SourceLocation start) {
        checkNotNull(node, "node");
        checkNotNull(visitor, "visitor");
        checkNotNull(start, "start");
        new SyntaxWalker(visitor, node.text(), start).visit(node);
    }

    private void visit(Syntax node) {
        var leading = node.raw()
                          .firstToken()
                          .map(token -> token.leadingTrivia().textLength())
                          .orElse(0);

        if (!visitor.enter(node, cursor.advance(text, offset, offset + leading))) {
            moveTo(offset + node.textLength());
            return;
        }
        if (node instanceof TokenSyntax) {
            moveTo(offset + node.textLength());
        } else {
            for (var child : node.children()) {
                visit(child);
            }
        }
        visitor.leave(node);
    }

    // cursor always sits at offset; both only move forward over the walked text
    private void moveTo(int target) {
        cursor = cursor.advance(text, offset, target);
        offset = target;
    }
}
