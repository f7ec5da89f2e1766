package org.pragmatica.syntax.visit;

import org.pragmatica.syntax.Syntax;
import org.pragmatica.syntax.tree.SourceLocation;
import org.pragmatica.syntax.tree.SourceSpan;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Line and column positions of nodes, computed from the text of the tree they belong to.
 */
public final class SourceLocator {
    private SourceLocator() {}

    /**
     * Where the first token text of {@code node} starts within its root.
     */
    public static SourceLocation locationOf(Syntax node) {
        checkNotNull(node, "node");
        var rootText = node.root().text();
        return SourceLocation.START.advance(rootText, 0, node.textPosition());
    }

    /**
     * Span of the node text within its root, without the outer leading and trailing trivia.
     * Missing and empty nodes get an empty span.
     */
    public static SourceSpan spanOf(Syntax node) {
        checkNotNull(node, "node");
        var rootText = node.root().text();
        var start = SourceLocation.START.advance(rootText, 0, node.textPosition());
        var trailing = node.lastToken()
                           .map(token -> token.trailingTrivia().textLength())
                           .orElse(0);
        var endOffset = Math.max(start.offset(), node.position() + node.textLength() - trailing);
        return SourceSpan.of(start, start.advance(rootText, start.offset(), endOffset));
    }
}
