package org.pragmatica.syntax.visit;

import com.google.common.collect.ImmutableList;
import org.pragmatica.syntax.Syntax;
import org.pragmatica.syntax.tree.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the missing nodes of a tree for a diagnostics layer.
 *
 * <p>Only outermost missing nodes are reported: once a node is missing, its own missing children
 * are not listed separately.
 */
public final class MissingNodeFinder {
    private static final Logger log = LoggerFactory.getLogger(MissingNodeFinder.class);

    private MissingNodeFinder() {}

    public static ImmutableList<MissingNode> find(Syntax root) {
        return find(root, SourceLocation.START);
    }

    /**
     * Missing nodes in source order, located relative to {@code start}.
     */
    public static ImmutableList<MissingNode> find(Syntax root, SourceLocation start) {
        var found = ImmutableList.<MissingNode>builder();

        SyntaxWalker.walk(root, new SyntaxVisitor() {
            @Override
            public boolean enter(Syntax node, SourceLocation location) {
                if (node.isMissing()) {
                    found.add(new MissingNode(node.kind(), location, node));
                    return false;
                }
                return true;
            }
        }, start);

        var result = found.build();
        log.debug("Found {} missing node(s) under {}", result.size(), root.kind());
        return result;
    }

    /**
     * Check whether anything under {@code root}, the root included, is missing.
     */
    public static boolean hasMissing(Syntax root) {
        return !find(root).isEmpty();
    }
}
