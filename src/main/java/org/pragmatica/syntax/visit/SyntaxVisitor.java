package org.pragmatica.syntax.visit;

import org.pragmatica.syntax.Syntax;
import org.pragmatica.syntax.tree.SourceLocation;

/**
 * Callbacks for {@link SyntaxWalker}. Nodes are reported in pre-order, absent slots are never reported.
 */
public interface SyntaxVisitor {
    /**
     * Called before the children of {@code node}.
     *
     * @param location where the node's first token text starts, i.e. past its leading trivia
     * @return {@code false} to skip the children of this node
     */
    default boolean enter(Syntax node, SourceLocation location) {
        return true;
    }

    /**
     * Called after the children of every node whose {@link #enter} returned {@code true}.
     */
    default void leave(Syntax node) {}
}
