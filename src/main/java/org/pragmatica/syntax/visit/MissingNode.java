package org.pragmatica.syntax.visit;

import org.pragmatica.syntax.Syntax;
import org.pragmatica.syntax.kind.SyntaxKind;
import org.pragmatica.syntax.tree.SourceLocation;

/**
 * A place where the parser expected input it did not find.
 *
 * @param kind     kind of the missing node
 * @param location where the missing text would have started
 * @param node     view of the missing node, for navigating to its parent
 */
public record MissingNode(SyntaxKind kind, SourceLocation location, Syntax node) {}
