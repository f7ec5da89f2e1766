package org.pragmatica.syntax;

/**
 * Anything that may appear in a statement list: statements, declarations and unknown syntax.
 */
public sealed interface CodeBlockItem permits DeclSyntax, StmtSyntax, UnknownSyntax {
    RawSyntax raw();
}
