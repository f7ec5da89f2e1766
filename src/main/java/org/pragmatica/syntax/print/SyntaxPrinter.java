package org.pragmatica.syntax.print;

import org.pragmatica.syntax.RawLayout;
import org.pragmatica.syntax.RawSyntax;
import org.pragmatica.syntax.RawToken;
import org.pragmatica.syntax.Syntax;
import org.pragmatica.syntax.kind.Shape;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Turns trees back into text.
 *
 * <p>{@link #print(Syntax)} reproduces the exact source the tree was built from: every token's
 * leading trivia, text and trailing trivia, in order. {@link #dump(Syntax)} renders the tree
 * structure for debugging, one node per line.
 */
public final class SyntaxPrinter {
    private static final String INDENT = "  ";

    private SyntaxPrinter() {}

    /**
     * Exact source text of the subtree.
     */
    public static String print(Syntax node) {
        return print(node, PrintOptions.DEFAULT);
    }

    public static String print(Syntax node, PrintOptions options) {
        checkNotNull(node, "node");
        checkNotNull(options, "options");
        var sb = new StringBuilder(node.textLength());
        print(node.raw(), options, sb);
        return sb.toString();
    }

    private static void print(RawSyntax raw, PrintOptions options, StringBuilder sb) {
        if (raw instanceof RawToken token) {
            if (options.includeTrivia()) {
                token.leadingTrivia().appendTo(sb);
            }
            sb.append(token.isMissing()
                      ? options.missingPlaceholder()
                      : token.tokenText());
            if (options.includeTrivia()) {
                token.trailingTrivia().appendTo(sb);
            }
            return;
        }
        for (var child : ((RawLayout) raw).children()) {
            child.ifPresent(node -> print(node, options, sb));
        }
    }

    /**
     * Indented structural dump of the subtree.
     *
     * <p>Example output for {@code Int?}:
     * <pre>
     * OPTIONAL_TYPE
     *   baseType: TYPE_IDENTIFIER
     *     identifier: IDENTIFIER "Int"
     *   questionMark: QUESTION_POSTFIX "?"
     * </pre>
     * Absent optional slots are skipped, missing nodes are tagged {@code <missing>}.
     */
    public static String dump(Syntax node) {
        checkNotNull(node, "node");
        var sb = new StringBuilder();
        dump(node.raw(), "", 0, sb);
        return sb.toString();
    }

    private static void dump(RawSyntax raw, String label, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth))
          .append(label)
          .append(raw.kind().name());

        if (raw instanceof RawToken token) {
            if (token.isPresent()) {
                sb.append(" \"")
                  .append(escape(token.tokenText()))
                  .append('"');
            }
        } else if (raw.isPresent() && ((RawLayout) raw).childCount() == 0) {
            sb.append(" []");
        }
        if (raw.isMissing()) {
            sb.append(" <missing>");
        }
        sb.append('\n');

        if (raw instanceof RawLayout layout) {
            var shape = layout.shape();
            for (var i = 0; i < layout.childCount(); i++) {
                var childLabel = shape instanceof Shape.Layout fixed
                                 ? fixed.slot(i).name() + ": "
                                 : "";
                layout.child(i)
                      .ifPresent(child -> dump(child, childLabel, depth + 1, sb));
            }
        }
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\")
                   .replace("\"", "\\\"")
                   .replace("\n", "\\n")
                   .replace("\t", "\\t");
    }
}
