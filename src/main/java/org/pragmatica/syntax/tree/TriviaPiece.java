package org.pragmatica.syntax.tree;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A single piece of non-semantic text: whitespace, a line break, a comment or garbage.
 * Each piece holds its exact literal text.
 */
public sealed interface TriviaPiece {
    String text();

    default int textLength() {
        return text().length();
    }

    /**
     * Run of horizontal whitespace (spaces, tabs, vertical tabs, form feeds).
     */
    record Whitespace(String text) implements TriviaPiece {
        public Whitespace {
            checkNotNull(text, "text");
            checkArgument(!text.isEmpty() && text.chars().allMatch(Whitespace::isHorizontal),
                          "Not a horizontal whitespace run: '%s'", text);
        }

        private static boolean isHorizontal(int ch) {
            return ch == ' ' || ch == '\t' || ch == '\u000B' || ch == '\f';
        }
    }

    /**
     * Run of line breaks ({@code \n}, {@code \r} or {@code \r\n}).
     */
    record Newline(String text) implements TriviaPiece {
        public Newline {
            checkNotNull(text, "text");
            checkArgument(!text.isEmpty() && text.chars().allMatch(ch -> ch == '\n' || ch == '\r'),
                          "Not a line break run: '%s'", text);
        }
    }

    /**
     * {@code // ...} up to, not including, the line break.
     */
    record LineComment(String text) implements TriviaPiece {
        public LineComment {
            checkLineComment(text, "//");
        }
    }

    /**
     * {@code /* ... *}{@code /}, may span lines.
     */
    record BlockComment(String text) implements TriviaPiece {
        public BlockComment {
            checkBlockComment(text, "/*");
        }
    }

    /**
     * {@code /// ...} documentation comment.
     */
    record DocLineComment(String text) implements TriviaPiece {
        public DocLineComment {
            checkLineComment(text, "///");
        }
    }

    /**
     * {@code /** ... *}{@code /} documentation comment.
     */
    record DocBlockComment(String text) implements TriviaPiece {
        public DocBlockComment {
            checkBlockComment(text, "/**");
        }
    }

    /**
     * Any other out-of-band text the lexer skipped, e.g. a stray byte order mark or a shebang line.
     */
    record Garbage(String text) implements TriviaPiece {
        public Garbage {
            checkNotNull(text, "text");
            checkArgument(!text.isEmpty(), "Garbage trivia must not be empty");
        }
    }

    private static void checkLineComment(String text, String prefix) {
        checkNotNull(text, "text");
        checkArgument(text.startsWith(prefix), "Line comment must start with '%s': '%s'", prefix, text);
        checkArgument(text.indexOf('\n') < 0 && text.indexOf('\r') < 0,
                      "Line comment must not contain a line break: '%s'", text);
    }

    private static void checkBlockComment(String text, String prefix) {
        checkNotNull(text, "text");
        checkArgument(text.startsWith(prefix) && text.endsWith("*/") && text.length() >= prefix.length() + 2,
                      "Block comment must be delimited by '%s' and '*/': '%s'", prefix, text);
    }
}
