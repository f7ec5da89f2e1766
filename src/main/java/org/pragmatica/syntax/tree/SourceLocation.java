package org.pragmatica.syntax.tree;

import static com.google.common.base.Preconditions.checkPositionIndexes;

/**
 * A position in source text (line and column, both 1-based; offset 0-based).
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location reached after consuming the given text from this location.
     * {@code \r\n} counts as a single line break.
     */
    public SourceLocation advance(CharSequence text) {
        return advance(text, 0, text.length());
    }

    /**
     * Location reached after consuming {@code source[from, to)} from this location.
     * A {@code \r} is looked at together with the character following it in {@code source},
     * even past {@code to}, so a {@code \r\n} pair split between two calls still counts once.
     */
    public SourceLocation advance(CharSequence source, int from, int to) {
        checkPositionIndexes(from, to, source.length());
        var newLine = line;
        var newColumn = column;
        for (var i = from; i < to; i++) {
            var ch = source.charAt(i);
            if (ch == '\n' || (ch == '\r' && (i + 1 >= source.length() || source.charAt(i + 1) != '\n'))) {
                newLine++;
                newColumn = 1;
            } else if (ch != '\r') {
                newColumn++;
            }
        }
        return new SourceLocation(newLine, newColumn, offset + to - from);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
