package org.pragmatica.syntax;

import org.pragmatica.syntax.kind.SyntaxKind;

import java.util.Optional;

/**
 * Immutable, parent-less node storage shared between tree versions.
 * Instances are created only by {@link SyntaxFactory} and the typed views' editors.
 */
public abstract sealed class RawSyntax permits RawToken, RawLayout {
    private final boolean missing;
    private final int textLength;

    RawSyntax(boolean missing, int textLength) {
        this.missing = missing;
        this.textLength = textLength;
    }

    public abstract SyntaxKind kind();

    public boolean isMissing() {
        return missing;
    }

    public boolean isPresent() {
        return !missing;
    }

    public abstract boolean isToken();

    /**
     * First token in tree order, missing tokens included. Empty for a node without tokens,
     * such as an empty collection.
     */
    public abstract Optional<RawToken> firstToken();

    /**
     * Length of the text this node prints to, trivia included.
     */
    public int textLength() {
        return textLength;
    }

    /**
     * Append leading trivia, text and trailing trivia of every token, in order.
     */
    public abstract void appendTo(StringBuilder sb);

    /**
     * Full source text of this node.
     */
    public String text() {
        var sb = new StringBuilder(textLength);
        appendTo(sb);
        return sb.toString();
    }
}
