package org.pragmatica.syntax.tree;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Ordered sequence of trivia pieces attached before (leading) or after (trailing) a token.
 * Pieces are kept exactly as supplied: never merged, reordered or normalized.
 */
public record Trivia(ImmutableList<TriviaPiece> pieces) {
    public static final Trivia EMPTY = new Trivia(ImmutableList.of());

    public Trivia {
        checkNotNull(pieces, "pieces");
    }

    public static Trivia of(TriviaPiece... pieces) {
        return pieces.length == 0
               ? EMPTY
               : new Trivia(ImmutableList.copyOf(pieces));
    }

    public static Trivia of(List<? extends TriviaPiece> pieces) {
        return pieces.isEmpty()
               ? EMPTY
               : new Trivia(ImmutableList.copyOf(pieces));
    }

    public static Trivia spaces(int count) {
        return count == 0
               ? EMPTY
               : of(new TriviaPiece.Whitespace(Strings.repeat(" ", count)));
    }

    public static Trivia tabs(int count) {
        return count == 0
               ? EMPTY
               : of(new TriviaPiece.Whitespace(Strings.repeat("\t", count)));
    }

    public static Trivia newlines(int count) {
        return count == 0
               ? EMPTY
               : of(new TriviaPiece.Newline(Strings.repeat("\n", count)));
    }

    public static Trivia lineComment(String text) {
        return of(new TriviaPiece.LineComment(text));
    }

    public static Trivia blockComment(String text) {
        return of(new TriviaPiece.BlockComment(text));
    }

    public static Trivia garbage(String text) {
        return of(new TriviaPiece.Garbage(text));
    }

    public boolean isEmpty() {
        return pieces.isEmpty();
    }

    public int size() {
        return pieces.size();
    }

    public TriviaPiece get(int index) {
        return pieces.get(index);
    }

    /**
     * New trivia with the piece added at the end.
     */
    public Trivia appending(TriviaPiece piece) {
        return new Trivia(ImmutableList.<TriviaPiece>builderWithExpectedSize(pieces.size() + 1)
                                       .addAll(pieces)
                                       .add(piece)
                                       .build());
    }

    /**
     * Concatenation of this trivia followed by the other.
     */
    public Trivia plus(Trivia other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        return new Trivia(ImmutableList.<TriviaPiece>builderWithExpectedSize(size() + other.size())
                                       .addAll(pieces)
                                       .addAll(other.pieces)
                                       .build());
    }

    /**
     * Check whether any piece is of the given flavour.
     */
    public boolean contains(Class<? extends TriviaPiece> flavour) {
        return pieces.stream()
                     .anyMatch(flavour::isInstance);
    }

    /**
     * Exact source text of all pieces, in order.
     */
    public String text() {
        var sb = new StringBuilder(textLength());
        appendTo(sb);
        return sb.toString();
    }

    public void appendTo(StringBuilder sb) {
        for (var piece : pieces) {
            sb.append(piece.text());
        }
    }

    public int textLength() {
        var length = 0;
        for (var piece : pieces) {
            length += piece.textLength();
        }
        return length;
    }
}
