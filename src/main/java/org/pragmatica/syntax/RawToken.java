package org.pragmatica.syntax;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import org.pragmatica.syntax.error.ShapeError;
import org.pragmatica.syntax.error.ShapeViolationException;
import org.pragmatica.syntax.kind.TokenKind;
import org.pragmatica.syntax.tree.Trivia;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Leaf: literal token text with its leading and trailing trivia.
 */
public final class RawToken extends RawSyntax {
    private static final Map<TokenKind, RawToken> CANONICAL = canonicalTokens();

    private final TokenKind tokenKind;
    private final String text;
    private final Trivia leadingTrivia;
    private final Trivia trailingTrivia;

    private RawToken(TokenKind tokenKind, String text, Trivia leadingTrivia, Trivia trailingTrivia, boolean missing) {
        super(missing, leadingTrivia.textLength() + text.length() + trailingTrivia.textLength());
        this.tokenKind = tokenKind;
        this.text = text;
        this.leadingTrivia = leadingTrivia;
        this.trailingTrivia = trailingTrivia;
    }

    /**
     * Present token. Fixed-spelling kinds must be given their exact spelling.
     */
    static RawToken make(TokenKind kind, String text, Trivia leadingTrivia, Trivia trailingTrivia) {
        checkNotNull(kind, "kind");
        checkNotNull(text, "text");
        checkNotNull(leadingTrivia, "leadingTrivia");
        checkNotNull(trailingTrivia, "trailingTrivia");

        if (kind.hasFixedText()) {
            var expected = kind.fixedText().get();
            if (!expected.equals(text)) {
                throw new ShapeViolationException(new ShapeError.FixedTextMismatch(kind, expected, text));
            }
            if (leadingTrivia.isEmpty() && trailingTrivia.isEmpty()) {
                return CANONICAL.get(kind);
            }
        }
        return new RawToken(kind, text, leadingTrivia, trailingTrivia, false);
    }

    /**
     * Present token with the fixed spelling of its kind.
     */
    static RawToken canonical(TokenKind kind, Trivia leadingTrivia, Trivia trailingTrivia) {
        checkNotNull(kind, "kind");
        var text = kind.fixedText()
                       .orElseThrow(() -> new IllegalArgumentException(kind + " has no fixed spelling"));
        return make(kind, text, leadingTrivia, trailingTrivia);
    }

    /**
     * Missing token: empty text, flagged missing. Trivia is whatever recovery decided to keep.
     */
    static RawToken missing(TokenKind kind, Trivia leadingTrivia, Trivia trailingTrivia) {
        checkNotNull(kind, "kind");
        checkNotNull(leadingTrivia, "leadingTrivia");
        checkNotNull(trailingTrivia, "trailingTrivia");
        return new RawToken(kind, "", leadingTrivia, trailingTrivia, true);
    }

    RawToken withLeadingTrivia(Trivia trivia) {
        return isMissing()
               ? missing(tokenKind, trivia, trailingTrivia)
               : make(tokenKind, text, trivia, trailingTrivia);
    }

    RawToken withTrailingTrivia(Trivia trivia) {
        return isMissing()
               ? missing(tokenKind, leadingTrivia, trivia)
               : make(tokenKind, text, leadingTrivia, trivia);
    }

    RawToken withText(String newText) {
        return make(tokenKind, newText, leadingTrivia, trailingTrivia);
    }

    @Override
    public TokenKind kind() {
        return tokenKind;
    }

    @Override
    public boolean isToken() {
        return true;
    }

    public String tokenText() {
        return text;
    }

    public Trivia leadingTrivia() {
        return leadingTrivia;
    }

    public Trivia trailingTrivia() {
        return trailingTrivia;
    }

    @Override
    public Optional<RawToken> firstToken() {
        return Optional.of(this);
    }

    @Override
    public void appendTo(StringBuilder sb) {
        leadingTrivia.appendTo(sb);
        sb.append(text);
        trailingTrivia.appendTo(sb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RawToken other
               && tokenKind == other.tokenKind
               && isMissing() == other.isMissing()
               && text.equals(other.text)
               && leadingTrivia.equals(other.leadingTrivia)
               && trailingTrivia.equals(other.trailingTrivia);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(tokenKind, text, leadingTrivia, trailingTrivia, isMissing());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper("Token")
                          .add("kind", tokenKind)
                          .add("text", text)
                          .add("leading", leadingTrivia.text())
                          .add("trailing", trailingTrivia.text())
                          .add("missing", isMissing())
                          .toString();
    }

    private static Map<TokenKind, RawToken> canonicalTokens() {
        var tokens = new EnumMap<TokenKind, RawToken>(TokenKind.class);
        for (var kind : TokenKind.values()) {
            kind.fixedText()
                .ifPresent(text -> tokens.put(kind, new RawToken(kind, text, Trivia.EMPTY, Trivia.EMPTY, false)));
        }
        return tokens;
    }
}
