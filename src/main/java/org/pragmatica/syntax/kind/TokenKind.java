package org.pragmatica.syntax.kind;

import java.util.Optional;

/**
 * Terminal lexical kinds. Keywords and punctuation have a fixed spelling,
 * the remaining kinds take their text from the source.
 */
public enum TokenKind implements SyntaxKind {
    IDENTIFIER(Family.IDENTIFIER, null),
    OPERATOR(Family.OPERATOR, null),
    INTEGER_LITERAL(Family.LITERAL, null),
    STRING_LITERAL(Family.LITERAL, null),
    UNKNOWN(Family.UNKNOWN, null),
    EOF(Family.UNKNOWN, ""),

    STRUCT_KEYWORD(Family.KEYWORD, "struct"),
    TYPEALIAS_KEYWORD(Family.KEYWORD, "typealias"),
    WHERE_KEYWORD(Family.KEYWORD, "where"),
    INOUT_KEYWORD(Family.KEYWORD, "inout"),
    THROWS_KEYWORD(Family.KEYWORD, "throws"),
    RETHROWS_KEYWORD(Family.KEYWORD, "rethrows"),
    FALLTHROUGH_KEYWORD(Family.KEYWORD, "fallthrough"),
    BREAK_KEYWORD(Family.KEYWORD, "break"),
    ANY_KEYWORD(Family.KEYWORD, "Any"),
    SELF_KEYWORD(Family.KEYWORD, "Self"),

    AT_SIGN(Family.PUNCTUATION, "@"),
    LEFT_ANGLE(Family.PUNCTUATION, "<"),
    RIGHT_ANGLE(Family.PUNCTUATION, ">"),
    LEFT_PAREN(Family.PUNCTUATION, "("),
    RIGHT_PAREN(Family.PUNCTUATION, ")"),
    LEFT_SQUARE_BRACKET(Family.PUNCTUATION, "["),
    RIGHT_SQUARE_BRACKET(Family.PUNCTUATION, "]"),
    LEFT_BRACE(Family.PUNCTUATION, "{"),
    RIGHT_BRACE(Family.PUNCTUATION, "}"),
    QUESTION_POSTFIX(Family.PUNCTUATION, "?"),
    EXCLAIM_POSTFIX(Family.PUNCTUATION, "!"),
    COMMA(Family.PUNCTUATION, ","),
    COLON(Family.PUNCTUATION, ":"),
    PERIOD(Family.PUNCTUATION, "."),
    EQUAL(Family.PUNCTUATION, "="),
    ARROW(Family.PUNCTUATION, "->");

    /**
     * Lexical family of a token kind.
     */
    public enum Family {
        IDENTIFIER,
        OPERATOR,
        LITERAL,
        KEYWORD,
        PUNCTUATION,
        UNKNOWN
    }

    private final Family family;
    private final String fixedText;

    TokenKind(Family family, String fixedText) {
        this.family = family;
        this.fixedText = fixedText;
    }

    public Family family() {
        return family;
    }

    /**
     * The only spelling a token of this kind may have, if the kind has one.
     */
    public Optional<String> fixedText() {
        return Optional.ofNullable(fixedText);
    }

    public boolean hasFixedText() {
        return fixedText != null;
    }

    public boolean isKeyword() {
        return family == Family.KEYWORD;
    }

    public boolean isPunctuation() {
        return family == Family.PUNCTUATION;
    }

    @Override
    public boolean isToken() {
        return true;
    }
}
