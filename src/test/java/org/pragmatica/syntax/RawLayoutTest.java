package org.pragmatica.syntax;

import org.junit.jupiter.api.Test;
import org.pragmatica.syntax.error.ShapeError;
import org.pragmatica.syntax.error.ShapeViolationException;
import org.pragmatica.syntax.kind.NodeKind;
import org.pragmatica.syntax.kind.TokenKind;
import org.pragmatica.syntax.tree.Trivia;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RawLayoutTest {

    private static RawToken token(TokenKind kind, String text) {
        return RawToken.make(kind, text, Trivia.EMPTY, Trivia.EMPTY);
    }

    private static RawLayout typeIdentifier(String name) {
        return RawLayout.make(NodeKind.TYPE_IDENTIFIER,
                              List.of(Optional.of(token(TokenKind.IDENTIFIER, name)),
                                      Optional.empty(),
                                      Optional.empty(),
                                      Optional.empty()));
    }

    @Test
    void make_wrongChildKind_isRejected() {
        // a same-type requirement whose equality slot holds a colon
        var children = List.<Optional<RawSyntax>>of(Optional.of(typeIdentifier("T")),
                                                    Optional.of(token(TokenKind.COLON, ":")),
                                                    Optional.of(typeIdentifier("U")),
                                                    Optional.empty());

        assertThatThrownBy(() -> RawLayout.make(NodeKind.SAME_TYPE_REQUIREMENT, children))
            .isInstanceOf(ShapeViolationException.class)
            .isInstanceOf(IllegalArgumentException.class)
            .satisfies(e -> {
                var error = ((ShapeViolationException) e).error();
                assertThat(error).isInstanceOf(ShapeError.DisallowedKind.class);
                assertThat(((ShapeError.DisallowedKind) error).index()).isEqualTo(1);
            });
    }

    @Test
    void make_wrongArity_isRejected() {
        var children = List.<Optional<RawSyntax>>of(Optional.of(token(TokenKind.BREAK_KEYWORD, "break")));

        assertThatThrownBy(() -> RawLayout.make(NodeKind.BREAK_STMT, children))
            .isInstanceOf(ShapeViolationException.class)
            .hasMessage("BREAK_STMT expects 2 children, got 1");
    }

    @Test
    void make_absentRequiredChild_isRejected() {
        var children = List.<Optional<RawSyntax>>of(Optional.empty(), Optional.empty());

        assertThatThrownBy(() -> RawLayout.make(NodeKind.BREAK_STMT, children))
            .isInstanceOf(ShapeViolationException.class)
            .hasMessageContaining("breakKeyword");
    }

    @Test
    void make_collectionWithForeignElement_isRejected() {
        assertThatThrownBy(() -> RawLayout.makePresent(NodeKind.DECL_MEMBERS,
                                                       List.of(RawLayout.blank(NodeKind.BREAK_STMT))))
            .isInstanceOf(ShapeViolationException.class)
            .hasMessageContaining("DECL_MEMBERS");
    }

    @Test
    void missing_fixedLayout_onlyWhenEveryChildIsAbsentOrMissing() {
        var missingKeyword = RawToken.missing(TokenKind.BREAK_KEYWORD, Trivia.EMPTY, Trivia.EMPTY);
        var label = token(TokenKind.IDENTIFIER, "outer");

        var allMissing = RawLayout.make(NodeKind.BREAK_STMT, List.of(Optional.of(missingKeyword), Optional.empty()));
        var partlyPresent = RawLayout.make(NodeKind.BREAK_STMT, List.of(Optional.of(missingKeyword), Optional.of(label)));

        assertThat(allMissing.isMissing()).isTrue();
        assertThat(partlyPresent.isMissing()).isFalse();
    }

    @Test
    void missing_emptyPresentCollection_isNotMissing() {
        var empty = RawLayout.makePresent(NodeKind.GENERIC_ARGUMENT_LIST, List.of());
        var blank = RawLayout.blank(NodeKind.GENERIC_ARGUMENT_LIST);

        assertThat(empty.isMissing()).isFalse();
        assertThat(blank.isMissing()).isTrue();
        assertThat(blank.childCount()).isZero();
    }

    @Test
    void missing_collectionOfMissingElements_isMissing() {
        var list = RawLayout.makePresent(NodeKind.GENERIC_ARGUMENT_LIST,
                                         List.of(RawLayout.blank(NodeKind.GENERIC_ARGUMENT),
                                                 RawLayout.blank(NodeKind.GENERIC_ARGUMENT)));

        assertThat(list.isMissing()).isTrue();
    }

    @Test
    void blank_fillsRequiredSlotsAndLeavesOptionalAbsent() {
        var blank = RawLayout.blank(NodeKind.TYPEALIAS_DECL);

        assertThat(blank.childCount()).isEqualTo(5);
        assertThat(blank.child(0)).hasValueSatisfying(child -> {
            assertThat(child.kind()).isEqualTo(TokenKind.TYPEALIAS_KEYWORD);
            assertThat(child.isMissing()).isTrue();
        });
        assertThat(blank.child(2)).isEmpty();
        assertThat(blank.child(4)).hasValueSatisfying(child -> assertThat(child.kind()).isEqualTo(NodeKind.TYPE_IDENTIFIER));
        assertThat(blank.text()).isEmpty();
    }

    @Test
    void replacingChild_sharesUntouchedChildren() {
        var left = typeIdentifier("T");
        var right = typeIdentifier("U");
        var requirement = RawLayout.make(NodeKind.SAME_TYPE_REQUIREMENT,
                                         List.of(Optional.of(left),
                                                 Optional.of(token(TokenKind.OPERATOR, "==")),
                                                 Optional.of(right),
                                                 Optional.empty()));

        var edited = requirement.replacingChild(2, Optional.of(typeIdentifier("V")));

        assertThat(edited.child(0).get()).isSameAs(left);
        assertThat(edited.child(1).get()).isSameAs(requirement.child(1).get());
        assertThat(requirement.child(2).get()).isSameAs(right);
        assertThat(edited.text()).isEqualTo("T==V");
        assertThat(requirement.text()).isEqualTo("T==U");
    }

    @Test
    void inserting_andRemoving_keepCollectionValid() {
        var list = RawLayout.makePresent(NodeKind.BALANCED_TOKENS, List.of(token(TokenKind.IDENTIFIER, "a")));

        var longer = list.inserting(0, token(TokenKind.INTEGER_LITERAL, "1"));
        var shorter = longer.removing(1);

        assertThat(longer.text()).isEqualTo("1a");
        assertThat(shorter.text()).isEqualTo("1");
        assertThat(list.text()).isEqualTo("a");
    }

    @Test
    void textLength_sumsChildrenIncludingTrivia() {
        var keyword = RawToken.make(TokenKind.BREAK_KEYWORD, "break", Trivia.newlines(1), Trivia.spaces(1));
        var label = RawToken.make(TokenKind.IDENTIFIER, "outer", Trivia.EMPTY, Trivia.lineComment("// done"));
        var stmt = RawLayout.make(NodeKind.BREAK_STMT, List.of(Optional.of(keyword), Optional.of(label)));

        assertThat(stmt.text()).isEqualTo("\nbreak outer// done");
        assertThat(stmt.textLength()).isEqualTo(stmt.text().length());
    }

    @Test
    void equals_isStructural() {
        assertThat(typeIdentifier("T")).isEqualTo(typeIdentifier("T"))
                                       .hasSameHashCodeAs(typeIdentifier("T"))
                                       .isNotEqualTo(typeIdentifier("U"));
        assertThat(RawLayout.blank(NodeKind.GENERIC_ARGUMENT_LIST))
            .isNotEqualTo(RawLayout.makePresent(NodeKind.GENERIC_ARGUMENT_LIST, List.of()));
    }

    @Test
    void token_fixedTextMismatch_isRejected() {
        assertThatThrownBy(() -> RawToken.make(TokenKind.STRUCT_KEYWORD, "class", Trivia.EMPTY, Trivia.EMPTY))
            .isInstanceOf(ShapeViolationException.class)
            .hasMessage("STRUCT_KEYWORD must be spelled 'struct', got 'class'");
    }

    @Test
    void token_withoutTrivia_isInterned() {
        var first = RawToken.make(TokenKind.COMMA, ",", Trivia.EMPTY, Trivia.EMPTY);
        var second = RawToken.canonical(TokenKind.COMMA, Trivia.EMPTY, Trivia.EMPTY);
        var spaced = RawToken.canonical(TokenKind.COMMA, Trivia.EMPTY, Trivia.spaces(1));

        assertThat(first).isSameAs(second);
        assertThat(spaced).isNotSameAs(first);
        assertThat(spaced.text()).isEqualTo(", ");
    }

    @Test
    void missingToken_hasEmptyTextButKeepsTrivia() {
        var missing = RawToken.missing(TokenKind.RIGHT_BRACE, Trivia.newlines(1), Trivia.EMPTY);

        assertThat(missing.isMissing()).isTrue();
        assertThat(missing.tokenText()).isEmpty();
        assertThat(missing.text()).isEqualTo("\n");
    }

    @Test
    void firstToken_skipsLeadingEmptyCollection() {
        var function = SyntaxFactory.makeFunctionType(Optional.of(SyntaxFactory.makeTypeAttributes(List.of())),
                                                      SyntaxFactory.makeLeftParenToken(Trivia.spaces(2), Trivia.EMPTY),
                                                      SyntaxFactory.makeTypeArgumentList(List.of()),
                                                      SyntaxFactory.makeRightParenToken(Trivia.EMPTY, Trivia.spaces(1)),
                                                      Optional.empty(),
                                                      SyntaxFactory.makeArrow(Trivia.EMPTY, Trivia.spaces(1)),
                                                      SyntaxFactory.makeSimpleTypeIdentifier("Void", Trivia.EMPTY, Trivia.EMPTY));

        assertThat(function.raw().firstToken()).hasValueSatisfying(token -> assertThat(token.kind()).isEqualTo(TokenKind.LEFT_PAREN));
        assertThat(function.typeAttributes().orElseThrow().raw().firstToken()).isEmpty();
        assertThat(function.textPosition()).isEqualTo(2);
    }

    @Test
    void firstToken_ofBlank_isMissingToken() {
        var blank = RawLayout.blank(NodeKind.OPTIONAL_TYPE);

        assertThat(blank.firstToken()).hasValueSatisfying(token -> {
            assertThat(token.kind()).isEqualTo(TokenKind.IDENTIFIER);
            assertThat(token.isMissing()).isTrue();
        });
    }
}
