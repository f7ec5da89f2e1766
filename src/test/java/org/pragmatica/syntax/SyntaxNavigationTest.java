package org.pragmatica.syntax;

import org.junit.jupiter.api.Test;
import org.pragmatica.syntax.kind.NodeKind;
import org.pragmatica.syntax.kind.TokenKind;
import org.pragmatica.syntax.tree.Trivia;

import java.util.ArrayList;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyntaxNavigationTest {

    @Test
    void root_hasNoParentAndNegativeIndex() {
        var pair = SyntaxFixtures.pairStruct();

        assertThat(pair.isRoot()).isTrue();
        assertThat(pair.parent()).isEmpty();
        assertThat(pair.indexInParent()).isEqualTo(-1);
        assertThat(pair.root()).isSameAs(pair);
        assertThat(pair.position()).isZero();
    }

    @Test
    void child_knowsParentAndSlot() {
        var pair = SyntaxFixtures.pairStruct();

        var members = pair.members();

        assertThat(members.indexInParent()).isEqualTo(5);
        assertThat(members.parent()).contains(pair);
        assertThat(members.root()).isSameAs(pair);
        assertThat(pair.child(2)).hasValueSatisfying(child -> assertThat(child.kind()).isEqualTo(NodeKind.GENERIC_PARAMETER_CLAUSE));
    }

    @Test
    void children_skipAbsentSlots() {
        var stmt = SyntaxFactory.makeBreakStmt(SyntaxFactory.makeBreakKeyword(Trivia.EMPTY, Trivia.EMPTY));

        assertThat(stmt.childCount()).isEqualTo(2);
        assertThat(stmt.children()).hasSize(1);
        assertThat(stmt.child(1)).isEmpty();
    }

    @Test
    void tokenChild_isOutOfBounds() {
        var token = SyntaxFactory.makeCommaToken(Trivia.EMPTY, Trivia.EMPTY);

        assertThat(token.childCount()).isZero();
        assertThat(token.children()).isEmpty();
        assertThatThrownBy(() -> token.child(0)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void positions_countTriviaOfPrecedingSiblings() {
        var pair = SyntaxFixtures.pairStruct();
        var source = SyntaxFixtures.PAIR_SOURCE;

        var identifier = pair.identifier();
        var alias = (TypealiasDeclSyntax) pair.members().get(0);

        assertThat(identifier.position()).isEqualTo(source.indexOf("Pair"));
        assertThat(pair.structKeyword().position()).isZero();
        assertThat(pair.structKeyword().textPosition()).isEqualTo(source.indexOf("struct"));
        assertThat(alias.position()).isEqualTo(source.indexOf("    typealias"));
        assertThat(alias.textPosition()).isEqualTo(source.indexOf("typealias"));
        assertThat(pair.rightBrace().position()).isEqualTo(source.length() - 1);
    }

    @Test
    void firstAndLastToken_walkIntoChildren() {
        var callback = SyntaxFixtures.callbackType();

        assertThat(callback.firstToken()).hasValueSatisfying(token -> assertThat(token.tokenKind()).isEqualTo(TokenKind.AT_SIGN));
        assertThat(callback.lastToken()).hasValueSatisfying(token -> assertThat(token.tokenKind()).isEqualTo(TokenKind.QUESTION_POSTFIX));
        assertThat(SyntaxFactory.makeBlankGenericArgumentList().firstToken()).isEmpty();
    }

    @Test
    void tokenClassification_followsKind() {
        var pair = SyntaxFixtures.pairStruct();

        assertThat(pair.structKeyword().isKeyword()).isTrue();
        assertThat(pair.leftBrace().isPunctuation()).isTrue();
        assertThat(pair.identifier().isKeyword()).isFalse();
        assertThat(pair.structKeyword().isToken()).isTrue();
        assertThat(pair.isToken()).isFalse();
    }

    @Test
    void concurrentReaders_seeSameText() throws Exception {
        var pair = SyntaxFixtures.pairStruct();
        var executor = Executors.newFixedThreadPool(4);
        try {
            var tasks = new ArrayList<Callable<String>>();
            for (var i = 0; i < 16; i++) {
                tasks.add(() -> {
                    var alias = (TypealiasDeclSyntax) pair.members().get(0);
                    return alias.root().text() + "|" + alias.type().position();
                });
            }

            var results = new ArrayList<String>();
            for (var future : executor.invokeAll(tasks)) {
                results.add(future.get());
            }

            assertThat(results).hasSize(16)
                               .containsOnly(results.get(0));
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        }
    }
}
