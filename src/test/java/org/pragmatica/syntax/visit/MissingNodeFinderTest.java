package org.pragmatica.syntax.visit;

import org.junit.jupiter.api.Test;
import org.pragmatica.syntax.StructDeclSyntax;
import org.pragmatica.syntax.SyntaxFactory;
import org.pragmatica.syntax.SyntaxFixtures;
import org.pragmatica.syntax.TypealiasDeclSyntax;
import org.pragmatica.syntax.kind.NodeKind;
import org.pragmatica.syntax.kind.TokenKind;
import org.pragmatica.syntax.tree.SourceLocation;
import org.pragmatica.syntax.tree.Trivia;
import org.pragmatica.syntax.tree.TriviaPiece;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.syntax.SyntaxFactory.*;

class MissingNodeFinderTest {
    static final String BROKEN_SOURCE = "struct Box<T {\n    typealias Value = \n}";

    /**
     * What a recovering parser builds for {@link #BROKEN_SOURCE}: the closing angle bracket
     * and the aliased type are missing.
     */
    static StructDeclSyntax brokenStruct() {
        var parameters = makeGenericParameterClause(makeLeftAngleToken(Trivia.EMPTY, Trivia.EMPTY),
                                                    makeGenericParameterList(List.of(makeSimpleGenericParameter("T",
                                                                                                                Trivia.EMPTY,
                                                                                                                Trivia.spaces(1)))),
                                                    makeMissingToken(TokenKind.RIGHT_ANGLE));
        var alias = makeTypealiasDecl(makeTypealiasKeyword(Trivia.spaces(4), Trivia.spaces(1)),
                                      makeIdentifier("Value", Trivia.EMPTY, Trivia.spaces(1)),
                                      Optional.empty(),
                                      makeEqualToken(Trivia.EMPTY, Trivia.spaces(1)),
                                      makeBlankTypeIdentifier());
        return makeStructDecl(makeStructKeyword(Trivia.EMPTY, Trivia.spaces(1)),
                              makeIdentifier("Box", Trivia.EMPTY, Trivia.EMPTY),
                              Optional.of(parameters),
                              Optional.empty(),
                              makeLeftBraceToken(Trivia.EMPTY, Trivia.newlines(1)),
                              makeDeclMembers(List.of(alias)),
                              makeRightBraceToken(Trivia.newlines(1), Trivia.EMPTY));
    }

    @Test
    void brokenStruct_printsItsSource() {
        assertThat(brokenStruct().text()).isEqualTo(BROKEN_SOURCE);
    }

    @Test
    void find_reportsMissingNodesInSourceOrder() {
        var missing = MissingNodeFinder.find(brokenStruct());

        assertThat(missing).hasSize(2);
        assertThat(missing.get(0).kind()).isEqualTo(TokenKind.RIGHT_ANGLE);
        assertThat(missing.get(0).location()).isEqualTo(SourceLocation.at(1, 14, 13));
        assertThat(missing.get(1).kind()).isEqualTo(NodeKind.TYPE_IDENTIFIER);
        assertThat(missing.get(1).location()).isEqualTo(SourceLocation.at(2, 23, 37));
    }

    @Test
    void find_reportsOnlyOutermostMissingNode() {
        var missing = MissingNodeFinder.find(brokenStruct());

        // the blank type identifier also holds a missing identifier token, which is not listed
        assertThat(missing).extracting(MissingNode::kind)
                           .doesNotContain(TokenKind.IDENTIFIER);
    }

    @Test
    void find_viewLeadsBackToParent() {
        var missingType = MissingNodeFinder.find(brokenStruct()).get(1);

        assertThat(missingType.node().parent()).hasValueSatisfying(parent -> {
            assertThat(parent).isInstanceOf(TypealiasDeclSyntax.class);
            assertThat(((TypealiasDeclSyntax) parent).identifier().tokenText()).isEqualTo("Value");
        });
    }

    @Test
    void find_onCompleteTree_reportsNothing() {
        assertThat(MissingNodeFinder.find(SyntaxFixtures.pairStruct())).isEmpty();
        assertThat(MissingNodeFinder.hasMissing(SyntaxFixtures.callbackType())).isFalse();
        assertThat(MissingNodeFinder.hasMissing(brokenStruct())).isTrue();
    }

    @Test
    void find_onBlankRoot_reportsRootOnly() {
        var blank = SyntaxFactory.makeBlankStructDecl();

        var missing = MissingNodeFinder.find(blank);

        assertThat(missing).hasSize(1);
        assertThat(missing.get(0).node()).isEqualTo(blank);
        assertThat(missing.get(0).location()).isEqualTo(SourceLocation.START);
    }

    @Test
    void find_withStartLocation_offsetsResults() {
        var missing = MissingNodeFinder.find(brokenStruct(), SourceLocation.at(10, 1, 100));

        assertThat(missing.get(0).location()).isEqualTo(SourceLocation.at(10, 14, 113));
    }

    @Test
    void find_carriageReturnLineFeedSplitAcrossTokens_countsOneBreak() {
        var statements = makeStmtList(List.of(
            makeFallthroughStmt(makeFallthroughKeyword(Trivia.EMPTY, Trivia.of(new TriviaPiece.Newline("\r")))),
            makeBreakStmt(makeMissingToken(TokenKind.BREAK_KEYWORD, Trivia.of(new TriviaPiece.Newline("\n")), Trivia.EMPTY))));

        var missing = MissingNodeFinder.find(statements);

        assertThat(statements.text()).isEqualTo("fallthrough\r\n");
        assertThat(missing).hasSize(1);
        assertThat(missing.get(0).kind()).isEqualTo(NodeKind.BREAK_STMT);
        assertThat(missing.get(0).location()).isEqualTo(SourceLocation.at(2, 1, 13))
                                             .isEqualTo(SourceLocator.locationOf(missing.get(0).node()));
    }

    @Test
    void emptyPresentCollection_isNotReported() {
        var tuple = SyntaxFactory.makeVoidTupleType();

        assertThat(MissingNodeFinder.find(tuple)).isEmpty();
    }
}
