package org.pragmatica.syntax;

import org.junit.jupiter.api.Test;
import org.pragmatica.syntax.kind.NodeKind;
import org.pragmatica.syntax.kind.TokenKind;
import org.pragmatica.syntax.tree.Trivia;
import org.pragmatica.syntax.tree.TriviaPiece;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.syntax.SyntaxFactory.*;

class RoundTripTest {

    @Test
    void struct_printsExactSource() {
        var pair = SyntaxFixtures.pairStruct();

        assertThat(pair.text()).isEqualTo(SyntaxFixtures.PAIR_SOURCE);
        assertThat(pair.textLength()).isEqualTo(SyntaxFixtures.PAIR_SOURCE.length());
        assertThat(pair.isMissing()).isFalse();
    }

    @Test
    void functionType_printsExactSource() {
        var callback = SyntaxFixtures.callbackType();

        assertThat(callback.text()).isEqualTo(SyntaxFixtures.CALLBACK_SOURCE);
        assertThat(callback.toString()).isEqualTo(SyntaxFixtures.CALLBACK_SOURCE);
    }

    @Test
    void tokens_concatenateToSource() {
        var tokens = new ArrayList<TokenSyntax>();
        collectTokens(SyntaxFixtures.pairStruct(), tokens);

        var sb = new StringBuilder();
        for (var token : tokens) {
            sb.append(token.leadingTrivia().text())
              .append(token.tokenText())
              .append(token.trailingTrivia().text());
        }

        assertThat(sb.toString()).isEqualTo(SyntaxFixtures.PAIR_SOURCE);
        assertThat(tokens.get(0).leadingTrivia().contains(TriviaPiece.DocLineComment.class)).isTrue();
    }

    @Test
    void accessors_returnParsedPieces() {
        var pair = SyntaxFixtures.pairStruct();

        assertThat(pair.identifier().tokenText()).isEqualTo("Pair");
        assertThat(pair.genericParameterClause()).hasValueSatisfying(clause -> {
            assertThat(clause.parameters().size()).isEqualTo(2);
            assertThat(clause.parameters().get(1).inheritedType()).hasValueSatisfying(
                type -> assertThat(type.text()).isEqualTo("Hashable"));
        });
        var requirement = pair.genericWhereClause().orElseThrow().requirements().get(0);
        assertThat(requirement).isInstanceOf(SameTypeRequirementSyntax.class);
        assertThat(requirement.leftType().identifier().tokenText()).isEqualTo("T");

        var alias = (TypealiasDeclSyntax) pair.members().get(0);
        assertThat(alias.type().kind()).isEqualTo(NodeKind.DICTIONARY_TYPE);
    }

    @Test
    void missingTokens_printNothingButKeepTrivia() {
        // "struct S {" with the closing brace never written
        var decl = makeStructDecl(makeStructKeyword(Trivia.EMPTY, Trivia.spaces(1)),
                                  makeIdentifier("S", Trivia.EMPTY, Trivia.spaces(1)),
                                  Optional.empty(),
                                  Optional.empty(),
                                  makeLeftBraceToken(Trivia.EMPTY, Trivia.newlines(1)),
                                  makeDeclMembers(List.of()),
                                  makeMissingToken(TokenKind.RIGHT_BRACE));

        assertThat(decl.text()).isEqualTo("struct S {\n");
        assertThat(decl.isMissing()).isFalse();
        assertThat(decl.rightBrace().isMissing()).isTrue();
    }

    @Test
    void garbageTrivia_survivesRoundTrip() {
        var source = "#!/usr/bin/swift\nfallthrough";
        var stmt = makeFallthroughStmt(makeFallthroughKeyword(Trivia.garbage("#!/usr/bin/swift").plus(Trivia.newlines(1)),
                                                              Trivia.EMPTY));

        assertThat(stmt.text()).isEqualTo(source);
    }

    private static void collectTokens(Syntax node, List<TokenSyntax> tokens) {
        if (node instanceof TokenSyntax token) {
            tokens.add(token);
            return;
        }
        for (var child : node.children()) {
            collectTokens(child, tokens);
        }
    }
}
