package org.pragmatica.syntax.visit;

import org.junit.jupiter.api.Test;
import org.pragmatica.syntax.Syntax;
import org.pragmatica.syntax.SyntaxFactory;
import org.pragmatica.syntax.SyntaxFixtures;
import org.pragmatica.syntax.TokenSyntax;
import org.pragmatica.syntax.TypealiasDeclSyntax;
import org.pragmatica.syntax.kind.NodeKind;
import org.pragmatica.syntax.kind.SyntaxKind;
import org.pragmatica.syntax.kind.TokenKind;
import org.pragmatica.syntax.tree.SourceLocation;
import org.pragmatica.syntax.tree.SourceSpan;
import org.pragmatica.syntax.tree.Trivia;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SyntaxWalkerTest {

    @Test
    void walk_visitsInPreOrderAndLeavesInPostOrder() {
        var events = new ArrayList<String>();

        SyntaxWalker.walk(SyntaxFixtures.callbackType().returnType(), new SyntaxVisitor() {
            @Override
            public boolean enter(Syntax node, SourceLocation location) {
                events.add("+" + node.kind().name());
                return true;
            }

            @Override
            public void leave(Syntax node) {
                events.add("-" + node.kind().name());
            }
        });

        assertThat(events).containsExactly("+OPTIONAL_TYPE",
                                           "+TYPE_IDENTIFIER",
                                           "+IDENTIFIER",
                                           "-IDENTIFIER",
                                           "-TYPE_IDENTIFIER",
                                           "+QUESTION_POSTFIX",
                                           "-QUESTION_POSTFIX",
                                           "-OPTIONAL_TYPE");
    }

    @Test
    void walk_tokenLocations_matchSourceText() {
        var source = SyntaxFixtures.PAIR_SOURCE;
        var locations = new HashMap<String, SourceLocation>();

        SyntaxWalker.walk(SyntaxFixtures.pairStruct(), new SyntaxVisitor() {
            @Override
            public boolean enter(Syntax node, SourceLocation location) {
                if (node instanceof TokenSyntax token) {
                    assertThat(location.offset()).as(token.tokenText())
                                                 .isEqualTo(token.textPosition());
                    locations.putIfAbsent(token.tokenText(), location);
                }
                return true;
            }
        });

        assertThat(locations.get("struct")).isEqualTo(SourceLocation.at(2, 1, source.indexOf("struct")));
        assertThat(locations.get("typealias")).isEqualTo(SourceLocation.at(3, 5, source.indexOf("typealias")));
        assertThat(locations.get("}")).isEqualTo(SourceLocation.at(4, 1, source.length() - 1));
    }

    @Test
    void walk_skippedSubtree_stillAdvancesLocation() {
        var kinds = new ArrayList<SyntaxKind>();
        var where = new ArrayList<SourceLocation>();

        SyntaxWalker.walk(SyntaxFixtures.pairStruct(), new SyntaxVisitor() {
            @Override
            public boolean enter(Syntax node, SourceLocation location) {
                kinds.add(node.kind());
                if (node.kind() == TokenKind.LEFT_BRACE) {
                    where.add(location);
                }
                return node.kind() != NodeKind.GENERIC_WHERE_CLAUSE;
            }
        });

        assertThat(kinds).contains(NodeKind.GENERIC_WHERE_CLAUSE)
                         .doesNotContain(NodeKind.SAME_TYPE_REQUIREMENT);
        assertThat(where).containsExactly(SourceLocation.at(2, 42, SyntaxFixtures.PAIR_SOURCE.indexOf("{")));
    }

    @Test
    void locator_spanExcludesOuterTrivia() {
        var pair = SyntaxFixtures.pairStruct();
        var alias = (TypealiasDeclSyntax) pair.members().get(0);

        SourceSpan span = SourceLocator.spanOf(alias);

        assertThat(span.extract(SyntaxFixtures.PAIR_SOURCE)).isEqualTo("typealias Key = [T: U?]");
        assertThat(span.start()).isEqualTo(SourceLocator.locationOf(alias));
        assertThat(span.start().line()).isEqualTo(3);
        assertThat(span.end().column()).isEqualTo(28);
    }

    @Test
    void locator_missingNode_getsEmptySpan() {
        var broken = MissingNodeFinderTest.brokenStruct();
        var missingType = MissingNodeFinder.find(broken).get(1).node();

        var span = SourceLocator.spanOf(missingType);

        assertThat(span.isEmpty()).isTrue();
        assertThat(span.start()).isEqualTo(SourceLocation.at(2, 23, 37));
    }

    @Test
    void locator_agreesWithWalker() {
        var nodes = new ArrayList<Syntax>();
        var locations = new ArrayList<SourceLocation>();

        SyntaxWalker.walk(SyntaxFixtures.pairStruct(), new SyntaxVisitor() {
            @Override
            public boolean enter(Syntax node, SourceLocation location) {
                nodes.add(node);
                locations.add(location);
                return true;
            }
        });

        for (var i = 0; i < nodes.size(); i++) {
            assertThat(SourceLocator.locationOf(nodes.get(i))).as(nodes.get(i).kind().name())
                                                              .isEqualTo(locations.get(i));
        }
    }

    @Test
    void walk_leadingEmptyCollection_locatedBeforeFirstToken() {
        var function = SyntaxFactory.makeFunctionType(Optional.of(SyntaxFactory.makeTypeAttributes(List.of())),
                                                      SyntaxFactory.makeLeftParenToken(Trivia.spaces(2), Trivia.EMPTY),
                                                      SyntaxFactory.makeTypeArgumentList(List.of()),
                                                      SyntaxFactory.makeRightParenToken(Trivia.EMPTY, Trivia.spaces(1)),
                                                      Optional.empty(),
                                                      SyntaxFactory.makeArrow(Trivia.EMPTY, Trivia.spaces(1)),
                                                      SyntaxFactory.makeSimpleTypeIdentifier("Void", Trivia.EMPTY, Trivia.EMPTY));
        var kinds = new ArrayList<SyntaxKind>();
        var locations = new ArrayList<SourceLocation>();

        SyntaxWalker.walk(function, new SyntaxVisitor() {
            @Override
            public boolean enter(Syntax node, SourceLocation location) {
                kinds.add(node.kind());
                locations.add(location);
                return true;
            }
        });

        assertThat(kinds.subList(0, 3)).containsExactly(NodeKind.FUNCTION_TYPE, NodeKind.TYPE_ATTRIBUTES, TokenKind.LEFT_PAREN);
        assertThat(locations.subList(0, 3)).containsExactly(SourceLocation.at(1, 3, 2),
                                                            SourceLocation.START,
                                                            SourceLocation.at(1, 3, 2));
    }
}
