package org.pragmatica.syntax.print;

import org.junit.jupiter.api.Test;
import org.pragmatica.syntax.SyntaxFactory;
import org.pragmatica.syntax.SyntaxFixtures;
import org.pragmatica.syntax.kind.TokenKind;
import org.pragmatica.syntax.tree.Trivia;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyntaxPrinterTest {

    @Test
    void print_default_reproducesSource() {
        assertThat(SyntaxPrinter.print(SyntaxFixtures.pairStruct())).isEqualTo(SyntaxFixtures.PAIR_SOURCE);
        assertThat(SyntaxPrinter.print(SyntaxFixtures.callbackType())).isEqualTo(SyntaxFixtures.CALLBACK_SOURCE);
    }

    @Test
    void print_subtree_printsOnlyThatSubtree() {
        var callback = SyntaxFixtures.callbackType();

        assertThat(SyntaxPrinter.print(callback.returnType())).isEqualTo("Void?");
        assertThat(SyntaxPrinter.print(callback.arguments().get(1))).isEqualTo("label: String");
    }

    @Test
    void print_withoutTrivia_joinsTokenText() {
        var options = PrintOptions.builder()
                                  .trivia(false)
                                  .build();

        assertThat(SyntaxPrinter.print(SyntaxFixtures.callbackType(), options))
            .isEqualTo("@escaping(inoutInt,label:String)throws->Void?");
    }

    @Test
    void print_withPlaceholder_marksMissingTokens() {
        var decl = SyntaxFactory.makeStructDecl(SyntaxFactory.makeStructKeyword(Trivia.EMPTY, Trivia.spaces(1)),
                                                SyntaxFactory.makeMissingToken(TokenKind.IDENTIFIER, Trivia.EMPTY, Trivia.spaces(1)),
                                                Optional.empty(),
                                                Optional.empty(),
                                                SyntaxFactory.makeLeftBraceToken(Trivia.EMPTY, Trivia.EMPTY),
                                                SyntaxFactory.makeDeclMembers(List.of()),
                                                SyntaxFactory.makeMissingToken(TokenKind.RIGHT_BRACE));
        var options = PrintOptions.builder()
                                  .missingPlaceholder("<#>")
                                  .build();

        assertThat(SyntaxPrinter.print(decl)).isEqualTo("struct  {");
        assertThat(SyntaxPrinter.print(decl, options)).isEqualTo("struct <#> {<#>");
    }

    @Test
    void defaults_roundTrip() {
        assertThat(PrintOptions.DEFAULT.includeTrivia()).isTrue();
        assertThat(PrintOptions.DEFAULT.missingPlaceholder()).isEmpty();
        assertThat(PrintOptions.builder().build()).isEqualTo(PrintOptions.DEFAULT);
        assertThatThrownBy(() -> new PrintOptions(true, null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void dump_showsSlotNamesAndTokenText() {
        var type = SyntaxFactory.makeOptionalTypeOf(SyntaxFactory.makeSimpleTypeIdentifier("Int", Trivia.EMPTY, Trivia.EMPTY),
                                                    Trivia.spaces(1));

        assertThat(SyntaxPrinter.dump(type)).isEqualTo("""
            OPTIONAL_TYPE
              baseType: TYPE_IDENTIFIER
                identifier: IDENTIFIER "Int"
              questionMark: QUESTION_POSTFIX "?"
            """);
    }

    @Test
    void dump_marksMissingAndEmptyNodes() {
        assertThat(SyntaxPrinter.dump(SyntaxFactory.makeBlankBreakStmt())).isEqualTo("""
            BREAK_STMT <missing>
              breakKeyword: BREAK_KEYWORD <missing>
            """);
        assertThat(SyntaxPrinter.dump(SyntaxFactory.makeVoidTupleType())).isEqualTo("""
            TUPLE_TYPE
              leftParen: LEFT_PAREN "("
              elements: TUPLE_TYPE_ELEMENT_LIST []
              rightParen: RIGHT_PAREN ")"
            """);
    }

    @Test
    void dump_collectionElements_haveNoSlotName() {
        var list = SyntaxFactory.makeBalancedTokens(List.of(SyntaxFactory.makeToken(TokenKind.STRING_LITERAL, "\"a\nb\"",
                                                                                    Trivia.EMPTY, Trivia.EMPTY)));

        assertThat(SyntaxPrinter.dump(list)).isEqualTo("""
            BALANCED_TOKENS
              STRING_LITERAL "\\"a\\nb\\""
            """);
    }
}
