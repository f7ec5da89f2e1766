package org.pragmatica.syntax;

import com.google.common.collect.ImmutableList;
import org.pragmatica.syntax.kind.NodeKind;
import org.pragmatica.syntax.kind.TokenKind;
import org.pragmatica.syntax.tree.Trivia;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry point for building syntax trees. Every node is created here: tokens from scanner output,
 * layouts bottom-up from already-built children, and blank placeholders wherever the parser could
 * not find the expected input.
 *
 * <p>Each {@code make<Kind>} method takes exactly the children of that kind's shape, optional ones
 * as {@link Optional}. Children are checked against the shape registry; a mismatch is a bug in the
 * caller and raises {@link org.pragmatica.syntax.error.ShapeViolationException}.
 *
 * <p>Example usage:
 * <pre>{@code
 * var type = SyntaxFactory.makeOptionalTypeOf(
 *     SyntaxFactory.makeSimpleTypeIdentifier("Int", Trivia.EMPTY, Trivia.EMPTY),
 *     Trivia.spaces(1));
 *
 * type.toString(); // "Int? "
 * }</pre>
 */
public final class SyntaxFactory {
    private static final Logger log = LoggerFactory.getLogger(SyntaxFactory.class);

    private SyntaxFactory() {}

    // === Generic construction ===

    /**
     * Fully missing placeholder of any node kind.
     */
    public static Syntax makeBlank(NodeKind kind) {
        log.trace("Synthesizing blank {}", kind);
        return Syntax.root(RawLayout.blank(kind));
    }

    /**
     * Collect tokens the parser could not make sense of into a piece of unknown syntax.
     */
    public static UnknownSyntax makeUnknownSyntax(List<TokenSyntax> tokens) {
        return collection(NodeKind.UNKNOWN, UnknownSyntax.class, tokens);
    }

    // === Tokens ===

    /**
     * Present token with the given text. Keyword and punctuation kinds only accept their own spelling.
     */
    public static TokenSyntax makeToken(TokenKind kind, String text, Trivia leadingTrivia, Trivia trailingTrivia) {
        return (TokenSyntax) Syntax.root(RawToken.make(kind, text, leadingTrivia, trailingTrivia));
    }

    /**
     * Missing token with empty text and no trivia.
     */
    public static TokenSyntax makeMissingToken(TokenKind kind) {
        return makeMissingToken(kind, Trivia.EMPTY, Trivia.EMPTY);
    }

    /**
     * Missing token keeping trivia the recovery code decided to attach to it.
     */
    public static TokenSyntax makeMissingToken(TokenKind kind, Trivia leadingTrivia, Trivia trailingTrivia) {
        return (TokenSyntax) Syntax.root(RawToken.missing(kind, leadingTrivia, trailingTrivia));
    }

    public static TokenSyntax makeIdentifier(String name, Trivia leadingTrivia, Trivia trailingTrivia) {
        return makeToken(TokenKind.IDENTIFIER, name, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeStructKeyword(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.STRUCT_KEYWORD, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeTypealiasKeyword(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.TYPEALIAS_KEYWORD, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeWhereKeyword(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.WHERE_KEYWORD, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeInoutKeyword(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.INOUT_KEYWORD, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeThrowsKeyword(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.THROWS_KEYWORD, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeRethrowsKeyword(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.RETHROWS_KEYWORD, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeFallthroughKeyword(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.FALLTHROUGH_KEYWORD, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeBreakKeyword(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.BREAK_KEYWORD, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeAnyKeyword(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.ANY_KEYWORD, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeSelfKeyword(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.SELF_KEYWORD, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeAtSignToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.AT_SIGN, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeLeftAngleToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.LEFT_ANGLE, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeRightAngleToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.RIGHT_ANGLE, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeLeftParenToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.LEFT_PAREN, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeRightParenToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.RIGHT_PAREN, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeLeftSquareBracketToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.LEFT_SQUARE_BRACKET, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeRightSquareBracketToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.RIGHT_SQUARE_BRACKET, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeLeftBraceToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.LEFT_BRACE, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeRightBraceToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.RIGHT_BRACE, leadingTrivia, trailingTrivia);
    }

    /**
     * Postfix {@code ?}. Postfix operators bind to the preceding token, so there is no leading trivia.
     */
    public static TokenSyntax makeQuestionPostfixToken(Trivia trailingTrivia) {
        return canonical(TokenKind.QUESTION_POSTFIX, Trivia.EMPTY, trailingTrivia);
    }

    /**
     * Postfix {@code !}. Postfix operators bind to the preceding token, so there is no leading trivia.
     */
    public static TokenSyntax makeExclaimPostfixToken(Trivia trailingTrivia) {
        return canonical(TokenKind.EXCLAIM_POSTFIX, Trivia.EMPTY, trailingTrivia);
    }

    public static TokenSyntax makeCommaToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.COMMA, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeColonToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.COLON, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeDotToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.PERIOD, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeEqualToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.EQUAL, leadingTrivia, trailingTrivia);
    }

    public static TokenSyntax makeArrow(Trivia leadingTrivia, Trivia trailingTrivia) {
        return canonical(TokenKind.ARROW, leadingTrivia, trailingTrivia);
    }

    /**
     * The {@code ==} binary operator.
     */
    public static TokenSyntax makeEqualityOperator(Trivia leadingTrivia, Trivia trailingTrivia) {
        return makeToken(TokenKind.OPERATOR, "==", leadingTrivia, trailingTrivia);
    }

    /**
     * The {@code Type} name of a metatype. Lexically an identifier.
     */
    public static TokenSyntax makeTypeToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return makeIdentifier("Type", leadingTrivia, trailingTrivia);
    }

    /**
     * The {@code Protocol} name of a protocol metatype. Lexically an identifier.
     */
    public static TokenSyntax makeProtocolToken(Trivia leadingTrivia, Trivia trailingTrivia) {
        return makeIdentifier("Protocol", leadingTrivia, trailingTrivia);
    }

    // === Declarations ===

    public static StructDeclSyntax makeStructDecl(TokenSyntax structKeyword,
                                                  TokenSyntax identifier,
                                                  Optional<GenericParameterClauseSyntax> genericParameterClause,
                                                  Optional<GenericWhereClauseSyntax> genericWhereClause,
                                                  TokenSyntax leftBrace,
                                                  DeclMembersSyntax members,
                                                  TokenSyntax rightBrace) {
        return layout(NodeKind.STRUCT_DECL,
                      StructDeclSyntax.class,
                      present(structKeyword),
                      present(identifier),
                      absentOr(genericParameterClause),
                      absentOr(genericWhereClause),
                      present(leftBrace),
                      present(members),
                      present(rightBrace));
    }

    public static StructDeclSyntax makeBlankStructDecl() {
        return blank(NodeKind.STRUCT_DECL, StructDeclSyntax.class);
    }

    public static TypealiasDeclSyntax makeTypealiasDecl(TokenSyntax typealiasKeyword,
                                                        TokenSyntax identifier,
                                                        Optional<GenericParameterClauseSyntax> genericParameterClause,
                                                        TokenSyntax equal,
                                                        TypeSyntax type) {
        return layout(NodeKind.TYPEALIAS_DECL,
                      TypealiasDeclSyntax.class,
                      present(typealiasKeyword),
                      present(identifier),
                      absentOr(genericParameterClause),
                      present(equal),
                      present(type));
    }

    public static TypealiasDeclSyntax makeBlankTypealiasDecl() {
        return blank(NodeKind.TYPEALIAS_DECL, TypealiasDeclSyntax.class);
    }

    public static DeclMembersSyntax makeDeclMembers(List<? extends DeclSyntax> members) {
        return collection(NodeKind.DECL_MEMBERS, DeclMembersSyntax.class, members);
    }

    /**
     * Empty, missing list of declaration members.
     */
    public static DeclMembersSyntax makeBlankDeclMembers() {
        return blank(NodeKind.DECL_MEMBERS, DeclMembersSyntax.class);
    }

    // === Statements ===

    public static CodeBlockStmtSyntax makeCodeBlock(TokenSyntax leftBrace, StmtListSyntax statements, TokenSyntax rightBrace) {
        return layout(NodeKind.CODE_BLOCK_STMT,
                      CodeBlockStmtSyntax.class,
                      present(leftBrace),
                      present(statements),
                      present(rightBrace));
    }

    public static CodeBlockStmtSyntax makeBlankCodeBlock() {
        return blank(NodeKind.CODE_BLOCK_STMT, CodeBlockStmtSyntax.class);
    }

    public static StmtListSyntax makeStmtList(List<? extends CodeBlockItem> items) {
        checkNotNull(items, "items");
        var raws = items.stream()
                        .map(CodeBlockItem::raw)
                        .collect(ImmutableList.toImmutableList());
        return StmtListSyntax.class.cast(Syntax.root(RawLayout.makePresent(NodeKind.STMT_LIST, raws)));
    }

    public static StmtListSyntax makeBlankStmtList() {
        return blank(NodeKind.STMT_LIST, StmtListSyntax.class);
    }

    public static FallthroughStmtSyntax makeFallthroughStmt(TokenSyntax fallthroughKeyword) {
        return layout(NodeKind.FALLTHROUGH_STMT, FallthroughStmtSyntax.class, present(fallthroughKeyword));
    }

    /**
     * {@code fallthrough} statement whose keyword is missing.
     */
    public static FallthroughStmtSyntax makeBlankFallthroughStmt() {
        return blank(NodeKind.FALLTHROUGH_STMT, FallthroughStmtSyntax.class);
    }

    public static BreakStmtSyntax makeBreakStmt(TokenSyntax breakKeyword, Optional<TokenSyntax> label) {
        return layout(NodeKind.BREAK_STMT, BreakStmtSyntax.class, present(breakKeyword), absentOr(label));
    }

    /**
     * Unlabeled {@code break}. Same as {@code makeBreakStmt(breakKeyword, Optional.empty())}.
     */
    public static BreakStmtSyntax makeBreakStmt(TokenSyntax breakKeyword) {
        return makeBreakStmt(breakKeyword, Optional.empty());
    }

    /**
     * {@code break} statement whose keyword is missing and whose label is absent.
     */
    public static BreakStmtSyntax makeBlankBreakStmt() {
        return blank(NodeKind.BREAK_STMT, BreakStmtSyntax.class);
    }

    // === Type attributes ===

    public static TypeAttributeSyntax makeTypeAttribute(TokenSyntax atSign,
                                                        TokenSyntax identifier,
                                                        Optional<TokenSyntax> leftParen,
                                                        Optional<BalancedTokensSyntax> balancedTokens,
                                                        Optional<TokenSyntax> rightParen) {
        return layout(NodeKind.TYPE_ATTRIBUTE,
                      TypeAttributeSyntax.class,
                      present(atSign),
                      present(identifier),
                      absentOr(leftParen),
                      absentOr(balancedTokens),
                      absentOr(rightParen));
    }

    /**
     * Attribute without an argument list, e.g. {@code @escaping}.
     */
    public static TypeAttributeSyntax makeTypeAttribute(TokenSyntax atSign, TokenSyntax identifier) {
        return makeTypeAttribute(atSign, identifier, Optional.empty(), Optional.empty(), Optional.empty());
    }

    public static TypeAttributeSyntax makeBlankTypeAttribute() {
        return blank(NodeKind.TYPE_ATTRIBUTE, TypeAttributeSyntax.class);
    }

    public static TypeAttributesSyntax makeTypeAttributes(List<TypeAttributeSyntax> attributes) {
        return collection(NodeKind.TYPE_ATTRIBUTES, TypeAttributesSyntax.class, attributes);
    }

    public static TypeAttributesSyntax makeBlankTypeAttributes() {
        return blank(NodeKind.TYPE_ATTRIBUTES, TypeAttributesSyntax.class);
    }

    public static BalancedTokensSyntax makeBalancedTokens(List<TokenSyntax> tokens) {
        return collection(NodeKind.BALANCED_TOKENS, BalancedTokensSyntax.class, tokens);
    }

    public static BalancedTokensSyntax makeBlankBalancedTokens() {
        return blank(NodeKind.BALANCED_TOKENS, BalancedTokensSyntax.class);
    }

    // === Types ===

    public static TypeIdentifierSyntax makeTypeIdentifier(TokenSyntax identifier,
                                                          Optional<GenericArgumentClauseSyntax> genericArgumentClause,
                                                          Optional<TokenSyntax> dot,
                                                          Optional<TypeIdentifierSyntax> childType) {
        return layout(NodeKind.TYPE_IDENTIFIER,
                      TypeIdentifierSyntax.class,
                      present(identifier),
                      absentOr(genericArgumentClause),
                      absentOr(dot),
                      absentOr(childType));
    }

    /**
     * Non-generic, unqualified type name.
     */
    public static TypeIdentifierSyntax makeSimpleTypeIdentifier(String name, Trivia leadingTrivia, Trivia trailingTrivia) {
        return makeTypeIdentifier(makeIdentifier(name, leadingTrivia, trailingTrivia),
                                  Optional.empty(),
                                  Optional.empty(),
                                  Optional.empty());
    }

    /**
     * Generic, unqualified type name such as {@code Array<Int>}.
     */
    public static TypeIdentifierSyntax makeGenericTypeIdentifier(TokenSyntax identifier,
                                                                 GenericArgumentClauseSyntax genericArguments) {
        return makeTypeIdentifier(identifier, Optional.of(genericArguments), Optional.empty(), Optional.empty());
    }

    /**
     * Bare {@code Any} without trivia.
     */
    public static TypeIdentifierSyntax makeAnyTypeIdentifier() {
        return makeTypeIdentifier(makeAnyKeyword(Trivia.EMPTY, Trivia.EMPTY),
                                  Optional.empty(),
                                  Optional.empty(),
                                  Optional.empty());
    }

    /**
     * Bare {@code Self} without trivia.
     */
    public static TypeIdentifierSyntax makeSelfTypeIdentifier() {
        return makeTypeIdentifier(makeSelfKeyword(Trivia.EMPTY, Trivia.EMPTY),
                                  Optional.empty(),
                                  Optional.empty(),
                                  Optional.empty());
    }

    public static TypeIdentifierSyntax makeBlankTypeIdentifier() {
        return blank(NodeKind.TYPE_IDENTIFIER, TypeIdentifierSyntax.class);
    }

    public static TupleTypeSyntax makeTupleType(TokenSyntax leftParen,
                                                TupleTypeElementListSyntax elements,
                                                TokenSyntax rightParen) {
        return layout(NodeKind.TUPLE_TYPE,
                      TupleTypeSyntax.class,
                      present(leftParen),
                      present(elements),
                      present(rightParen));
    }

    /**
     * The void type {@code ()} without trivia.
     */
    public static TupleTypeSyntax makeVoidTupleType() {
        return makeTupleType(makeLeftParenToken(Trivia.EMPTY, Trivia.EMPTY),
                             makeTupleTypeElementList(List.of()),
                             makeRightParenToken(Trivia.EMPTY, Trivia.EMPTY));
    }

    public static TupleTypeSyntax makeBlankTupleType() {
        return blank(NodeKind.TUPLE_TYPE, TupleTypeSyntax.class);
    }

    public static TupleTypeElementListSyntax makeTupleTypeElementList(List<TupleTypeElementSyntax> elements) {
        return collection(NodeKind.TUPLE_TYPE_ELEMENT_LIST, TupleTypeElementListSyntax.class, elements);
    }

    public static TupleTypeElementListSyntax makeBlankTupleTypeElementList() {
        return blank(NodeKind.TUPLE_TYPE_ELEMENT_LIST, TupleTypeElementListSyntax.class);
    }

    public static TupleTypeElementSyntax makeTupleTypeElement(Optional<TokenSyntax> label,
                                                              Optional<TokenSyntax> colon,
                                                              Optional<TypeAttributesSyntax> typeAttributes,
                                                              Optional<TokenSyntax> inoutKeyword,
                                                              TypeSyntax type,
                                                              Optional<TokenSyntax> comma) {
        return layout(NodeKind.TUPLE_TYPE_ELEMENT,
                      TupleTypeElementSyntax.class,
                      absentOr(label),
                      absentOr(colon),
                      absentOr(typeAttributes),
                      absentOr(inoutKeyword),
                      present(type),
                      absentOr(comma));
    }

    /**
     * Element of the form {@code label: Type}.
     */
    public static TupleTypeElementSyntax makeLabeledTupleTypeElement(TokenSyntax label, TokenSyntax colon, TypeSyntax type) {
        return makeTupleTypeElement(Optional.of(label),
                                    Optional.of(colon),
                                    Optional.empty(),
                                    Optional.empty(),
                                    type,
                                    Optional.empty());
    }

    /**
     * Element consisting of a type only.
     */
    public static TupleTypeElementSyntax makeUnlabeledTupleTypeElement(TypeSyntax type) {
        return makeTupleTypeElement(Optional.empty(),
                                    Optional.empty(),
                                    Optional.empty(),
                                    Optional.empty(),
                                    type,
                                    Optional.empty());
    }

    public static TupleTypeElementSyntax makeBlankTupleTypeElement() {
        return blank(NodeKind.TUPLE_TYPE_ELEMENT, TupleTypeElementSyntax.class);
    }

    public static OptionalTypeSyntax makeOptionalType(TypeSyntax baseType, TokenSyntax questionMark) {
        return layout(NodeKind.OPTIONAL_TYPE, OptionalTypeSyntax.class, present(baseType), present(questionMark));
    }

    /**
     * {@code Base?} with a freshly made {@code ?} carrying the given trailing trivia.
     */
    public static OptionalTypeSyntax makeOptionalTypeOf(TypeSyntax baseType, Trivia trailingTrivia) {
        return makeOptionalType(baseType, makeQuestionPostfixToken(trailingTrivia));
    }

    public static OptionalTypeSyntax makeBlankOptionalType() {
        return blank(NodeKind.OPTIONAL_TYPE, OptionalTypeSyntax.class);
    }

    public static ImplicitlyUnwrappedOptionalTypeSyntax makeImplicitlyUnwrappedOptionalType(TypeSyntax baseType,
                                                                                            TokenSyntax exclamationMark) {
        return layout(NodeKind.IMPLICITLY_UNWRAPPED_OPTIONAL_TYPE,
                      ImplicitlyUnwrappedOptionalTypeSyntax.class,
                      present(baseType),
                      present(exclamationMark));
    }

    /**
     * {@code Base!} with a freshly made {@code !} carrying the given trailing trivia.
     */
    public static ImplicitlyUnwrappedOptionalTypeSyntax makeImplicitlyUnwrappedOptionalTypeOf(TypeSyntax baseType,
                                                                                              Trivia trailingTrivia) {
        return makeImplicitlyUnwrappedOptionalType(baseType, makeExclaimPostfixToken(trailingTrivia));
    }

    public static ImplicitlyUnwrappedOptionalTypeSyntax makeBlankImplicitlyUnwrappedOptionalType() {
        return blank(NodeKind.IMPLICITLY_UNWRAPPED_OPTIONAL_TYPE, ImplicitlyUnwrappedOptionalTypeSyntax.class);
    }

    /**
     * Metatype {@code Base.Type} or {@code Base.Protocol}; see {@link #makeTypeToken} and {@link #makeProtocolToken}.
     */
    public static MetatypeTypeSyntax makeMetatypeType(TypeSyntax baseType, TokenSyntax dot, TokenSyntax typeOrProtocol) {
        return layout(NodeKind.METATYPE_TYPE,
                      MetatypeTypeSyntax.class,
                      present(baseType),
                      present(dot),
                      present(typeOrProtocol));
    }

    public static MetatypeTypeSyntax makeBlankMetatypeType() {
        return blank(NodeKind.METATYPE_TYPE, MetatypeTypeSyntax.class);
    }

    public static ArrayTypeSyntax makeArrayType(TokenSyntax leftSquareBracket,
                                                TypeSyntax elementType,
                                                TokenSyntax rightSquareBracket) {
        return layout(NodeKind.ARRAY_TYPE,
                      ArrayTypeSyntax.class,
                      present(leftSquareBracket),
                      present(elementType),
                      present(rightSquareBracket));
    }

    public static ArrayTypeSyntax makeBlankArrayType() {
        return blank(NodeKind.ARRAY_TYPE, ArrayTypeSyntax.class);
    }

    public static DictionaryTypeSyntax makeDictionaryType(TokenSyntax leftSquareBracket,
                                                          TypeSyntax keyType,
                                                          TokenSyntax colon,
                                                          TypeSyntax valueType,
                                                          TokenSyntax rightSquareBracket) {
        return layout(NodeKind.DICTIONARY_TYPE,
                      DictionaryTypeSyntax.class,
                      present(leftSquareBracket),
                      present(keyType),
                      present(colon),
                      present(valueType),
                      present(rightSquareBracket));
    }

    public static DictionaryTypeSyntax makeBlankDictionaryType() {
        return blank(NodeKind.DICTIONARY_TYPE, DictionaryTypeSyntax.class);
    }

    public static FunctionTypeArgumentSyntax makeFunctionTypeArgument(Optional<TokenSyntax> externalName,
                                                                      Optional<TokenSyntax> localName,
                                                                      Optional<TypeAttributesSyntax> typeAttributes,
                                                                      Optional<TokenSyntax> inoutKeyword,
                                                                      Optional<TokenSyntax> colon,
                                                                      TypeSyntax type,
                                                                      Optional<TokenSyntax> comma) {
        return layout(NodeKind.FUNCTION_TYPE_ARGUMENT,
                      FunctionTypeArgumentSyntax.class,
                      absentOr(externalName),
                      absentOr(localName),
                      absentOr(typeAttributes),
                      absentOr(inoutKeyword),
                      absentOr(colon),
                      present(type),
                      absentOr(comma));
    }

    /**
     * Argument of the form {@code name: Type}.
     */
    public static FunctionTypeArgumentSyntax makeNamedFunctionTypeArgument(TokenSyntax localName,
                                                                           TokenSyntax colon,
                                                                           TypeSyntax type) {
        return makeFunctionTypeArgument(Optional.empty(),
                                        Optional.of(localName),
                                        Optional.empty(),
                                        Optional.empty(),
                                        Optional.of(colon),
                                        type,
                                        Optional.empty());
    }

    /**
     * Argument consisting of a type only.
     */
    public static FunctionTypeArgumentSyntax makeUnnamedFunctionTypeArgument(TypeSyntax type) {
        return makeFunctionTypeArgument(Optional.empty(),
                                        Optional.empty(),
                                        Optional.empty(),
                                        Optional.empty(),
                                        Optional.empty(),
                                        type,
                                        Optional.empty());
    }

    public static FunctionTypeArgumentSyntax makeBlankFunctionTypeArgument() {
        return blank(NodeKind.FUNCTION_TYPE_ARGUMENT, FunctionTypeArgumentSyntax.class);
    }

    public static TypeArgumentListSyntax makeTypeArgumentList(List<FunctionTypeArgumentSyntax> arguments) {
        return collection(NodeKind.TYPE_ARGUMENT_LIST, TypeArgumentListSyntax.class, arguments);
    }

    public static TypeArgumentListSyntax makeBlankTypeArgumentList() {
        return blank(NodeKind.TYPE_ARGUMENT_LIST, TypeArgumentListSyntax.class);
    }

    public static FunctionTypeSyntax makeFunctionType(Optional<TypeAttributesSyntax> typeAttributes,
                                                      TokenSyntax leftParen,
                                                      TypeArgumentListSyntax arguments,
                                                      TokenSyntax rightParen,
                                                      Optional<TokenSyntax> throwsOrRethrows,
                                                      TokenSyntax arrow,
                                                      TypeSyntax returnType) {
        return layout(NodeKind.FUNCTION_TYPE,
                      FunctionTypeSyntax.class,
                      absentOr(typeAttributes),
                      present(leftParen),
                      present(arguments),
                      present(rightParen),
                      absentOr(throwsOrRethrows),
                      present(arrow),
                      present(returnType));
    }

    public static FunctionTypeSyntax makeBlankFunctionType() {
        return blank(NodeKind.FUNCTION_TYPE, FunctionTypeSyntax.class);
    }

    // === Generics ===

    public static GenericParameterClauseSyntax makeGenericParameterClause(TokenSyntax leftAngle,
                                                                          GenericParameterListSyntax parameters,
                                                                          TokenSyntax rightAngle) {
        return layout(NodeKind.GENERIC_PARAMETER_CLAUSE,
                      GenericParameterClauseSyntax.class,
                      present(leftAngle),
                      present(parameters),
                      present(rightAngle));
    }

    public static GenericParameterClauseSyntax makeBlankGenericParameterClause() {
        return blank(NodeKind.GENERIC_PARAMETER_CLAUSE, GenericParameterClauseSyntax.class);
    }

    public static GenericParameterListSyntax makeGenericParameterList(List<GenericParameterSyntax> parameters) {
        return collection(NodeKind.GENERIC_PARAMETER_LIST, GenericParameterListSyntax.class, parameters);
    }

    public static GenericParameterListSyntax makeBlankGenericParameterList() {
        return blank(NodeKind.GENERIC_PARAMETER_LIST, GenericParameterListSyntax.class);
    }

    public static GenericParameterSyntax makeGenericParameter(TokenSyntax identifier,
                                                              Optional<TokenSyntax> colon,
                                                              Optional<TypeIdentifierSyntax> inheritedType,
                                                              Optional<TokenSyntax> comma) {
        return layout(NodeKind.GENERIC_PARAMETER,
                      GenericParameterSyntax.class,
                      present(identifier),
                      absentOr(colon),
                      absentOr(inheritedType),
                      absentOr(comma));
    }

    /**
     * Unconstrained parameter with just a name.
     */
    public static GenericParameterSyntax makeSimpleGenericParameter(String name, Trivia leadingTrivia, Trivia trailingTrivia) {
        return makeGenericParameter(makeIdentifier(name, leadingTrivia, trailingTrivia),
                                    Optional.empty(),
                                    Optional.empty(),
                                    Optional.empty());
    }

    public static GenericParameterSyntax makeBlankGenericParameter() {
        return blank(NodeKind.GENERIC_PARAMETER, GenericParameterSyntax.class);
    }

    public static GenericArgumentClauseSyntax makeGenericArgumentClause(TokenSyntax leftAngle,
                                                                        GenericArgumentListSyntax arguments,
                                                                        TokenSyntax rightAngle) {
        return layout(NodeKind.GENERIC_ARGUMENT_CLAUSE,
                      GenericArgumentClauseSyntax.class,
                      present(leftAngle),
                      present(arguments),
                      present(rightAngle));
    }

    public static GenericArgumentClauseSyntax makeBlankGenericArgumentClause() {
        return blank(NodeKind.GENERIC_ARGUMENT_CLAUSE, GenericArgumentClauseSyntax.class);
    }

    public static GenericArgumentListSyntax makeGenericArgumentList(List<GenericArgumentSyntax> arguments) {
        return collection(NodeKind.GENERIC_ARGUMENT_LIST, GenericArgumentListSyntax.class, arguments);
    }

    public static GenericArgumentListSyntax makeBlankGenericArgumentList() {
        return blank(NodeKind.GENERIC_ARGUMENT_LIST, GenericArgumentListSyntax.class);
    }

    public static GenericArgumentSyntax makeGenericArgument(TypeSyntax type, Optional<TokenSyntax> comma) {
        return layout(NodeKind.GENERIC_ARGUMENT, GenericArgumentSyntax.class, present(type), absentOr(comma));
    }

    public static GenericArgumentSyntax makeBlankGenericArgument() {
        return blank(NodeKind.GENERIC_ARGUMENT, GenericArgumentSyntax.class);
    }

    public static GenericWhereClauseSyntax makeGenericWhereClause(TokenSyntax whereKeyword,
                                                                  GenericRequirementListSyntax requirements) {
        return layout(NodeKind.GENERIC_WHERE_CLAUSE,
                      GenericWhereClauseSyntax.class,
                      present(whereKeyword),
                      present(requirements));
    }

    public static GenericWhereClauseSyntax makeBlankGenericWhereClause() {
        return blank(NodeKind.GENERIC_WHERE_CLAUSE, GenericWhereClauseSyntax.class);
    }

    public static GenericRequirementListSyntax makeGenericRequirementList(List<? extends GenericRequirementSyntax> requirements) {
        return collection(NodeKind.GENERIC_REQUIREMENT_LIST, GenericRequirementListSyntax.class, requirements);
    }

    public static GenericRequirementListSyntax makeBlankGenericRequirementList() {
        return blank(NodeKind.GENERIC_REQUIREMENT_LIST, GenericRequirementListSyntax.class);
    }

    /**
     * Same-type requirement {@code Left == Right}. Any child may be a missing placeholder.
     */
    public static SameTypeRequirementSyntax makeSameTypeRequirement(TypeIdentifierSyntax leftType,
                                                                    TokenSyntax equalityToken,
                                                                    TypeSyntax rightType,
                                                                    Optional<TokenSyntax> comma) {
        return layout(NodeKind.SAME_TYPE_REQUIREMENT,
                      SameTypeRequirementSyntax.class,
                      present(leftType),
                      present(equalityToken),
                      present(rightType),
                      absentOr(comma));
    }

    public static SameTypeRequirementSyntax makeBlankSameTypeRequirement() {
        return blank(NodeKind.SAME_TYPE_REQUIREMENT, SameTypeRequirementSyntax.class);
    }

    public static ConformanceRequirementSyntax makeConformanceRequirement(TypeIdentifierSyntax leftType,
                                                                          TokenSyntax colon,
                                                                          TypeIdentifierSyntax rightType,
                                                                          Optional<TokenSyntax> comma) {
        return layout(NodeKind.CONFORMANCE_REQUIREMENT,
                      ConformanceRequirementSyntax.class,
                      present(leftType),
                      present(colon),
                      present(rightType),
                      absentOr(comma));
    }

    public static ConformanceRequirementSyntax makeBlankConformanceRequirement() {
        return blank(NodeKind.CONFORMANCE_REQUIREMENT, ConformanceRequirementSyntax.class);
    }

    // === Internals ===

    private static TokenSyntax canonical(TokenKind kind, Trivia leadingTrivia, Trivia trailingTrivia) {
        return (TokenSyntax) Syntax.root(RawToken.canonical(kind, leadingTrivia, trailingTrivia));
    }

    private static Optional<RawSyntax> present(Syntax node) {
        return Optional.of(checkNotNull(node, "required child").raw());
    }

    private static Optional<RawSyntax> absentOr(Optional<? extends Syntax> node) {
        return checkNotNull(node, "optional child").map(Syntax::raw);
    }

    @SafeVarargs
    private static <T extends Syntax> T layout(NodeKind kind, Class<T> type, Optional<RawSyntax>... children) {
        return type.cast(Syntax.root(RawLayout.make(kind, List.of(children))));
    }

    private static <T extends Syntax> T collection(NodeKind kind, Class<T> type, List<? extends Syntax> elements) {
        checkNotNull(elements, "elements");
        var raws = elements.stream()
                           .map(Syntax::raw)
                           .collect(ImmutableList.toImmutableList());
        return type.cast(Syntax.root(RawLayout.makePresent(kind, raws)));
    }

    private static <T extends Syntax> T blank(NodeKind kind, Class<T> type) {
        return type.cast(makeBlank(kind));
    }
}
