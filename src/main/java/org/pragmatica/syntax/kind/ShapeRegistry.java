package org.pragmatica.syntax.kind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import org.pragmatica.syntax.error.ShapeError;
import org.pragmatica.syntax.error.ShapeViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;

import static com.google.common.base.Preconditions.checkState;
import static org.pragmatica.syntax.kind.NodeKind.*;
import static org.pragmatica.syntax.kind.Slot.optional;
import static org.pragmatica.syntax.kind.Slot.required;
import static org.pragmatica.syntax.kind.TokenKind.*;

/**
 * Process-wide table of node shapes. Built once during class initialization and read-only afterwards.
 */
public final class ShapeRegistry {
    private static final Logger log = LoggerFactory.getLogger(ShapeRegistry.class);

    public static final ImmutableSet<SyntaxKind> ANY_TOKEN = ImmutableSet.copyOf(TokenKind.values());
    public static final ImmutableSet<SyntaxKind> ANY_TYPE = ImmutableSet.copyOf(ofCategory(Category.TYPE));
    public static final ImmutableSet<SyntaxKind> ANY_DECL = ImmutableSet.copyOf(ofCategory(Category.DECLARATION));
    public static final ImmutableSet<SyntaxKind> ANY_CODE_BLOCK_ITEM = ImmutableSet.<SyntaxKind>builder()
                                                                                  .addAll(ofCategory(Category.STATEMENT))
                                                                                  .addAll(ofCategory(Category.DECLARATION))
                                                                                  .add(NodeKind.UNKNOWN)
                                                                                  .build();

    private static final ImmutableMap<NodeKind, Shape> SHAPES = buildShapes();

    private ShapeRegistry() {}

    /**
     * Shape of the given node kind.
     *
     * @throws ShapeViolationException if the kind has no registered shape
     */
    public static Shape shapeOf(NodeKind kind) {
        var shape = SHAPES.get(kind);
        if (shape == null) {
            throw new ShapeViolationException(new ShapeError.UnknownShape(kind));
        }
        return shape;
    }

    /**
     * Shape of a fixed-layout kind.
     *
     * @throws IllegalArgumentException if the kind is a collection
     */
    public static Shape.Layout layoutOf(NodeKind kind) {
        if (shapeOf(kind) instanceof Shape.Layout layout) {
            return layout;
        }
        throw new IllegalArgumentException(kind + " is a collection, not a fixed layout");
    }

    public static ImmutableMap<NodeKind, Shape> shapes() {
        return SHAPES;
    }

    private static ImmutableMap<NodeKind, Shape> buildShapes() {
        var shapes = new EnumMap<NodeKind, Shape>(NodeKind.class);

        collection(shapes, NodeKind.UNKNOWN, ANY_TOKEN);

        // Declarations
        layout(shapes, STRUCT_DECL,
               required("structKeyword", STRUCT_KEYWORD),
               required("identifier", IDENTIFIER),
               optional("genericParameterClause", GENERIC_PARAMETER_CLAUSE),
               optional("genericWhereClause", GENERIC_WHERE_CLAUSE),
               required("leftBrace", LEFT_BRACE),
               required("members", DECL_MEMBERS),
               required("rightBrace", RIGHT_BRACE));
        layout(shapes, TYPEALIAS_DECL,
               required("typealiasKeyword", TYPEALIAS_KEYWORD),
               required("identifier", IDENTIFIER),
               optional("genericParameterClause", GENERIC_PARAMETER_CLAUSE),
               required("equal", EQUAL),
               required("type", ANY_TYPE));
        collection(shapes, DECL_MEMBERS, ANY_DECL);

        // Statements
        layout(shapes, CODE_BLOCK_STMT,
               required("leftBrace", LEFT_BRACE),
               required("statements", STMT_LIST),
               required("rightBrace", RIGHT_BRACE));
        collection(shapes, STMT_LIST, ANY_CODE_BLOCK_ITEM);
        layout(shapes, FALLTHROUGH_STMT,
               required("fallthroughKeyword", FALLTHROUGH_KEYWORD));
        layout(shapes, BREAK_STMT,
               required("breakKeyword", BREAK_KEYWORD),
               optional("label", IDENTIFIER));

        // Types
        layout(shapes, TYPE_IDENTIFIER,
               required("identifier", IDENTIFIER, ANY_KEYWORD, SELF_KEYWORD),
               optional("genericArgumentClause", GENERIC_ARGUMENT_CLAUSE),
               optional("dot", PERIOD),
               optional("childType", TYPE_IDENTIFIER));
        layout(shapes, TUPLE_TYPE,
               required("leftParen", LEFT_PAREN),
               required("elements", TUPLE_TYPE_ELEMENT_LIST),
               required("rightParen", RIGHT_PAREN));
        layout(shapes, OPTIONAL_TYPE,
               required("baseType", ANY_TYPE),
               required("questionMark", QUESTION_POSTFIX));
        layout(shapes, IMPLICITLY_UNWRAPPED_OPTIONAL_TYPE,
               required("baseType", ANY_TYPE),
               required("exclamationMark", EXCLAIM_POSTFIX));
        layout(shapes, METATYPE_TYPE,
               required("baseType", ANY_TYPE),
               required("dot", PERIOD),
               required("typeOrProtocol", IDENTIFIER));
        layout(shapes, ARRAY_TYPE,
               required("leftSquareBracket", LEFT_SQUARE_BRACKET),
               required("elementType", ANY_TYPE),
               required("rightSquareBracket", RIGHT_SQUARE_BRACKET));
        layout(shapes, DICTIONARY_TYPE,
               required("leftSquareBracket", LEFT_SQUARE_BRACKET),
               required("keyType", ANY_TYPE),
               required("colon", COLON),
               required("valueType", ANY_TYPE),
               required("rightSquareBracket", RIGHT_SQUARE_BRACKET));
        layout(shapes, FUNCTION_TYPE,
               optional("typeAttributes", TYPE_ATTRIBUTES),
               required("leftParen", LEFT_PAREN),
               required("arguments", TYPE_ARGUMENT_LIST),
               required("rightParen", RIGHT_PAREN),
               optional("throwsOrRethrows", THROWS_KEYWORD, RETHROWS_KEYWORD),
               required("arrow", ARROW),
               required("returnType", ANY_TYPE));

        // Type pieces
        layout(shapes, TYPE_ATTRIBUTE,
               required("atSign", AT_SIGN),
               required("identifier", IDENTIFIER),
               optional("leftParen", LEFT_PAREN),
               optional("balancedTokens", BALANCED_TOKENS),
               optional("rightParen", RIGHT_PAREN));
        collection(shapes, TYPE_ATTRIBUTES, ImmutableSet.of(TYPE_ATTRIBUTE));
        collection(shapes, BALANCED_TOKENS, ANY_TOKEN);
        layout(shapes, TUPLE_TYPE_ELEMENT,
               optional("label", IDENTIFIER),
               optional("colon", COLON),
               optional("typeAttributes", TYPE_ATTRIBUTES),
               optional("inoutKeyword", INOUT_KEYWORD),
               required("type", ANY_TYPE),
               optional("comma", COMMA));
        collection(shapes, TUPLE_TYPE_ELEMENT_LIST, ImmutableSet.of(TUPLE_TYPE_ELEMENT));
        layout(shapes, FUNCTION_TYPE_ARGUMENT,
               optional("externalName", IDENTIFIER),
               optional("localName", IDENTIFIER),
               optional("typeAttributes", TYPE_ATTRIBUTES),
               optional("inoutKeyword", INOUT_KEYWORD),
               optional("colon", COLON),
               required("type", ANY_TYPE),
               optional("comma", COMMA));
        collection(shapes, TYPE_ARGUMENT_LIST, ImmutableSet.of(FUNCTION_TYPE_ARGUMENT));

        // Generics
        layout(shapes, GENERIC_PARAMETER_CLAUSE,
               required("leftAngle", LEFT_ANGLE),
               required("parameters", GENERIC_PARAMETER_LIST),
               required("rightAngle", RIGHT_ANGLE));
        collection(shapes, GENERIC_PARAMETER_LIST, ImmutableSet.of(GENERIC_PARAMETER));
        layout(shapes, GENERIC_PARAMETER,
               required("identifier", IDENTIFIER),
               optional("colon", COLON),
               optional("inheritedType", TYPE_IDENTIFIER),
               optional("comma", COMMA));
        layout(shapes, GENERIC_ARGUMENT_CLAUSE,
               required("leftAngle", LEFT_ANGLE),
               required("arguments", GENERIC_ARGUMENT_LIST),
               required("rightAngle", RIGHT_ANGLE));
        collection(shapes, GENERIC_ARGUMENT_LIST, ImmutableSet.of(GENERIC_ARGUMENT));
        layout(shapes, GENERIC_ARGUMENT,
               required("type", ANY_TYPE),
               optional("comma", COMMA));
        layout(shapes, GENERIC_WHERE_CLAUSE,
               required("whereKeyword", WHERE_KEYWORD),
               required("requirements", GENERIC_REQUIREMENT_LIST));
        collection(shapes, GENERIC_REQUIREMENT_LIST, ImmutableSet.copyOf(ofCategory(Category.REQUIREMENT)));
        layout(shapes, SAME_TYPE_REQUIREMENT,
               required("leftType", TYPE_IDENTIFIER),
               required("equalityToken", OPERATOR),
               required("rightType", ANY_TYPE),
               optional("comma", COMMA));
        layout(shapes, CONFORMANCE_REQUIREMENT,
               required("leftType", TYPE_IDENTIFIER),
               required("colon", COLON),
               required("rightType", TYPE_IDENTIFIER),
               optional("comma", COMMA));

        verify(shapes);
        log.debug("Shape registry initialized with {} node kinds", shapes.size());
        return Maps.immutableEnumMap(shapes);
    }

    private static void layout(Map<NodeKind, Shape> shapes, NodeKind kind, Slot... slots) {
        checkState(!shapes.containsKey(kind), "Duplicate shape for %s", kind);
        shapes.put(kind, new Shape.Layout(kind, ImmutableList.copyOf(slots)));
    }

    private static void collection(Map<NodeKind, Shape> shapes, NodeKind kind, ImmutableSet<? extends SyntaxKind> elements) {
        checkState(!shapes.containsKey(kind), "Duplicate shape for %s", kind);
        shapes.put(kind, new Shape.Collection(kind, ImmutableSet.copyOf(elements)));
    }

    private static void verify(Map<NodeKind, Shape> shapes) {
        for (var kind : NodeKind.values()) {
            checkState(shapes.containsKey(kind), "No shape declared for %s", kind);
            if (shapes.get(kind) instanceof Shape.Layout layout) {
                var names = new HashSet<String>();
                for (var slot : layout.slots()) {
                    checkState(names.add(slot.name()), "Duplicate slot '%s' in %s", slot.name(), kind);
                    checkState(slot.optional() || slot.blankKind() != kind,
                               "Required slot '%s' of %s cannot be blank-filled with its own kind", slot.name(), kind);
                }
            }
        }
    }
}
