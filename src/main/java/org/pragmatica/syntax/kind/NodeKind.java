package org.pragmatica.syntax.kind;

import com.google.common.collect.ImmutableSet;

import java.util.Arrays;

/**
 * Non-terminal kinds. The slot layout of each kind lives in {@link ShapeRegistry}.
 */
public enum NodeKind implements SyntaxKind {
    UNKNOWN(Category.UNKNOWN),

    STRUCT_DECL(Category.DECLARATION),
    TYPEALIAS_DECL(Category.DECLARATION),
    DECL_MEMBERS(Category.COLLECTION),

    CODE_BLOCK_STMT(Category.STATEMENT),
    STMT_LIST(Category.COLLECTION),
    FALLTHROUGH_STMT(Category.STATEMENT),
    BREAK_STMT(Category.STATEMENT),

    // TYPE_IDENTIFIER must stay the first type kind: it is the blank form of every type slot
    TYPE_IDENTIFIER(Category.TYPE),
    TUPLE_TYPE(Category.TYPE),
    OPTIONAL_TYPE(Category.TYPE),
    IMPLICITLY_UNWRAPPED_OPTIONAL_TYPE(Category.TYPE),
    METATYPE_TYPE(Category.TYPE),
    ARRAY_TYPE(Category.TYPE),
    DICTIONARY_TYPE(Category.TYPE),
    FUNCTION_TYPE(Category.TYPE),

    TYPE_ATTRIBUTE(Category.OTHER),
    TYPE_ATTRIBUTES(Category.COLLECTION),
    BALANCED_TOKENS(Category.COLLECTION),
    TUPLE_TYPE_ELEMENT(Category.OTHER),
    TUPLE_TYPE_ELEMENT_LIST(Category.COLLECTION),
    FUNCTION_TYPE_ARGUMENT(Category.OTHER),
    TYPE_ARGUMENT_LIST(Category.COLLECTION),

    GENERIC_PARAMETER_CLAUSE(Category.OTHER),
    GENERIC_PARAMETER_LIST(Category.COLLECTION),
    GENERIC_PARAMETER(Category.OTHER),
    GENERIC_ARGUMENT_CLAUSE(Category.OTHER),
    GENERIC_ARGUMENT_LIST(Category.COLLECTION),
    GENERIC_ARGUMENT(Category.OTHER),
    GENERIC_WHERE_CLAUSE(Category.OTHER),
    GENERIC_REQUIREMENT_LIST(Category.COLLECTION),
    SAME_TYPE_REQUIREMENT(Category.REQUIREMENT),
    CONFORMANCE_REQUIREMENT(Category.REQUIREMENT);

    /**
     * Grammar category of a node kind.
     */
    public enum Category {
        DECLARATION,
        STATEMENT,
        TYPE,
        REQUIREMENT,
        COLLECTION,
        OTHER,
        UNKNOWN
    }

    private final Category category;

    NodeKind(Category category) {
        this.category = category;
    }

    public Category category() {
        return category;
    }

    /**
     * All kinds of the given category, in declaration order.
     */
    public static ImmutableSet<NodeKind> ofCategory(Category category) {
        return Arrays.stream(values())
                     .filter(kind -> kind.category == category)
                     .collect(ImmutableSet.toImmutableSet());
    }

    @Override
    public boolean isToken() {
        return false;
    }
}
