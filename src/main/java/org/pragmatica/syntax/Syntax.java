package org.pragmatica.syntax;

import com.google.common.collect.ImmutableList;
import org.pragmatica.syntax.kind.SyntaxKind;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Typed view over a {@link RawSyntax} node. Views are cheap: they hold the raw node, the view of
 * the parent it was reached from, and the slot index inside that parent. Several views may wrap the
 * same raw node; they are {@linkplain #equals(Object) equal} regardless of how they were reached.
 *
 * <p>Views never change. Every {@code with...} editor returns a new view whose ancestors, up to the
 * root, have been rebuilt around the replacement while untouched siblings are shared.
 */
public abstract sealed class Syntax
    permits TokenSyntax,
            DeclSyntax,
            StmtSyntax,
            TypeSyntax,
            GenericRequirementSyntax,
            SyntaxCollection,
            TypeAttributeSyntax,
            TupleTypeElementSyntax,
            FunctionTypeArgumentSyntax,
            GenericParameterClauseSyntax,
            GenericParameterSyntax,
            GenericArgumentClauseSyntax,
            GenericArgumentSyntax,
            GenericWhereClauseSyntax {
    private final RawSyntax raw;
    private final Syntax parent;
    private final int indexInParent;

    Syntax(RawSyntax raw, Syntax parent, int indexInParent) {
        this.raw = checkNotNull(raw, "raw");
        this.parent = parent;
        this.indexInParent = indexInParent;
    }

    /**
     * Wrap a raw node into the view class matching its kind.
     */
    static Syntax wrap(RawSyntax raw, Syntax parent, int indexInParent) {
        if (raw instanceof RawToken token) {
            return new TokenSyntax(token, parent, indexInParent);
        }
        var layout = (RawLayout) raw;
        return switch (layout.kind()) {
            case UNKNOWN -> new UnknownSyntax(layout, parent, indexInParent);
            case STRUCT_DECL -> new StructDeclSyntax(layout, parent, indexInParent);
            case TYPEALIAS_DECL -> new TypealiasDeclSyntax(layout, parent, indexInParent);
            case DECL_MEMBERS -> new DeclMembersSyntax(layout, parent, indexInParent);
            case CODE_BLOCK_STMT -> new CodeBlockStmtSyntax(layout, parent, indexInParent);
            case STMT_LIST -> new StmtListSyntax(layout, parent, indexInParent);
            case FALLTHROUGH_STMT -> new FallthroughStmtSyntax(layout, parent, indexInParent);
            case BREAK_STMT -> new BreakStmtSyntax(layout, parent, indexInParent);
            case TYPE_IDENTIFIER -> new TypeIdentifierSyntax(layout, parent, indexInParent);
            case TUPLE_TYPE -> new TupleTypeSyntax(layout, parent, indexInParent);
            case OPTIONAL_TYPE -> new OptionalTypeSyntax(layout, parent, indexInParent);
            case IMPLICITLY_UNWRAPPED_OPTIONAL_TYPE -> new ImplicitlyUnwrappedOptionalTypeSyntax(layout, parent, indexInParent);
            case METATYPE_TYPE -> new MetatypeTypeSyntax(layout, parent, indexInParent);
            case ARRAY_TYPE -> new ArrayTypeSyntax(layout, parent, indexInParent);
            case DICTIONARY_TYPE -> new DictionaryTypeSyntax(layout, parent, indexInParent);
            case FUNCTION_TYPE -> new FunctionTypeSyntax(layout, parent, indexInParent);
            case TYPE_ATTRIBUTE -> new TypeAttributeSyntax(layout, parent, indexInParent);
            case TYPE_ATTRIBUTES -> new TypeAttributesSyntax(layout, parent, indexInParent);
            case BALANCED_TOKENS -> new BalancedTokensSyntax(layout, parent, indexInParent);
            case TUPLE_TYPE_ELEMENT -> new TupleTypeElementSyntax(layout, parent, indexInParent);
            case TUPLE_TYPE_ELEMENT_LIST -> new TupleTypeElementListSyntax(layout, parent, indexInParent);
            case FUNCTION_TYPE_ARGUMENT -> new FunctionTypeArgumentSyntax(layout, parent, indexInParent);
            case TYPE_ARGUMENT_LIST -> new TypeArgumentListSyntax(layout, parent, indexInParent);
            case GENERIC_PARAMETER_CLAUSE -> new GenericParameterClauseSyntax(layout, parent, indexInParent);
            case GENERIC_PARAMETER_LIST -> new GenericParameterListSyntax(layout, parent, indexInParent);
            case GENERIC_PARAMETER -> new GenericParameterSyntax(layout, parent, indexInParent);
            case GENERIC_ARGUMENT_CLAUSE -> new GenericArgumentClauseSyntax(layout, parent, indexInParent);
            case GENERIC_ARGUMENT_LIST -> new GenericArgumentListSyntax(layout, parent, indexInParent);
            case GENERIC_ARGUMENT -> new GenericArgumentSyntax(layout, parent, indexInParent);
            case GENERIC_WHERE_CLAUSE -> new GenericWhereClauseSyntax(layout, parent, indexInParent);
            case GENERIC_REQUIREMENT_LIST -> new GenericRequirementListSyntax(layout, parent, indexInParent);
            case SAME_TYPE_REQUIREMENT -> new SameTypeRequirementSyntax(layout, parent, indexInParent);
            case CONFORMANCE_REQUIREMENT -> new ConformanceRequirementSyntax(layout, parent, indexInParent);
        };
    }

    /**
     * Root view over a freshly built raw node.
     */
    static Syntax root(RawSyntax raw) {
        return wrap(raw, null, -1);
    }

    public SyntaxKind kind() {
        return raw.kind();
    }

    public RawSyntax raw() {
        return raw;
    }

    public boolean isToken() {
        return raw.isToken();
    }

    public boolean isMissing() {
        return raw.isMissing();
    }

    public boolean isPresent() {
        return raw.isPresent();
    }

    public Optional<Syntax> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Slot index of this node in its parent, or -1 for a root.
     */
    public int indexInParent() {
        return indexInParent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public Syntax root() {
        var node = this;
        while (node.parent != null) {
            node = node.parent;
        }
        return node;
    }

    /**
     * Number of child slots, absent ones included. Zero for tokens.
     */
    public int childCount() {
        return raw instanceof RawLayout layout
               ? layout.childCount()
               : 0;
    }

    /**
     * View of the child in the given slot, empty if the slot is absent.
     */
    public Optional<Syntax> child(int index) {
        if (!(raw instanceof RawLayout layout)) {
            throw new IndexOutOfBoundsException("Token has no children");
        }
        return layout.child(index)
                     .map(child -> wrap(child, this, index));
    }

    /**
     * Views of all present children, in order.
     */
    public ImmutableList<Syntax> children() {
        var builder = ImmutableList.<Syntax>builder();
        for (var i = 0; i < childCount(); i++) {
            child(i).ifPresent(builder::add);
        }
        return builder.build();
    }

    /**
     * Absolute offset of this node from the start of its root, leading trivia included.
     */
    public int position() {
        if (parent == null) {
            return 0;
        }
        var offset = parent.position();
        var siblings = ((RawLayout) parent.raw).children();
        for (var i = 0; i < indexInParent; i++) {
            var sibling = siblings.get(i);
            if (sibling.isPresent()) {
                offset += sibling.get().textLength();
            }
        }
        return offset;
    }

    /**
     * Absolute offset of the first token text, i.e. {@link #position()} past the leading trivia.
     */
    public int textPosition() {
        return position() + raw.firstToken()
                               .map(token -> token.leadingTrivia().textLength())
                               .orElse(0);
    }

    /**
     * Length of the printed text, trivia included.
     */
    public int textLength() {
        return raw.textLength();
    }

    /**
     * First token in tree order, missing tokens included.
     */
    public Optional<TokenSyntax> firstToken() {
        if (this instanceof TokenSyntax token) {
            return Optional.of(token);
        }
        for (var i = 0; i < childCount(); i++) {
            var token = child(i).flatMap(Syntax::firstToken);
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }

    /**
     * Last token in tree order, missing tokens included.
     */
    public Optional<TokenSyntax> lastToken() {
        if (this instanceof TokenSyntax token) {
            return Optional.of(token);
        }
        for (var i = childCount() - 1; i >= 0; i--) {
            var token = child(i).flatMap(Syntax::lastToken);
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }

    /**
     * Exact source text of this subtree, trivia included.
     */
    public String text() {
        return raw.text();
    }

    /**
     * Structural equality: same kinds, texts, trivia and missing flags all the way down.
     */
    public boolean isEquivalentTo(Syntax other) {
        return raw.equals(other.raw);
    }

    /**
     * Two views are equal when they wrap the very same raw node.
     */
    @Override
    public final boolean equals(Object o) {
        return o instanceof Syntax other && raw == other.raw;
    }

    @Override
    public final int hashCode() {
        return System.identityHashCode(raw);
    }

    @Override
    public String toString() {
        return text();
    }

    final RawLayout layout() {
        return (RawLayout) raw;
    }

    final <T extends Syntax> T requiredChild(int index, Class<T> type) {
        return type.cast(child(index).orElseThrow(() -> new IllegalStateException(
            "Required slot #" + index + " of " + kind() + " is absent")));
    }

    final <T extends Syntax> Optional<T> optionalChild(int index, Class<T> type) {
        return child(index).map(type::cast);
    }

    final Syntax withChild(int index, Syntax child) {
        checkNotNull(child, "child");
        return replacingSelf(layout().replacingChild(index, Optional.of(child.raw)));
    }

    final Syntax withOptionalChild(int index, Optional<? extends Syntax> child) {
        checkNotNull(child, "child");
        return replacingSelf(layout().replacingChild(index, child.map(Syntax::raw)));
    }

    /**
     * Same node with {@code element} appended to the collection held in slot {@code index}.
     * The ancestors are rebuilt once.
     */
    final Syntax withAppended(int index, Syntax element) {
        checkNotNull(element, "element");
        var collection = (RawLayout) requiredChild(index, Syntax.class).raw;
        var grown = collection.inserting(collection.childCount(), element.raw);
        return replacingSelf(layout().replacingChild(index, Optional.of(grown)));
    }

    /**
     * View over {@code replacement} standing where this node stood: every ancestor is rebuilt,
     * every sibling along the way is shared.
     */
    final Syntax replacingSelf(RawSyntax replacement) {
        if (parent == null) {
            return root(replacement);
        }
        var newParent = parent.replacingSelf(parent.layout()
                                                   .replacingChild(indexInParent, Optional.of(replacement)));
        return wrap(replacement, newParent, indexInParent);
    }
}
