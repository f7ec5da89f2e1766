package org.pragmatica.syntax;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import org.pragmatica.syntax.error.ShapeViolationException;
import org.pragmatica.syntax.kind.NodeKind;
import org.pragmatica.syntax.kind.Shape;
import org.pragmatica.syntax.kind.ShapeRegistry;
import org.pragmatica.syntax.kind.Slot;
import org.pragmatica.syntax.kind.SyntaxKind;
import org.pragmatica.syntax.kind.TokenKind;
import org.pragmatica.syntax.tree.Trivia;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndex;

/**
 * Interior node: an ordered list of child slots, each either present or absent.
 * Children always satisfy the shape registered for the kind.
 */
public final class RawLayout extends RawSyntax {
    private final NodeKind nodeKind;
    private final ImmutableList<Optional<RawSyntax>> children;
    private final Optional<RawToken> firstToken;

    private RawLayout(NodeKind nodeKind, ImmutableList<Optional<RawSyntax>> children, boolean missing) {
        super(missing, textLength(children));
        this.nodeKind = nodeKind;
        this.children = children;
        this.firstToken = firstToken(children);
    }

    /**
     * Validated layout. A fixed layout is missing when every slot is absent or missing;
     * a collection is missing when it is non-empty and every element is missing.
     *
     * @throws ShapeViolationException if the children do not fit the shape of {@code kind}
     */
    static RawLayout make(NodeKind kind, List<Optional<RawSyntax>> children) {
        checkNotNull(kind, "kind");
        var copy = ImmutableList.copyOf(children);
        var shape = ShapeRegistry.shapeOf(kind);
        var violation = shape.check(copy.stream()
                                        .map(child -> child.map(RawSyntax::kind))
                                        .collect(ImmutableList.toImmutableList()));
        if (violation.isPresent()) {
            throw new ShapeViolationException(violation.get());
        }

        var allMissing = copy.stream()
                             .allMatch(child -> child.map(RawSyntax::isMissing)
                                                     .orElse(true));
        var missing = shape.isCollection()
                      ? !copy.isEmpty() && allMissing
                      : allMissing;
        return new RawLayout(kind, copy, missing);
    }

    /**
     * Validated layout from present children only.
     */
    static RawLayout makePresent(NodeKind kind, List<? extends RawSyntax> children) {
        return make(kind, children.stream()
                                  .map(child -> Optional.<RawSyntax>of(child))
                                  .collect(ImmutableList.toImmutableList()));
    }

    /**
     * Fully missing placeholder of the given kind: required slots hold blank forms of their first
     * allowed kind, optional slots are absent, collections are empty.
     */
    static RawLayout blank(NodeKind kind) {
        checkNotNull(kind, "kind");
        var shape = ShapeRegistry.shapeOf(kind);

        if (shape instanceof Shape.Layout layout) {
            var children = ImmutableList.<Optional<RawSyntax>>builderWithExpectedSize(layout.slotCount());
            for (var slot : layout.slots()) {
                children.add(slot.optional()
                             ? Optional.empty()
                             : Optional.of(blankFor(slot)));
            }
            return new RawLayout(kind, children.build(), true);
        }
        return new RawLayout(kind, ImmutableList.of(), true);
    }

    private static RawSyntax blankFor(Slot slot) {
        return blankOf(slot.blankKind());
    }

    static RawSyntax blankOf(SyntaxKind kind) {
        if (kind instanceof TokenKind tokenKind) {
            return RawToken.missing(tokenKind, Trivia.EMPTY, Trivia.EMPTY);
        }
        return blank((NodeKind) kind);
    }

    /**
     * New layout with one child replaced; every other child is shared with this one.
     */
    RawLayout replacingChild(int index, Optional<RawSyntax> child) {
        checkElementIndex(index, children.size());
        checkNotNull(child, "child");
        var updated = ImmutableList.<Optional<RawSyntax>>builderWithExpectedSize(children.size());
        for (var i = 0; i < children.size(); i++) {
            updated.add(i == index
                        ? child
                        : children.get(i));
        }
        return make(nodeKind, updated.build());
    }

    /**
     * New collection with an element inserted at {@code index}.
     */
    RawLayout inserting(int index, RawSyntax element) {
        checkPositionIndex(index, children.size());
        checkNotNull(element, "element");
        var updated = ImmutableList.<Optional<RawSyntax>>builderWithExpectedSize(children.size() + 1);
        updated.addAll(children.subList(0, index));
        updated.add(Optional.of(element));
        updated.addAll(children.subList(index, children.size()));
        return make(nodeKind, updated.build());
    }

    /**
     * New collection without the element at {@code index}.
     */
    RawLayout removing(int index) {
        checkElementIndex(index, children.size());
        var updated = ImmutableList.<Optional<RawSyntax>>builderWithExpectedSize(children.size() - 1);
        updated.addAll(children.subList(0, index));
        updated.addAll(children.subList(index + 1, children.size()));
        return make(nodeKind, updated.build());
    }

    @Override
    public NodeKind kind() {
        return nodeKind;
    }

    @Override
    public boolean isToken() {
        return false;
    }

    public Shape shape() {
        return ShapeRegistry.shapeOf(nodeKind);
    }

    public int childCount() {
        return children.size();
    }

    public Optional<RawSyntax> child(int index) {
        return children.get(index);
    }

    public ImmutableList<Optional<RawSyntax>> children() {
        return children;
    }

    @Override
    public Optional<RawToken> firstToken() {
        return firstToken;
    }

    @Override
    public void appendTo(StringBuilder sb) {
        for (var child : children) {
            child.ifPresent(node -> node.appendTo(sb));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RawLayout other
               && nodeKind == other.nodeKind
               && isMissing() == other.isMissing()
               && textLength() == other.textLength()
               && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(nodeKind, children, isMissing());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper("Layout")
                          .add("kind", nodeKind)
                          .add("children", children.size())
                          .add("missing", isMissing())
                          .toString();
    }

    private static Optional<RawToken> firstToken(List<Optional<RawSyntax>> children) {
        for (var child : children) {
            var token = child.flatMap(RawSyntax::firstToken);
            if (token.isPresent()) {
                return token;
            }
        }
        return Optional.empty();
    }

    private static int textLength(List<Optional<RawSyntax>> children) {
        var length = 0;
        for (var child : children) {
            if (child.isPresent()) {
                length += child.get().textLength();
            }
        }
        return length;
    }
}
