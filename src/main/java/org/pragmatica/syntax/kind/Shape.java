package org.pragmatica.syntax.kind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import org.pragmatica.syntax.error.ShapeError;

import java.util.List;
import java.util.Optional;

/**
 * Declared shape of a node kind: a fixed list of slots or a homogeneous collection.
 */
public sealed interface Shape {
    NodeKind kind();

    boolean isCollection();

    /**
     * Check the kinds of proposed children against this shape.
     * An empty optional stands for an absent child.
     *
     * @return the first violation found, or empty if the children fit
     */
    Optional<ShapeError> check(List<Optional<SyntaxKind>> childKinds);

    /**
     * Fixed-arity layout. Child {@code i} must satisfy {@code slots().get(i)}.
     */
    record Layout(NodeKind kind, ImmutableList<Slot> slots) implements Shape {
        @Override
        public boolean isCollection() {
            return false;
        }

        public int slotCount() {
            return slots.size();
        }

        public Slot slot(int index) {
            return slots.get(index);
        }

        @Override
        public Optional<ShapeError> check(List<Optional<SyntaxKind>> childKinds) {
            if (childKinds.size() != slots.size()) {
                return Optional.of(new ShapeError.SlotCountMismatch(kind, slots.size(), childKinds.size()));
            }
            for (var i = 0; i < slots.size(); i++) {
                var slot = slots.get(i);
                var childKind = childKinds.get(i);

                if (childKind.isEmpty()) {
                    if (slot.required()) {
                        return Optional.of(new ShapeError.MissingRequiredSlot(kind, i, slot.name()));
                    }
                    continue;
                }
                if (!slot.accepts(childKind.get())) {
                    return Optional.of(new ShapeError.DisallowedKind(kind,
                                                                     i,
                                                                     slot.name(),
                                                                     childKind.get(),
                                                                     slot.allowedKinds()));
                }
            }
            return Optional.empty();
        }
    }

    /**
     * Variable-length list; every element must be present and of an allowed element kind.
     */
    record Collection(NodeKind kind, ImmutableSet<SyntaxKind> elementKinds) implements Shape {
        @Override
        public boolean isCollection() {
            return true;
        }

        public boolean accepts(SyntaxKind kind) {
            return elementKinds.contains(kind);
        }

        @Override
        public Optional<ShapeError> check(List<Optional<SyntaxKind>> childKinds) {
            for (var i = 0; i < childKinds.size(); i++) {
                var childKind = childKinds.get(i);

                if (childKind.isEmpty()) {
                    return Optional.of(new ShapeError.AbsentCollectionElement(kind, i));
                }
                if (!accepts(childKind.get())) {
                    return Optional.of(new ShapeError.DisallowedKind(kind,
                                                                     i,
                                                                     "element",
                                                                     childKind.get(),
                                                                     elementKinds));
                }
            }
            return Optional.empty();
        }
    }
}
