package org.pragmatica.syntax.kind;

import com.google.common.collect.ImmutableSet;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One child position of a layout: its name, whether it may be absent, and the kinds it accepts.
 * The first accepted kind is the one synthesized when a blank node fills the slot.
 */
public record Slot(String name, ImmutableSet<SyntaxKind> allowedKinds, boolean optional) {
    public Slot {
        checkNotNull(name, "name");
        checkArgument(!allowedKinds.isEmpty(), "Slot '%s' accepts no kinds", name);
    }

    public static Slot required(String name, SyntaxKind kind, SyntaxKind... more) {
        return new Slot(name, kinds(kind, more), false);
    }

    public static Slot required(String name, ImmutableSet<? extends SyntaxKind> kinds) {
        return new Slot(name, ImmutableSet.copyOf(kinds), false);
    }

    public static Slot optional(String name, SyntaxKind kind, SyntaxKind... more) {
        return new Slot(name, kinds(kind, more), true);
    }

    public static Slot optional(String name, ImmutableSet<? extends SyntaxKind> kinds) {
        return new Slot(name, ImmutableSet.copyOf(kinds), true);
    }

    public boolean accepts(SyntaxKind kind) {
        return allowedKinds.contains(kind);
    }

    public boolean required() {
        return !optional;
    }

    /**
     * Kind used to populate this slot in a blank node.
     */
    public SyntaxKind blankKind() {
        return allowedKinds.iterator()
                           .next();
    }

    private static ImmutableSet<SyntaxKind> kinds(SyntaxKind kind, SyntaxKind... more) {
        return ImmutableSet.<SyntaxKind>builder()
                           .add(kind)
                           .add(more)
                           .build();
    }
}
