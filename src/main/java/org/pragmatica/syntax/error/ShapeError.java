package org.pragmatica.syntax.error;

import org.pragmatica.syntax.kind.NodeKind;
import org.pragmatica.syntax.kind.SyntaxKind;
import org.pragmatica.syntax.kind.TokenKind;

import java.util.Set;

/**
 * Construction contract violation: children or token text that do not fit the declared shape.
 */
public sealed interface ShapeError {
    String message();

    /**
     * Wrong number of children for a fixed layout.
     */
    record SlotCountMismatch(
    NodeKind kind,
    int expected,
    int actual) implements ShapeError {
        @Override
        public String message() {
            return kind + " expects " + expected + " children, got " + actual;
        }
    }

    /**
     * Child kind not accepted at its position.
     */
    record DisallowedKind(
    NodeKind kind,
    int index,
    String slot,
    SyntaxKind found,
    Set<SyntaxKind> allowed) implements ShapeError {
        @Override
        public String message() {
            return kind + " does not accept " + found + " at " + slot + " (#" + index + "), expected one of " + allowed;
        }
    }

    /**
     * Required slot left absent.
     */
    record MissingRequiredSlot(
    NodeKind kind,
    int index,
    String slot) implements ShapeError {
        @Override
        public String message() {
            return kind + " requires " + slot + " (#" + index + ")";
        }
    }

    /**
     * Collections hold only present elements.
     */
    record AbsentCollectionElement(
    NodeKind kind,
    int index) implements ShapeError {
        @Override
        public String message() {
            return kind + " element #" + index + " is absent";
        }
    }

    /**
     * Keyword or punctuation token spelled differently from its kind.
     */
    record FixedTextMismatch(
    TokenKind kind,
    String expected,
    String actual) implements ShapeError {
        @Override
        public String message() {
            return kind + " must be spelled '" + expected + "', got '" + actual + "'";
        }
    }

    /**
     * Node kind without a registered shape.
     */
    record UnknownShape(NodeKind kind) implements ShapeError {
        @Override
        public String message() {
            return "No shape registered for " + kind;
        }
    }
}
