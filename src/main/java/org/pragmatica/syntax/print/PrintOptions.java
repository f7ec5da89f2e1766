package org.pragmatica.syntax.print;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Printer options.
 *
 * @param includeTrivia      emit leading and trailing trivia; with trivia off only token text is printed
 * @param missingPlaceholder text emitted in place of each missing token; empty keeps the exact source
 */
public record PrintOptions(
    boolean includeTrivia,
    String missingPlaceholder
) {
    /**
     * Exact round-trip: trivia on, nothing printed for missing tokens.
     */
    public static final PrintOptions DEFAULT = new PrintOptions(
        true,
        ""
    );

    public PrintOptions {
        checkNotNull(missingPlaceholder, "missingPlaceholder");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean includeTrivia = DEFAULT.includeTrivia();
        private String missingPlaceholder = DEFAULT.missingPlaceholder();

        private Builder() {}

        public Builder trivia(boolean include) {
            this.includeTrivia = include;
            return this;
        }

        public Builder missingPlaceholder(String placeholder) {
            this.missingPlaceholder = placeholder;
            return this;
        }

        public PrintOptions build() {
            return new PrintOptions(includeTrivia, missingPlaceholder);
        }
    }
}
