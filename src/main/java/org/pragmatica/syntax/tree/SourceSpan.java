package org.pragmatica.syntax.tree;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Range of source text, start inclusive, end exclusive.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {
    public SourceSpan {
        checkArgument(start.offset() <= end.offset(), "Span end %s precedes start %s", end, start);
    }

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    /**
     * Empty span at a single location, e.g. where a missing token would go.
     */
    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
