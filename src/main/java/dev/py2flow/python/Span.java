package dev.py2flow.python;

/**
 * Location of a syntax node: first line plus character offsets into the source.
 */
public record Span(int line, int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [%d, %d)".formatted(start, end));
        }
    }

    public Span to(Span other) {
        return new Span(line, start, Math.max(end, other.end()));
    }
}
