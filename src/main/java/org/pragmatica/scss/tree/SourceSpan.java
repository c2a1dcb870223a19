package org.pragmatica.scss.tree;

/**
 * A range in source text from offset (inclusive) to end (exclusive).
 */
public record SourceSpan(int offset, int length) {

    public SourceSpan {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Invalid span: offset=" + offset + ", length=" + length);
        }
    }

    public static SourceSpan of(int offset, int end) {
        return new SourceSpan(offset, end - offset);
    }

    public static SourceSpan at(int offset) {
        return new SourceSpan(offset, 0);
    }

    public int end() {
        return offset + length;
    }

    public boolean contains(SourceSpan other) {
        return offset <= other.offset && other.end() <= end();
    }

    public boolean contains(int position) {
        return offset <= position && position < end();
    }

    public String extract(String source) {
        return source.substring(offset, end());
    }

    public SourceSpan merge(SourceSpan other) {
        var newStart = Math.min(offset, other.offset);
        var newEnd = Math.max(end(), other.end());
        return of(newStart, newEnd);
    }

    @Override
    public String toString() {
        return offset + "-" + end();
    }
}
