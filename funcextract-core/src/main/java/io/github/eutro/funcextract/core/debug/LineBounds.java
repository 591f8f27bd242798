package io.github.eutro.funcextract.core.debug;

/**
 * An inclusive range of source lines, or {@link #EMPTY no range at all}.
 * <p>
 * The empty bounds contain no line; in particular they are not {@code [0, 0]}.
 */
public final class LineBounds {
    /**
     * Bounds of something with no debug locations.
     */
    public static final LineBounds EMPTY = new LineBounds(0, -1);

    private final int start;
    private final int end;

    private LineBounds(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public static LineBounds of(int start, int end) {
        if (start > end) {
            throw new IllegalArgumentException("start " + start + " is after end " + end);
        }
        return new LineBounds(start, end);
    }

    public boolean isEmpty() {
        return this == EMPTY;
    }

    public int getStart() {
        checkPresent();
        return start;
    }

    public int getEnd() {
        checkPresent();
        return end;
    }

    private void checkPresent() {
        if (isEmpty()) {
            throw new IllegalStateException("Line bounds are empty");
        }
    }

    public boolean contains(int line) {
        return !isEmpty() && start <= line && line <= end;
    }

    /**
     * Get the smallest bounds containing these bounds and the given line.
     *
     * @param line The line.
     * @return The extended bounds.
     */
    public LineBounds extend(int line) {
        if (isEmpty()) return new LineBounds(line, line);
        if (contains(line)) return this;
        return new LineBounds(Math.min(start, line), Math.max(end, line));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LineBounds that = (LineBounds) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return isEmpty() ? "[]" : "[" + start + ", " + end + "]";
    }
}
