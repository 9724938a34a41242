package dev.nodedump.reformatter.format;

import dev.nodedump.reformatter.diagnostic.Invariants;

/**
 * Output line under construction, bounded by a fixed capacity.
 */
final class LineBuffer {

    private final StringBuilder chars;
    private final int capacity;

    LineBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be greater than zero");
        }
        this.capacity = capacity;
        this.chars = new StringBuilder(capacity);
    }

    int capacity() {
        return capacity;
    }

    int length() {
        return chars.length();
    }

    boolean isEmpty() {
        return chars.length() == 0;
    }

    boolean isFull() {
        return chars.length() >= capacity;
    }

    LineBuffer append(char ch) {
        Invariants.check(chars.length() < capacity, "line length < capacity");
        chars.append(ch);
        return this;
    }

    void clear() {
        chars.setLength(0);
    }

    /**
     * Empties the buffer and fills it with {@code indent} spaces.
     */
    void reset(int indent) {
        Invariants.check(indent >= 0 && indent <= capacity, "0 <= indent <= capacity");
        chars.setLength(0);
        for (int i = 0; i < indent; i++) {
            chars.append(' ');
        }
    }

    void truncate(int length) {
        Invariants.check(length >= 0 && length <= chars.length(), "0 <= truncated length <= length");
        chars.setLength(length);
    }

    /**
     * Position of the last {@code ch} strictly after {@code lowerBound}, or -1.
     */
    int lastIndexOf(char ch, int lowerBound) {
        for (int k = chars.length() - 1; k > lowerBound; k--) {
            if (chars.charAt(k) == ch) {
                return k;
            }
        }
        return -1;
    }

    String contents() {
        return chars.toString();
    }

    @Override
    public String toString() {
        return contents();
    }
}
