package com.papertrail.core.model;

import java.util.Objects;

/**
 * Unordered pair of record (or entity) ids. The smaller id is always {@code first}.
 */
public record RecordPair(String first, String second) implements Comparable<RecordPair> {

    public RecordPair {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (first.equals(second)) {
            throw new IllegalArgumentException("A pair needs two distinct ids, got " + first);
        }
        if (first.compareTo(second) > 0) {
            String tmp = first;
            first = second;
            second = tmp;
        }
    }

    public static RecordPair of(String a, String b) {
        return new RecordPair(a, b);
    }

    public boolean contains(String id) {
        return first.equals(id) || second.equals(id);
    }

    public String other(String id) {
        if (first.equals(id)) {
            return second;
        }
        if (second.equals(id)) {
            return first;
        }
        throw new IllegalArgumentException(id + " is not part of " + this);
    }

    @Override
    public int compareTo(RecordPair o) {
        int c = first.compareTo(o.first);
        return c != 0 ? c : second.compareTo(o.second);
    }

    @Override
    public String toString() {
        return first + "|" + second;
    }
}
