package com.tyron.filepicker.api.model;

/**
 * Stable identity of a directory entry, independent of its display name.
 */
public record EntryId(long value) implements Comparable<EntryId> {

    @Override
    public int compareTo(EntryId o) {
        return Long.compare(value, o.value);
    }

    @Override
    public String toString() {
        return "#" + value;
    }
}
