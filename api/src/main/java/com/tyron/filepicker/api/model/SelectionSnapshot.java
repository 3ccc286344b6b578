package com.tyron.filepicker.api.model;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Read-only copy of a selection model, in selection order.
 */
public record SelectionSnapshot(List<EntryId> selected, @Nullable EntryId focused, @Nullable EntryId anchor) {

    public static final SelectionSnapshot EMPTY = new SelectionSnapshot(List.of(), null, null);

    public SelectionSnapshot {
        selected = List.copyOf(selected);
    }

    public boolean isSelected(EntryId id) {
        return selected.contains(id);
    }
}
