package com.tyron.filepicker.core.selection;

import com.tyron.filepicker.api.model.EntryId;
import com.tyron.filepicker.api.model.SelectionSnapshot;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;
import it.unimi.dsi.fastutil.objects.ObjectLinkedOpenHashSet;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Selected ids (in selection order), focus and range anchor of one dialog.
 * <p>
 * Also remembers the order in which ids were focused, most recent last, so over-full selections
 * can be trimmed deterministically.
 */
public final class SelectionModel {

    private final ObjectLinkedOpenHashSet<EntryId> selected = new ObjectLinkedOpenHashSet<>();
    private final ObjectLinkedOpenHashSet<EntryId> focusRecency = new ObjectLinkedOpenHashSet<>();
    private @Nullable EntryId focused;
    private @Nullable EntryId anchor;

    public List<EntryId> selected() {
        return List.copyOf(selected);
    }

    public int size() {
        return selected.size();
    }

    public boolean isEmpty() {
        return selected.isEmpty();
    }

    public boolean isSelected(EntryId id) {
        return selected.contains(id);
    }

    @Nullable
    public EntryId focused() {
        return focused;
    }

    @Nullable
    public EntryId anchor() {
        return anchor;
    }

    public void setFocused(@Nullable EntryId id) {
        focused = id;
        if (id != null) {
            focusRecency.addAndMoveToLast(id);
        }
    }

    public void setAnchor(@Nullable EntryId id) {
        anchor = id;
    }

    public void add(EntryId id) {
        selected.add(Objects.requireNonNull(id, "id"));
    }

    public boolean remove(EntryId id) {
        return selected.remove(id);
    }

    /**
     * Replaces the selected ids, keeping the given order. Focus and anchor are untouched.
     */
    public void replace(Collection<EntryId> ids) {
        selected.clear();
        for (EntryId id : ids) {
            add(id);
        }
    }

    public void clearSelection() {
        selected.clear();
    }

    public void reset() {
        selected.clear();
        focusRecency.clear();
        focused = null;
        anchor = null;
    }

    /**
     * Focused ids, most recently focused first.
     */
    public List<EntryId> focusRecency() {
        ObjectArrayList<EntryId> out = new ObjectArrayList<>(focusRecency);
        Collections.reverse(out);
        return out;
    }

    boolean removeSelectedIf(Predicate<EntryId> predicate) {
        return selected.removeIf(predicate);
    }

    boolean removeFocusHistoryIf(Predicate<EntryId> predicate) {
        return focusRecency.removeIf(predicate);
    }

    boolean retainSelected(Collection<EntryId> keep) {
        return selected.retainAll(keep);
    }

    public SelectionSnapshot snapshot() {
        return new SelectionSnapshot(selected(), focused, anchor);
    }

    @Override
    public String toString() {
        return "SelectionModel{selected=" + selected + ", focused=" + focused + ", anchor=" + anchor + '}';
    }
}
