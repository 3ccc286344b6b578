package com.tyron.filepicker.core.selection;

import com.tyron.filepicker.api.model.EntryId;
import com.tyron.filepicker.api.model.FileMeta;
import com.tyron.filepicker.core.scan.DirSnapshot;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps a {@link SelectionModel} consistent with the authoritative snapshot and applies
 * selection gestures against the visible list.
 * <p>
 * Gestures never select more than {@code maxSelection} ids. Reconciliation drops ids that no
 * longer resolve and trims over-full selections, keeping the most recently focused ids first.
 */
public final class SelectionReconciler {

    private static final Logger LOG = Logger.getLogger(SelectionReconciler.class.getName());

    private final int maxSelection;
    private final boolean multiSelect;

    public SelectionReconciler(int maxSelection, boolean multiSelect) {
        if (maxSelection <= 0) {
            throw new IllegalArgumentException("maxSelection must be positive: " + maxSelection);
        }
        this.maxSelection = multiSelect ? maxSelection : 1;
        this.multiSelect = multiSelect && maxSelection > 1;
    }

    public int maxSelection() {
        return maxSelection;
    }

    public boolean isMultiSelect() {
        return multiSelect;
    }

    /**
     * @return true if the model changed
     */
    public boolean reconcile(SelectionModel model, @Nullable DirSnapshot snapshot) {
        Objects.requireNonNull(model, "model");
        return reconcile(model, id -> snapshot != null && snapshot.contains(id));
    }

    /**
     * Like {@link #reconcile(SelectionModel, DirSnapshot)}, but an id must also be part of the
     * projected {@code visible} list to stay selected, focused or anchored.
     *
     * @return true if the model changed
     */
    public boolean reconcile(SelectionModel model, @Nullable DirSnapshot snapshot, List<EntryId> visible) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(visible, "visible");
        Set<EntryId> shown = new ObjectOpenHashSet<>(visible);
        return reconcile(model, id -> snapshot != null && snapshot.contains(id) && shown.contains(id));
    }

    private boolean reconcile(SelectionModel model, Predicate<EntryId> keep) {
        int before = model.size();

        boolean changed = model.removeSelectedIf(keep.negate());
        if (model.focused() != null && !keep.test(model.focused())) {
            model.setFocused(null);
            changed = true;
        }
        if (model.anchor() != null && !keep.test(model.anchor())) {
            model.setAnchor(null);
            changed = true;
        }
        model.removeFocusHistoryIf(keep.negate());

        if (model.size() > maxSelection) {
            trim(model);
            changed = true;
        }

        if (changed && LOG.isLoggable(Level.FINE)) {
            LOG.fine("reconciled selection " + before + " -> " + model.size());
        }
        return changed;
    }

    private void trim(SelectionModel model) {
        Set<EntryId> keep = new ObjectOpenHashSet<>(maxSelection);
        for (EntryId id : model.focusRecency()) {
            if (keep.size() >= maxSelection) break;
            if (model.isSelected(id)) keep.add(id);
        }
        for (EntryId id : model.selected()) {
            if (keep.size() >= maxSelection) break;
            keep.add(id);
        }
        model.retainSelected(keep);
    }

    // --- gestures ---

    /**
     * Replaces the selection with {@code id}; focus and anchor move to it.
     */
    public void click(SelectionModel model, EntryId id) {
        model.replace(List.of(id));
        model.setFocused(id);
        model.setAnchor(id);
    }

    /**
     * Toggles {@code id}. The anchor is untouched; adding beyond the cap is ignored.
     */
    public void ctrlClick(SelectionModel model, EntryId id) {
        if (!multiSelect) {
            click(model, id);
            return;
        }
        if (model.isSelected(id)) {
            model.remove(id);
            model.setFocused(id);
            return;
        }
        if (model.size() >= maxSelection) {
            return;
        }
        model.add(id);
        model.setFocused(id);
    }

    /**
     * Selects the visible range between the anchor and {@code id}, replacing the selection.
     * Without a visible anchor this is a plain click.
     */
    public void shiftClick(SelectionModel model, List<EntryId> visible, EntryId id) {
        EntryId anchor = model.anchor();
        if (!multiSelect || anchor == null) {
            click(model, id);
            return;
        }
        int from = visible.indexOf(anchor);
        int to = visible.indexOf(id);
        if (to < 0) {
            return;
        }
        if (from < 0) {
            click(model, id);
            return;
        }
        model.replace(range(visible, from, to));
        model.setFocused(id);
    }

    /**
     * Ids between two visible positions (either order), in visible order, capped at the first
     * {@code maxSelection}.
     */
    List<EntryId> range(List<EntryId> visible, int a, int b) {
        int lo = Math.min(a, b);
        int hi = Math.max(a, b);
        int end = (int) Math.min(hi + 1L, (long) lo + maxSelection);
        return new ArrayList<>(visible.subList(lo, end));
    }

    /**
     * Selects the first {@code maxSelection} visible ids.
     */
    public void selectAll(SelectionModel model, List<EntryId> visible) {
        if (!multiSelect || visible.isEmpty()) {
            return;
        }
        model.replace(visible.subList(0, Math.min(visible.size(), maxSelection)));
        if (model.focused() == null || !visible.contains(model.focused())) {
            model.setFocused(visible.get(0));
        }
        if (model.anchor() == null) {
            model.setAnchor(model.focused());
        }
    }

    /**
     * Moves focus by {@code delta} rows; with {@code extend} the range from the anchor follows.
     */
    public void moveFocus(SelectionModel model, List<EntryId> visible, int delta, boolean extend) {
        if (visible.isEmpty()) {
            return;
        }
        EntryId focused = model.focused();
        int index = focused == null ? -1 : visible.indexOf(focused);
        int target;
        if (index < 0) {
            target = delta >= 0 ? 0 : visible.size() - 1;
        } else {
            target = Math.max(0, Math.min(visible.size() - 1, index + delta));
        }
        EntryId id = visible.get(target);

        if (extend && multiSelect) {
            if (model.anchor() == null || !visible.contains(model.anchor())) {
                model.setAnchor(index >= 0 ? focused : id);
            }
            shiftClick(model, visible, id);
        } else {
            click(model, id);
        }
    }

    /**
     * Type-to-select: selects the next visible entry after the focused one whose name starts
     * with {@code prefix}, wrapping around.
     *
     * @return true if an entry was found
     */
    public boolean selectByPrefix(SelectionModel model, List<EntryId> visible, DirSnapshot snapshot, String prefix) {
        String p = prefix.trim().toLowerCase(Locale.ROOT);
        if (p.isEmpty() || visible.isEmpty()) {
            return false;
        }
        EntryId focused = model.focused();
        int start = focused == null ? 0 : visible.indexOf(focused) + 1;
        int n = visible.size();
        for (int i = 0; i < n; i++) {
            EntryId id = visible.get((start + i) % n);
            FileMeta meta = snapshot.get(id);
            if (meta != null && meta.getNameLower().startsWith(p)) {
                click(model, id);
                return true;
            }
        }
        return false;
    }

    /**
     * Replaces the selection programmatically, keeping the first {@code maxSelection} ids.
     */
    public void replaceSelection(SelectionModel model, List<EntryId> ids) {
        if (ids.isEmpty()) {
            model.clearSelection();
            return;
        }
        List<EntryId> kept = ids.subList(0, Math.min(ids.size(), maxSelection));
        model.replace(kept);
        model.setFocused(kept.get(0));
        model.setAnchor(kept.get(0));
    }
}
