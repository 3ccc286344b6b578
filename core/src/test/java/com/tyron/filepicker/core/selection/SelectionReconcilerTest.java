package com.tyron.filepicker.core.selection;

import com.tyron.filepicker.api.model.EntryId;
import com.tyron.filepicker.api.vfs.FsEntry;
import com.tyron.filepicker.core.scan.DirSnapshot;
import com.tyron.filepicker.core.scan.EntryIdRegistry;
import com.tyron.filepicker.core.scan.Snapshots;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;

public class SelectionReconcilerTest {

    private static final Path DIR = Path.of("/files");

    private EntryIdRegistry ids;
    private DirSnapshot snapshot;
    private List<EntryId> visible;

    @BeforeEach
    public void setUp() {
        ids = new EntryIdRegistry();
        snapshot = Snapshots.of(ids, DIR, "a.txt", "b.txt", "c.txt", "d.txt", "e.txt", "beta.md", "alpha.md");
        visible = new ArrayList<>(snapshot.orderedIds());
    }

    private EntryId id(String name) {
        return snapshot.findByName(name).getId();
    }

    @Test
    public void shiftClickSelectsContiguousRange() {
        List<EntryId> abc = List.of(id("a.txt"), id("b.txt"), id("c.txt"));
        SelectionReconciler reconciler = new SelectionReconciler(Integer.MAX_VALUE, true);
        SelectionModel model = new SelectionModel();

        reconciler.click(model, id("a.txt"));
        reconciler.shiftClick(model, abc, id("c.txt"));

        Assertions.assertEquals(abc, model.selected());
        Assertions.assertEquals(id("a.txt"), model.anchor());
        Assertions.assertEquals(id("c.txt"), model.focused());
    }

    @Test
    public void rangeSelectionIsSymmetric() {
        for (int max : new int[]{Integer.MAX_VALUE, 3}) {
            SelectionReconciler reconciler = new SelectionReconciler(max, true);
            for (int i = 0; i < visible.size(); i++) {
                for (int j = 0; j < visible.size(); j++) {
                    SelectionModel forward = new SelectionModel();
                    reconciler.click(forward, visible.get(i));
                    reconciler.shiftClick(forward, visible, visible.get(j));

                    SelectionModel backward = new SelectionModel();
                    reconciler.click(backward, visible.get(j));
                    reconciler.shiftClick(backward, visible, visible.get(i));

                    Assertions.assertEquals(new HashSet<>(forward.selected()), new HashSet<>(backward.selected()),
                            "i=" + i + " j=" + j + " max=" + max);
                    Assertions.assertTrue(forward.size() <= max);
                }
            }
        }
    }

    @Test
    public void ctrlClickTogglesWithoutMovingAnchor() {
        SelectionReconciler reconciler = new SelectionReconciler(2, true);
        SelectionModel model = new SelectionModel();

        reconciler.click(model, id("a.txt"));
        reconciler.ctrlClick(model, id("c.txt"));
        Assertions.assertEquals(List.of(id("a.txt"), id("c.txt")), model.selected());
        Assertions.assertEquals(id("a.txt"), model.anchor());

        reconciler.ctrlClick(model, id("d.txt"));
        Assertions.assertEquals(2, model.size(), "adding beyond the cap is ignored");

        reconciler.ctrlClick(model, id("a.txt"));
        Assertions.assertEquals(List.of(id("c.txt")), model.selected());
    }

    @Test
    public void singleSelectionTreatsModifiersAsPlainClick() {
        SelectionReconciler reconciler = new SelectionReconciler(5, false);
        SelectionModel model = new SelectionModel();

        reconciler.click(model, id("a.txt"));
        reconciler.ctrlClick(model, id("b.txt"));
        Assertions.assertEquals(List.of(id("b.txt")), model.selected());

        reconciler.shiftClick(model, visible, id("e.txt"));
        Assertions.assertEquals(List.of(id("e.txt")), model.selected());

        reconciler.selectAll(model, visible);
        Assertions.assertEquals(1, model.size());
        Assertions.assertEquals(1, reconciler.maxSelection());
    }

    @Test
    public void gesturesNeverExceedMaximum() {
        Random random = new Random(11);
        SelectionReconciler reconciler = new SelectionReconciler(3, true);
        SelectionModel model = new SelectionModel();

        for (int step = 0; step < 1_000; step++) {
            EntryId target = visible.get(random.nextInt(visible.size()));
            switch (random.nextInt(6)) {
                case 0 -> reconciler.click(model, target);
                case 1 -> reconciler.ctrlClick(model, target);
                case 2 -> reconciler.shiftClick(model, visible, target);
                case 3 -> reconciler.selectAll(model, visible);
                case 4 -> reconciler.moveFocus(model, visible, random.nextInt(5) - 2, random.nextBoolean());
                default -> reconciler.replaceSelection(model, visible);
            }
            Assertions.assertTrue(model.size() <= 3, "step " + step + ": " + model);
        }
    }

    @Test
    public void reconcileDropsIdsThatNoLongerResolve() {
        SelectionReconciler reconciler = new SelectionReconciler(Integer.MAX_VALUE, true);
        SelectionModel model = new SelectionModel();
        reconciler.click(model, id("a.txt"));
        reconciler.shiftClick(model, visible, id("c.txt"));

        DirSnapshot rescanned = Snapshots.of(ids, 2, DIR, List.of(
                Snapshots.entry(DIR, "b.txt"), Snapshots.entry(DIR, "d.txt")));

        Assertions.assertTrue(reconciler.reconcile(model, rescanned));
        Assertions.assertEquals(List.of(id("b.txt")), model.selected());
        Assertions.assertNull(model.focused());
        Assertions.assertNull(model.anchor());
        Assertions.assertFalse(reconciler.reconcile(model, rescanned));
    }

    @Test
    public void reconcileKeepsEverythingResolvable() {
        Random random = new Random(3);
        SelectionReconciler reconciler = new SelectionReconciler(4, true);
        SelectionModel model = new SelectionModel();
        List<String> names = List.of("a.txt", "b.txt", "c.txt", "d.txt", "e.txt", "beta.md", "alpha.md");

        for (int round = 0; round < 200; round++) {
            reconciler.shiftClick(model, visible, visible.get(random.nextInt(visible.size())));
            reconciler.ctrlClick(model, visible.get(random.nextInt(visible.size())));

            List<FsEntry> survivors = new ArrayList<>();
            for (String name : names) {
                if (random.nextBoolean()) {
                    survivors.add(Snapshots.entry(DIR, name));
                }
            }
            DirSnapshot next = Snapshots.of(ids, round + 2, DIR, survivors);
            reconciler.reconcile(model, next);

            for (EntryId selected : model.selected()) {
                Assertions.assertTrue(next.contains(selected));
            }
            if (model.focused() != null) {
                Assertions.assertTrue(next.contains(model.focused()));
            }
            if (model.anchor() != null) {
                Assertions.assertTrue(next.contains(model.anchor()));
            }
            Assertions.assertTrue(model.size() <= 4);
        }
    }

    @Test
    public void reconcileAgainstNothingClearsSelection() {
        SelectionReconciler reconciler = new SelectionReconciler(5, true);
        SelectionModel model = new SelectionModel();
        reconciler.click(model, id("a.txt"));

        reconciler.reconcile(model, null);

        Assertions.assertTrue(model.isEmpty());
        Assertions.assertNull(model.focused());
    }

    @Test
    public void reconcileAgainstVisibleListDropsHiddenIds() {
        SelectionReconciler reconciler = new SelectionReconciler(Integer.MAX_VALUE, true);
        SelectionModel model = new SelectionModel();
        reconciler.click(model, id("a.txt"));
        reconciler.ctrlClick(model, id("beta.md"));

        Assertions.assertTrue(reconciler.reconcile(model, snapshot, List.of(id("a.txt"), id("b.txt"))));

        Assertions.assertEquals(List.of(id("a.txt")), model.selected());
        Assertions.assertEquals(id("a.txt"), model.anchor());
        Assertions.assertNull(model.focused());
        Assertions.assertFalse(reconciler.reconcile(model, snapshot, List.of(id("a.txt"), id("b.txt"))));
    }

    @Test
    public void trimKeepsMostRecentlyFocusedIds() {
        SelectionModel model = new SelectionModel();
        model.replace(List.of(id("a.txt"), id("b.txt"), id("c.txt"), id("d.txt"), id("e.txt")));
        model.setFocused(id("d.txt"));
        model.setFocused(id("b.txt"));

        new SelectionReconciler(2, true).reconcile(model, snapshot);

        Assertions.assertEquals(List.of(id("b.txt"), id("d.txt")), model.selected());
    }

    @Test
    public void moveFocusWithExtendGrowsRangeFromAnchor() {
        SelectionReconciler reconciler = new SelectionReconciler(Integer.MAX_VALUE, true);
        SelectionModel model = new SelectionModel();
        reconciler.click(model, visible.get(1));

        reconciler.moveFocus(model, visible, 2, true);

        Assertions.assertEquals(visible.subList(1, 4), model.selected());
        Assertions.assertEquals(visible.get(1), model.anchor());
        Assertions.assertEquals(visible.get(3), model.focused());

        reconciler.moveFocus(model, visible, 100, false);
        Assertions.assertEquals(List.of(visible.get(visible.size() - 1)), model.selected());
    }

    @Test
    public void moveFocusWithoutFocusStartsAtEdge() {
        SelectionReconciler reconciler = new SelectionReconciler(1, false);
        SelectionModel model = new SelectionModel();

        reconciler.moveFocus(model, visible, -1, false);

        Assertions.assertEquals(visible.get(visible.size() - 1), model.focused());
    }

    @Test
    public void prefixSelectionCyclesThroughMatches() {
        SelectionReconciler reconciler = new SelectionReconciler(1, false);
        SelectionModel model = new SelectionModel();

        Assertions.assertTrue(reconciler.selectByPrefix(model, visible, snapshot, "B"));
        Assertions.assertEquals(id("b.txt"), model.focused());

        Assertions.assertTrue(reconciler.selectByPrefix(model, visible, snapshot, "b"));
        Assertions.assertEquals(id("beta.md"), model.focused());

        Assertions.assertTrue(reconciler.selectByPrefix(model, visible, snapshot, "b"));
        Assertions.assertEquals(id("b.txt"), model.focused());

        Assertions.assertFalse(reconciler.selectByPrefix(model, visible, snapshot, "zz"));
        Assertions.assertEquals(id("b.txt"), model.focused());
    }

    @Test
    public void rejectsNonPositiveMaximum() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new SelectionReconciler(0, true));
    }
}
