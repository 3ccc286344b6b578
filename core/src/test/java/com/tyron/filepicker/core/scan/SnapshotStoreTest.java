package com.tyron.filepicker.core.scan;

import com.tyron.filepicker.api.model.EntryId;
import com.tyron.filepicker.api.model.FileMeta;
import com.tyron.filepicker.api.scan.ScanBatch;
import com.tyron.filepicker.api.vfs.FsEntry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class SnapshotStoreTest {

    private static final Path DIR = Path.of("/work");

    private EntryIdRegistry ids;

    @BeforeEach
    public void setUp() {
        ids = new EntryIdRegistry();
    }

    private static FsEntry file(String name) {
        return FsEntry.file(DIR.resolve(name), 10, 0);
    }

    private static List<String> names(DirSnapshot snapshot) {
        List<String> out = new ArrayList<>();
        for (FileMeta meta : snapshot.entries()) {
            out.add(meta.getName());
        }
        return out;
    }

    @Test
    public void chunkingDoesNotChangeResult() {
        SnapshotStore chunked = new SnapshotStore(ids);
        chunked.begin(1, DIR);
        chunked.apply(ScanBatch.begin(1));
        chunked.apply(ScanBatch.entries(1, List.of(file("c.txt"), file("a.txt"))));
        chunked.apply(ScanBatch.entries(1, List.of(file("b.txt"))));
        chunked.apply(ScanBatch.complete(1, List.of()));

        SnapshotStore single = new SnapshotStore(ids);
        single.begin(1, DIR);
        single.apply(ScanBatch.complete(1, List.of(file("b.txt"), file("c.txt"), file("a.txt"))));

        Assertions.assertEquals(single.current().orderedIds(), chunked.current().orderedIds());
        Assertions.assertEquals(single.current().entriesById(), chunked.current().entriesById());
    }

    @Test
    public void orderIsNormalizedByLowerCaseName() {
        DirSnapshot snapshot = Snapshots.of(ids, 1, DIR,
                List.of(file("B.txt"), file("c.txt"), file("a.txt")));

        Assertions.assertEquals(List.of("a.txt", "B.txt", "c.txt"), names(snapshot));
    }

    @Test
    public void publishingForgetsPathsNoLongerListed() {
        SnapshotStore store = new SnapshotStore(ids);
        store.begin(1, DIR);
        store.apply(ScanBatch.complete(1, List.of(file("a.txt"), file("b.txt"))));
        EntryId a = store.current().findByName("a.txt").getId();
        EntryId b = store.current().findByName("b.txt").getId();

        Path other = Path.of("/elsewhere");
        store.begin(2, other);
        store.apply(ScanBatch.complete(2, List.of(FsEntry.file(other.resolve("x"), 1, 0))));
        Assertions.assertEquals(1, ids.size());
        Assertions.assertNull(ids.find(DIR.resolve("a.txt")));

        store.begin(3, DIR);
        store.apply(ScanBatch.complete(3, List.of(file("a.txt"), file("b.txt"))));
        EntryId newA = store.current().findByName("a.txt").getId();
        Assertions.assertNotEquals(a, newA);
        Assertions.assertNotEquals(b, newA);
        Assertions.assertEquals(2, ids.size());
    }

    @Test
    public void failedScanKeepsIdsOfPublishedSnapshot() {
        SnapshotStore store = new SnapshotStore(ids);
        store.begin(1, DIR);
        store.apply(ScanBatch.complete(1, List.of(file("a.txt"))));
        EntryId a = store.current().findByName("a.txt").getId();

        store.begin(2, DIR);
        store.apply(ScanBatch.error(2, "permission denied: /work"));

        Assertions.assertEquals(a, ids.find(DIR.resolve("a.txt")));
    }

    @Test
    public void samePathKeepsIdAcrossGenerations() {
        SnapshotStore store = new SnapshotStore(ids);
        store.begin(1, DIR);
        store.apply(ScanBatch.complete(1, List.of(file("keep.txt"), file("old.txt"))));
        EntryId keep = store.current().findByName("keep.txt").getId();
        EntryId old = store.current().findByName("old.txt").getId();

        store.begin(2, DIR);
        store.apply(ScanBatch.complete(2, List.of(file("keep.txt"), file("new.txt"))));

        DirSnapshot second = store.current();
        Assertions.assertEquals(2, second.generation());
        Assertions.assertEquals(keep, second.findByName("keep.txt").getId());
        Assertions.assertNotEquals(old, second.findByName("new.txt").getId());
        Assertions.assertFalse(second.contains(old));
    }

    @Test
    public void redeliveredPathReplacesEarlierRow() {
        SnapshotStore store = new SnapshotStore(ids);
        store.begin(1, DIR);
        store.apply(ScanBatch.entries(1, List.of(FsEntry.file(DIR.resolve("a"), 1, 0))));
        store.apply(ScanBatch.complete(1, List.of(FsEntry.file(DIR.resolve("a"), 5, 0))));

        DirSnapshot snapshot = store.current();
        Assertions.assertEquals(1, snapshot.size());
        Assertions.assertEquals(5, snapshot.findByName("a").getSize());
    }

    @Test
    public void batchOfOtherGenerationIsIgnored() {
        SnapshotStore store = new SnapshotStore(ids);
        store.begin(2, DIR);

        Assertions.assertFalse(store.apply(ScanBatch.complete(1, List.of(file("a.txt")))));
        Assertions.assertNull(store.current());
        Assertions.assertTrue(store.isBuilding());
        Assertions.assertEquals(2, store.buildingGeneration());
    }

    @Test
    public void previousSnapshotStaysVisibleWhileBuilding() {
        SnapshotStore store = new SnapshotStore(ids);
        store.begin(1, DIR);
        store.apply(ScanBatch.complete(1, List.of(file("a.txt"))));
        DirSnapshot first = store.current();

        store.begin(2, Path.of("/other"));
        store.apply(ScanBatch.entries(2, List.of(FsEntry.file(Path.of("/other/x"), 1, 0))));

        Assertions.assertSame(first, store.current());
        Assertions.assertEquals(1, store.loaded());
    }

    @Test
    public void errorKeepsPublishedSnapshot() {
        SnapshotStore store = new SnapshotStore(ids);
        store.begin(1, DIR);
        store.apply(ScanBatch.complete(1, List.of(file("a.txt"))));
        DirSnapshot first = store.current();

        store.begin(2, DIR);
        store.apply(ScanBatch.entries(2, List.of(file("b.txt"))));
        Assertions.assertTrue(store.apply(ScanBatch.error(2, "boom")));

        Assertions.assertSame(first, store.current());
        Assertions.assertFalse(store.isBuilding());
        Assertions.assertFalse(store.apply(ScanBatch.complete(2, List.of())));
    }

    @Test
    public void hookCanRewriteAndDropEntries() {
        SnapshotStore store = new SnapshotStore(ids, entry -> {
            if (entry.getName().endsWith(".tmp")) {
                return null;
            }
            return entry.withName(entry.getName().toUpperCase());
        });
        store.begin(1, DIR);
        store.apply(ScanBatch.complete(1, List.of(file("a.txt"), file("scratch.tmp"))));

        Assertions.assertEquals(List.of("A.TXT"), names(store.current()));
        Assertions.assertEquals(DIR.resolve("a.txt"), store.current().findByName("A.TXT").getPath());
    }
}
