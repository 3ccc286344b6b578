package com.tyron.filepicker.core.scan;

import com.tyron.filepicker.api.model.EntryId;
import com.tyron.filepicker.api.model.FileMeta;
import com.tyron.filepicker.api.scan.ScanBatch;
import com.tyron.filepicker.api.scan.ScanHook;
import com.tyron.filepicker.api.vfs.FsEntry;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds the snapshot of the generation being scanned and holds the published one.
 * <p>
 * Only one generation is built at a time. A snapshot is published (becomes authoritative) when
 * its {@code COMPLETE} batch is applied; until then the previous snapshot stays visible.
 * Batches of any other generation are ignored. Publishing drops the id mappings of paths the
 * new snapshot no longer lists.
 */
public final class SnapshotStore {

    private static final Logger LOG = Logger.getLogger(SnapshotStore.class.getName());

    private final EntryIdRegistry ids;
    private final @Nullable ScanHook hook;

    private @Nullable DirSnapshot published;

    private boolean building;
    private long buildingGeneration = -1;
    private @Nullable Path buildingDirectory;
    private final Map<EntryId, FileMeta> pending = new LinkedHashMap<>();

    public SnapshotStore(EntryIdRegistry ids, @Nullable ScanHook hook) {
        this.ids = Objects.requireNonNull(ids, "ids");
        this.hook = hook;
    }

    public SnapshotStore(EntryIdRegistry ids) {
        this(ids, null);
    }

    /**
     * Starts building {@code generation}. Any partially built older generation is abandoned.
     */
    public void begin(long generation, Path directory) {
        Objects.requireNonNull(directory, "directory");
        if (building && LOG.isLoggable(Level.FINE)) {
            LOG.fine("abandon generation " + buildingGeneration + " with " + pending.size() + " entries");
        }
        building = true;
        buildingGeneration = generation;
        buildingDirectory = directory;
        pending.clear();
    }

    /**
     * @return true if the batch belonged to the generation being built and was applied
     */
    public boolean apply(ScanBatch batch) {
        Objects.requireNonNull(batch, "batch");
        if (!building || batch.generation() != buildingGeneration) {
            return false;
        }

        switch (batch.kind()) {
            case BEGIN -> pending.clear();
            case ENTRIES -> addAll(batch.entries());
            case COMPLETE -> {
                addAll(batch.entries());
                publish();
            }
            case ERROR -> {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("generation " + buildingGeneration + " failed, keeping " + published);
                }
                pending.clear();
                building = false;
            }
        }
        return true;
    }

    private void addAll(List<FsEntry> entries) {
        for (FsEntry raw : entries) {
            FsEntry entry = hook != null ? hook.apply(raw) : raw;
            if (entry == null) {
                continue;
            }
            EntryId id = ids.getOrCreateId(entry.getPath());
            // Re-delivered paths replace the earlier row.
            pending.put(id, FileMeta.of(id, entry));
        }
    }

    private void publish() {
        published = new DirSnapshot(buildingGeneration, buildingDirectory, pending);
        List<Path> listed = new ArrayList<>(pending.size());
        for (FileMeta meta : pending.values()) {
            listed.add(meta.getPath());
        }
        int forgotten = ids.retainOnly(listed);
        pending.clear();
        building = false;
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("published " + published + ", forgot " + forgotten + " ids");
        }
    }

    /**
     * The authoritative snapshot, or null before the first scan completed.
     */
    @Nullable
    public DirSnapshot current() {
        return published;
    }

    public boolean isBuilding() {
        return building;
    }

    public long buildingGeneration() {
        return buildingGeneration;
    }

    /**
     * Entries accumulated so far for the generation being built.
     */
    public int loaded() {
        return pending.size();
    }

    public EntryIdRegistry ids() {
        return ids;
    }
}
