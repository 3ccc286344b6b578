package com.tyron.filepicker.core.thumbnails;

import com.tyron.filepicker.api.thumbnails.RgbaImage;
import com.tyron.filepicker.api.thumbnails.ThumbnailProvider;
import com.tyron.filepicker.api.thumbnails.ThumbnailRenderer;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides which thumbnails to decode and when to release them.
 * <p>
 * New requests are limited per frame; entries beyond {@code maxEntries} are evicted least
 * recently used first. Textures of evicted (or late-arriving, already evicted) entries are
 * queued for destruction. Decoding and uploading are done by host collaborators.
 */
public final class ThumbnailCache {

    private static final Logger LOG = Logger.getLogger(ThumbnailCache.class.getName());

    public static final int DEFAULT_MAX_ENTRIES = 256;
    public static final int DEFAULT_MAX_NEW_REQUESTS_PER_FRAME = 24;

    public enum State {
        REQUESTED,
        READY,
        FAILED
    }

    private static final class Entry {
        State state = State.REQUESTED;
        long textureId;
        long lastUsed;
    }

    private final int maxEntries;
    private final int maxNewRequestsPerFrame;

    private final Map<Path, Entry> entries = new HashMap<>();
    private final List<ThumbnailRequest> pendingRequests = new ArrayList<>();
    private final LongList pendingDestroys = new LongArrayList();

    private long stamp;
    private int requestedThisFrame;

    public ThumbnailCache() {
        this(DEFAULT_MAX_ENTRIES, DEFAULT_MAX_NEW_REQUESTS_PER_FRAME);
    }

    public ThumbnailCache(int maxEntries, int maxNewRequestsPerFrame) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        if (maxNewRequestsPerFrame <= 0) {
            throw new IllegalArgumentException("maxNewRequestsPerFrame must be positive: " + maxNewRequestsPerFrame);
        }
        this.maxEntries = maxEntries;
        this.maxNewRequestsPerFrame = maxNewRequestsPerFrame;
    }

    /**
     * Resets the per-frame request budget.
     */
    public void beginFrame() {
        requestedThisFrame = 0;
    }

    /**
     * Marks {@code path} as wanted this frame, queueing a decode request if it is new and the
     * frame budget allows.
     *
     * @return true if the thumbnail is known (requested, ready or failed) after the call
     */
    public boolean request(Path path, int maxSize) {
        Objects.requireNonNull(path, "path");
        Entry entry = entries.get(path);
        if (entry != null) {
            entry.lastUsed = ++stamp;
            return true;
        }
        if (requestedThisFrame >= maxNewRequestsPerFrame) {
            return false;
        }
        entry = new Entry();
        entry.lastUsed = ++stamp;
        entries.put(path, entry);
        pendingRequests.add(new ThumbnailRequest(path, maxSize));
        requestedThisFrame++;
        evictIfNeeded();
        return true;
    }

    public List<ThumbnailRequest> takeRequests() {
        List<ThumbnailRequest> out = new ArrayList<>(pendingRequests);
        pendingRequests.clear();
        return out;
    }

    /**
     * Records an uploaded texture. If the entry was evicted meanwhile the texture is queued for
     * destruction instead.
     */
    public void fulfill(Path path, long textureId) {
        Entry entry = entries.get(path);
        if (entry == null || entry.state != State.REQUESTED) {
            pendingDestroys.add(textureId);
            return;
        }
        entry.state = State.READY;
        entry.textureId = textureId;
    }

    public void fail(Path path) {
        Entry entry = entries.get(path);
        if (entry != null && entry.state == State.REQUESTED) {
            entry.state = State.FAILED;
        }
    }

    public OptionalLong texture(Path path) {
        Entry entry = entries.get(path);
        return entry != null && entry.state == State.READY ? OptionalLong.of(entry.textureId) : OptionalLong.empty();
    }

    @Nullable
    public State state(Path path) {
        Entry entry = entries.get(path);
        return entry == null ? null : entry.state;
    }

    public long[] takePendingDestroys() {
        long[] out = pendingDestroys.toLongArray();
        pendingDestroys.clear();
        return out;
    }

    /**
     * Drops everything; ready textures are queued for destruction.
     */
    public void clear() {
        for (Entry e : entries.values()) {
            if (e.state == State.READY) {
                pendingDestroys.add(e.textureId);
            }
        }
        entries.clear();
        pendingRequests.clear();
    }

    public int size() {
        return entries.size();
    }

    /**
     * Runs queued requests through the host collaborators and destroys released textures.
     */
    public void pump(ThumbnailProvider provider, ThumbnailRenderer renderer) {
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(renderer, "renderer");
        for (ThumbnailRequest req : takeRequests()) {
            try {
                RgbaImage image = provider.decode(req.path(), req.maxSize());
                fulfill(req.path(), renderer.upload(image));
            } catch (IOException e) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("thumbnail decode failed for " + req.path() + ": " + e);
                }
                fail(req.path());
            }
        }
        for (long id : takePendingDestroys()) {
            renderer.destroy(id);
        }
    }

    private void evictIfNeeded() {
        while (entries.size() > maxEntries) {
            Path victim = null;
            long oldest = Long.MAX_VALUE;
            for (Map.Entry<Path, Entry> e : entries.entrySet()) {
                if (e.getValue().lastUsed < oldest) {
                    oldest = e.getValue().lastUsed;
                    victim = e.getKey();
                }
            }
            Path evicted = victim;
            Entry removed = entries.remove(evicted);
            if (removed.state == State.READY) {
                pendingDestroys.add(removed.textureId);
            }
            pendingRequests.removeIf(r -> r.path().equals(evicted));
        }
    }
}
