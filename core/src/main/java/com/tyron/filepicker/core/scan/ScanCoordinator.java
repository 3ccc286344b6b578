package com.tyron.filepicker.core.scan;

import com.tyron.filepicker.api.scan.ScanBatch;
import com.tyron.filepicker.api.scan.ScanPolicy;
import com.tyron.filepicker.api.scan.ScanRequest;
import com.tyron.filepicker.api.scan.ScanRuntime;
import com.tyron.filepicker.api.scan.ScanStatus;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns scan generations for one dialog.
 * <p>
 * Every {@link #requestScan(Path, ScanPolicy)} supersedes the previous request. Batches are
 * pulled from the runtime in {@link #pollApply()} and only those tagged with the current
 * generation reach the {@link SnapshotStore}; everything else is dropped, whether or not the
 * runtime honored the cancellation.
 */
public final class ScanCoordinator implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ScanCoordinator.class.getName());

    private final SnapshotStore store;
    private final Function<ScanPolicy, ScanRuntime> runtimeFactory;

    private @Nullable ScanRuntime runtime;
    private @Nullable ScanPolicy runtimePolicy;

    private long generation;
    private @Nullable Path directory;
    private @Nullable ScanPolicy policy;
    private ScanStatus status = ScanStatus.idle();
    private long droppedBatches;

    public ScanCoordinator(SnapshotStore store, Function<ScanPolicy, ScanRuntime> runtimeFactory) {
        this.store = Objects.requireNonNull(store, "store");
        this.runtimeFactory = Objects.requireNonNull(runtimeFactory, "runtimeFactory");
    }

    /**
     * Supersedes any in-flight scan and starts a new generation.
     *
     * @return the new generation
     * @throws ArithmeticException if the generation counter overflows
     */
    public long requestScan(Path directory, ScanPolicy policy) {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(policy, "policy");

        long next = Math.addExact(generation, 1);
        if (runtime != null && generation > 0) {
            runtime.cancelGeneration(generation);
        }
        ScanRuntime rt = runtimeFor(policy);

        this.generation = next;
        this.directory = directory;
        this.policy = policy;
        store.begin(next, directory);
        status = ScanStatus.scanning(next);

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("scan gen=" + next + " dir=" + directory + " policy=" + policy.kind());
        }
        rt.request(new ScanRequest(next, directory, policy));
        return next;
    }

    private ScanRuntime runtimeFor(ScanPolicy policy) {
        ScanRuntime current = runtime;
        if (current != null && policy.equals(runtimePolicy)) {
            return current;
        }
        ScanRuntime created = Objects.requireNonNull(runtimeFactory.apply(policy), "runtime");
        if (current != null && current != created) {
            current.close();
        }
        runtime = created;
        runtimePolicy = policy;
        return created;
    }

    /**
     * Re-scans the current directory with the current policy.
     */
    public long refresh() {
        if (directory == null || policy == null) {
            throw new IllegalStateException("nothing scanned yet");
        }
        return requestScan(directory, policy);
    }

    /**
     * Applies the batches available right now, bounded by the policy's batches-per-tick.
     */
    public ScanStatus pollApply() {
        ScanRuntime rt = runtime;
        ScanPolicy p = policy;
        if (rt == null || p == null) {
            return status;
        }

        int budget = p.kind() == ScanPolicy.Kind.SYNC ? Integer.MAX_VALUE : p.maxBatchesPerTick();
        int applied = 0;
        while (applied < budget) {
            ScanBatch batch = rt.pollBatch();
            if (batch == null) {
                break;
            }
            if (batch.generation() != generation) {
                droppedBatches++;
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("drop stale " + batch.kind() + " gen=" + batch.generation() + " current=" + generation);
                }
                continue;
            }
            applied++;
            accept(batch);
        }
        return status;
    }

    private void accept(ScanBatch batch) {
        if (!store.apply(batch)) {
            // Generation already finished (a runtime delivered after its terminal batch).
            droppedBatches++;
            return;
        }
        switch (batch.kind()) {
            case BEGIN -> status = ScanStatus.scanning(generation);
            case ENTRIES -> status = ScanStatus.partial(generation, store.loaded());
            case COMPLETE -> {
                DirSnapshot snapshot = Objects.requireNonNull(store.current());
                status = ScanStatus.complete(generation, snapshot.size());
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("scan gen=" + generation + " complete, " + snapshot.size() + " entries");
                }
            }
            case ERROR -> {
                String message = Objects.requireNonNull(batch.message());
                status = ScanStatus.failed(generation, message);
                LOG.warning("scan of " + directory + " failed: " + message);
            }
        }
    }

    public ScanStatus status() {
        return status;
    }

    public long generation() {
        return generation;
    }

    @Nullable
    public Path directory() {
        return directory;
    }

    @Nullable
    public ScanPolicy policy() {
        return policy;
    }

    public long droppedBatchCount() {
        return droppedBatches;
    }

    public SnapshotStore store() {
        return store;
    }

    @Override
    public void close() {
        ScanRuntime rt = runtime;
        runtime = null;
        runtimePolicy = null;
        if (rt != null) {
            rt.close();
        }
    }
}
