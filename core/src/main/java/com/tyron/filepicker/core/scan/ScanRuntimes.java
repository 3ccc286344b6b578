package com.tyron.filepicker.core.scan;

import com.tyron.filepicker.api.scan.ScanPolicy;
import com.tyron.filepicker.api.scan.ScanRuntime;
import com.tyron.filepicker.api.vfs.FileSystem;

import java.util.Objects;
import java.util.function.Function;

public final class ScanRuntimes {

    private ScanRuntimes() {
    }

    public static ScanRuntime forPolicy(FileSystem fs, ScanPolicy policy) {
        Objects.requireNonNull(fs, "fs");
        Objects.requireNonNull(policy, "policy");
        return switch (policy.kind()) {
            case SYNC -> new SyncRuntime(fs);
            case INCREMENTAL -> new IncrementalRuntime(fs, policy.batchSize());
            case BACKGROUND -> new WorkerRuntime(fs, policy.batchSize());
        };
    }

    public static Function<ScanPolicy, ScanRuntime> factory(FileSystem fs) {
        Objects.requireNonNull(fs, "fs");
        return policy -> forPolicy(fs, policy);
    }
}
