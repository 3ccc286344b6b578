package com.tyron.filepicker.api.scan;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One scan attempt. Immutable once issued.
 */
public record ScanRequest(long generation, Path directory, ScanPolicy policy) {

    public ScanRequest {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(policy, "policy");
    }
}
