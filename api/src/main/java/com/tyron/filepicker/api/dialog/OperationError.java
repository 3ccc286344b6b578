package com.tyron.filepicker.api.dialog;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Failure of a file operation (create, rename, delete, paste, bookmark persistence).
 */
public record OperationError(String operation, @Nullable Path path, String message) {

    public OperationError {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(message, "message");
    }
}
