package com.tyron.filepicker.core.scan;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;

final class ScanErrors {

    private ScanErrors() {
    }

    static String describe(Path directory, IOException e) {
        if (e instanceof NoSuchFileException) {
            return "directory not found: " + directory;
        }
        if (e instanceof AccessDeniedException) {
            return "permission denied: " + directory;
        }
        if (e instanceof NotDirectoryException) {
            return "not a directory: " + directory;
        }
        String msg = e.getMessage();
        return msg == null || msg.isBlank()
                ? e.getClass().getSimpleName() + ": " + directory
                : msg;
    }
}
