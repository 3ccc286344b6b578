package com.tyron.filepicker.api.dialog;

import java.nio.file.Path;
import java.util.List;

/**
 * Paths a dialog was confirmed with.
 */
public record Selection(List<Path> paths) {

    public Selection {
        paths = List.copyOf(paths);
    }

    public static Selection of(Path... paths) {
        return new Selection(List.of(paths));
    }
}
