package com.tyron.filepicker.api.dialog;

import java.nio.file.Path;
import java.util.List;

/**
 * Host hook consulted before a dialog finishes with {@link DialogResult.Kind#OK}.
 */
@FunctionalInterface
public interface ConfirmValidator {

    ConfirmGate check(DialogMode mode, Path directory, List<Path> candidates);
}
