package com.tyron.filepicker.core.dialog;

import com.tyron.filepicker.api.dialog.DialogResult;
import com.tyron.filepicker.api.dialog.DialogStateKind;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * State of the dialog state machine: {@code OPEN -> CONFIRM_OVERWRITE(target) -> FINISHED(result)}.
 */
public record DialogState(DialogStateKind kind, @Nullable Path overwriteTarget, @Nullable DialogResult result) {

    private static final DialogState OPEN = new DialogState(DialogStateKind.OPEN, null, null);

    public DialogState {
        Objects.requireNonNull(kind, "kind");
        if (kind == DialogStateKind.CONFIRM_OVERWRITE) Objects.requireNonNull(overwriteTarget, "overwriteTarget");
        if (kind == DialogStateKind.FINISHED) {
            Objects.requireNonNull(result, "result");
            if (result.kind() == DialogResult.Kind.VALIDATION_FAILED) {
                throw new IllegalArgumentException("validation failures do not finish a dialog");
            }
        }
    }

    public static DialogState open() {
        return OPEN;
    }

    public static DialogState confirmOverwrite(Path target) {
        return new DialogState(DialogStateKind.CONFIRM_OVERWRITE, target, null);
    }

    public static DialogState finished(DialogResult result) {
        return new DialogState(DialogStateKind.FINISHED, null, result);
    }

    public boolean isFinished() {
        return kind == DialogStateKind.FINISHED;
    }
}
