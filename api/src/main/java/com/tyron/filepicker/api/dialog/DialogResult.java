package com.tyron.filepicker.api.dialog;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Outcome of a dialog.
 * <p>
 * {@link Kind#OK} and {@link Kind#CANCELLED} are terminal. {@link Kind#VALIDATION_FAILED}
 * describes a rejected confirm attempt; the dialog stays open.
 */
public record DialogResult(Kind kind, @Nullable Selection selection, @Nullable String reason) {

    private static final DialogResult CANCELLED = new DialogResult(Kind.CANCELLED, null, null);

    public enum Kind {
        OK,
        CANCELLED,
        VALIDATION_FAILED
    }

    public DialogResult {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.OK) Objects.requireNonNull(selection, "selection");
        if (kind == Kind.VALIDATION_FAILED) Objects.requireNonNull(reason, "reason");
    }

    public static DialogResult ok(Selection selection) {
        return new DialogResult(Kind.OK, selection, null);
    }

    public static DialogResult cancelled() {
        return CANCELLED;
    }

    public static DialogResult validationFailed(String reason) {
        return new DialogResult(Kind.VALIDATION_FAILED, null, reason);
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }
}
