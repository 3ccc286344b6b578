package com.tyron.filepicker.api.dialog;

import org.jetbrains.annotations.Nullable;

/**
 * Answer of a {@link ConfirmValidator}.
 */
public record ConfirmGate(boolean canConfirm, @Nullable String message) {

    private static final ConfirmGate ALLOW = new ConfirmGate(true, null);

    public static ConfirmGate allow() {
        return ALLOW;
    }

    public static ConfirmGate block(String message) {
        return new ConfirmGate(false, message);
    }
}
