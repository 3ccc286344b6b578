package com.tyron.filepicker.api.dialog;

public enum DialogStateKind {
    OPEN,
    /** Save target exists; waiting for the user to accept or decline overwriting it. */
    CONFIRM_OVERWRITE,
    FINISHED
}
