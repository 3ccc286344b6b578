package com.tyron.filepicker.api.dialog;

/**
 * Opaque handle of a dialog owned by a dialog manager.
 */
public record DialogId(long value) {

    @Override
    public String toString() {
        return "dialog-" + value;
    }
}
