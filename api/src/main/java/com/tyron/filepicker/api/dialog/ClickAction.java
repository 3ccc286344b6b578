package com.tyron.filepicker.api.dialog;

/**
 * What a single click on a directory does.
 */
public enum ClickAction {
    SELECT,
    NAVIGATE
}
