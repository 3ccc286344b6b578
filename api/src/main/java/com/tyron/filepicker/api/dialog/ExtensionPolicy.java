package com.tyron.filepicker.api.dialog;

/**
 * How the save name is combined with the active filter's extension.
 */
public enum ExtensionPolicy {
    /** Use the typed name as is. */
    KEEP_USER,
    /** Append the filter extension when the name has no extension. */
    ADD_IF_MISSING,
    /** Replace the name's last extension with the filter extension. */
    OVERWRITE_BY_FILTER
}
