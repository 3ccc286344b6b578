package com.tyron.filepicker.api.vfs;

/**
 * What a paste does when the destination already has an entry with the same name.
 */
public enum ExistingTargetPolicy {
    /** Replace the existing entry. */
    OVERWRITE,
    /** Leave the existing entry alone and skip the source. */
    SKIP,
    /** Keep both, giving the pasted entry a free " (copy)" name. */
    KEEP_BOTH
}
