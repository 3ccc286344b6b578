package com.tyron.filepicker.core.view;

import com.tyron.filepicker.api.dialog.SortSpec;
import com.tyron.filepicker.api.model.FileMeta;

import java.util.Comparator;

/**
 * Sorting of visible entries. Equal keys are always broken by {@code EntryId} ascending,
 * regardless of direction, so repeated sorts never reorder ties. Extension order groups by the
 * full extension, so "a.tar.gz" does not sort among plain ".gz" files.
 */
public final class EntryOrdering {

    private static final Comparator<FileMeta> BY_NAME = Comparator.comparing(FileMeta::getNameLower);

    private EntryOrdering() {
    }

    public static Comparator<FileMeta> comparator(SortSpec spec) {
        Comparator<FileMeta> key = switch (spec.by()) {
            case NAME -> BY_NAME;
            case EXTENSION -> Comparator.comparing(FileMeta::getFullExtension).thenComparing(BY_NAME);
            case SIZE -> Comparator.comparingLong(FileMeta::getSize).thenComparing(BY_NAME);
            case MODIFIED -> Comparator.comparingLong(FileMeta::getLastModified).thenComparing(BY_NAME);
        };
        if (!spec.ascending()) {
            key = key.reversed();
        }
        if (spec.directoriesFirst()) {
            key = Comparator.comparing((FileMeta m) -> !m.isDirectory()).thenComparing(key);
        }
        return key.thenComparing(FileMeta::getId);
    }
}
