package com.tyron.filepicker.api.model;

import com.tyron.filepicker.api.dialog.DialogStateKind;
import com.tyron.filepicker.api.dialog.OperationError;
import com.tyron.filepicker.api.places.Bookmark;
import com.tyron.filepicker.api.scan.ScanStatus;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.List;

/**
 * Everything a host needs to render one frame of a dialog.
 *
 * @param currentDirectory  the directory the user navigated to
 * @param snapshotDirectory the directory the visible entries were listed from; differs from
 *                          {@code currentDirectory} until the new scan completes
 * @param overwriteTarget   pending target while in {@link DialogStateKind#CONFIRM_OVERWRITE}
 */
public record ViewModel(
        List<FileMeta> visibleEntries,
        SelectionSnapshot selection,
        ScanStatus scanStatus,
        Path currentDirectory,
        @Nullable Path snapshotDirectory,
        DialogStateKind state,
        @Nullable Path overwriteTarget,
        String saveName,
        String search,
        @Nullable Integer activeFilter,
        @Nullable String validationError,
        @Nullable OperationError lastOperationError,
        List<Bookmark> places
) {

    public ViewModel {
        visibleEntries = List.copyOf(visibleEntries);
        places = List.copyOf(places);
    }
}
