package com.tyron.filepicker.core.view;

import com.tyron.filepicker.api.dialog.DialogMode;
import com.tyron.filepicker.api.dialog.FileFilter;
import com.tyron.filepicker.api.dialog.HiddenFilePolicy;
import com.tyron.filepicker.api.dialog.SearchMode;
import com.tyron.filepicker.api.dialog.SortSpec;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Every input of a projection besides the snapshot. Equal options mean an equal projection.
 */
public record ProjectionOptions(
        HiddenFilePolicy hiddenPolicy,
        DialogMode mode,
        @Nullable FileFilter activeFilter,
        String search,
        SearchMode searchMode,
        SortSpec sort
) {

    public ProjectionOptions {
        Objects.requireNonNull(hiddenPolicy, "hiddenPolicy");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(search, "search");
        Objects.requireNonNull(searchMode, "searchMode");
        Objects.requireNonNull(sort, "sort");
    }

    public static ProjectionOptions defaults(DialogMode mode) {
        return new ProjectionOptions(HiddenFilePolicy.HIDE_DOTFILES, mode, null, "", SearchMode.SUBSTRING, SortSpec.DEFAULT);
    }

    public ProjectionOptions withFilter(@Nullable FileFilter filter) {
        return new ProjectionOptions(hiddenPolicy, mode, filter, search, searchMode, sort);
    }

    public ProjectionOptions withSearch(String text) {
        return new ProjectionOptions(hiddenPolicy, mode, activeFilter, text, searchMode, sort);
    }

    public ProjectionOptions withSort(SortSpec spec) {
        return new ProjectionOptions(hiddenPolicy, mode, activeFilter, search, searchMode, spec);
    }

    public ProjectionOptions withHiddenPolicy(HiddenFilePolicy policy) {
        return new ProjectionOptions(policy, mode, activeFilter, search, searchMode, sort);
    }
}
