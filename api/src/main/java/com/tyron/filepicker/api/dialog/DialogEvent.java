package com.tyron.filepicker.api.dialog;

import com.tyron.filepicker.api.model.EntryId;
import com.tyron.filepicker.api.vfs.ExistingTargetPolicy;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Input translated by the host from raw pointer/keyboard interaction.
 */
public interface DialogEvent {

    // navigation

    record NavigateInto(EntryId id) implements DialogEvent {
        public NavigateInto {
            Objects.requireNonNull(id, "id");
        }
    }

    record NavigateUp() implements DialogEvent {
    }

    record NavigateTo(Path directory) implements DialogEvent {
        public NavigateTo {
            Objects.requireNonNull(directory, "directory");
        }
    }

    record Refresh() implements DialogEvent {
    }

    // selection

    record ClickEntry(EntryId id, Modifiers modifiers) implements DialogEvent {
        public ClickEntry {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(modifiers, "modifiers");
        }
    }

    record DoubleClickEntry(EntryId id) implements DialogEvent {
        public DoubleClickEntry {
            Objects.requireNonNull(id, "id");
        }
    }

    record MoveFocus(int delta, Modifiers modifiers) implements DialogEvent {
        public MoveFocus {
            Objects.requireNonNull(modifiers, "modifiers");
        }
    }

    record SelectByPrefix(String prefix) implements DialogEvent {
        public SelectByPrefix {
            Objects.requireNonNull(prefix, "prefix");
        }
    }

    record SelectAll() implements DialogEvent {
    }

    /** Enter on the focused entry: opens directories, confirms files. */
    record ActivateFocused() implements DialogEvent {
    }

    // view

    record SetSearch(String text) implements DialogEvent {
        public SetSearch {
            Objects.requireNonNull(text, "text");
        }
    }

    record SetSort(SortSpec sort) implements DialogEvent {
        public SetSort {
            Objects.requireNonNull(sort, "sort");
        }
    }

    /**
     * @param index index into the configured filters, or null for no filtering
     */
    record SetActiveFilter(@Nullable Integer index) implements DialogEvent {
    }

    record SetShowHidden(boolean show) implements DialogEvent {
    }

    record SetSaveName(String name) implements DialogEvent {
        public SetSaveName {
            Objects.requireNonNull(name, "name");
        }
    }

    // state machine

    record Confirm() implements DialogEvent {
    }

    record Cancel() implements DialogEvent {
    }

    record ConfirmOverwriteYes() implements DialogEvent {
    }

    record ConfirmOverwriteNo() implements DialogEvent {
    }

    // file operations

    record CreateFolder(String name) implements DialogEvent {
        public CreateFolder {
            Objects.requireNonNull(name, "name");
        }
    }

    record RenameEntry(EntryId id, String newName) implements DialogEvent {
        public RenameEntry {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(newName, "newName");
        }
    }

    record DeleteSelected(boolean recursive) implements DialogEvent {
    }

    record CopySelected() implements DialogEvent {
    }

    record CutSelected() implements DialogEvent {
    }

    record Paste(ExistingTargetPolicy policy) implements DialogEvent {
        public Paste {
            Objects.requireNonNull(policy, "policy");
        }
    }

    // places

    record AddBookmark(String label, Path path) implements DialogEvent {
        public AddBookmark {
            Objects.requireNonNull(label, "label");
            Objects.requireNonNull(path, "path");
        }
    }

    record RemoveBookmark(Path path) implements DialogEvent {
        public RemoveBookmark {
            Objects.requireNonNull(path, "path");
        }
    }
}
