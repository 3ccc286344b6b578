package com.tyron.filepicker.core.dialog;

import com.tyron.filepicker.api.dialog.ClickAction;
import com.tyron.filepicker.api.dialog.ConfirmValidator;
import com.tyron.filepicker.api.dialog.DialogMode;
import com.tyron.filepicker.api.dialog.FileFilter;
import com.tyron.filepicker.api.dialog.HiddenFilePolicy;
import com.tyron.filepicker.api.dialog.SavePolicy;
import com.tyron.filepicker.api.dialog.SearchMode;
import com.tyron.filepicker.api.dialog.SortSpec;
import com.tyron.filepicker.api.places.PlacesStore;
import com.tyron.filepicker.api.scan.ScanHook;
import com.tyron.filepicker.api.scan.ScanPolicy;
import com.tyron.filepicker.api.scan.ScanRuntime;
import com.tyron.filepicker.api.vfs.FileSystem;
import com.tyron.filepicker.core.style.FileStyleRegistry;
import com.tyron.filepicker.core.thumbnails.ThumbnailCache;
import com.tyron.filepicker.core.vfs.LocalFileSystem;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Immutable configuration of one dialog. Create with {@link #builder(DialogMode)}.
 */
public final class DialogConfig {

    private final DialogMode mode;
    private final Path directory;
    private final FileSystem fileSystem;
    private final ScanPolicy scanPolicy;
    private final @Nullable Function<ScanPolicy, ScanRuntime> runtimeFactory;
    private final @Nullable ScanHook scanHook;
    private final int maxSelection;
    private final ClickAction clickAction;
    private final HiddenFilePolicy hiddenPolicy;
    private final SortSpec sort;
    private final SearchMode searchMode;
    private final List<FileFilter> filters;
    private final @Nullable Integer activeFilter;
    private final SavePolicy savePolicy;
    private final String saveName;
    private final @Nullable ConfirmValidator confirmValidator;
    private final @Nullable PlacesStore placesStore;
    private final FileStyleRegistry styles;
    private final int thumbnailMaxEntries;
    private final int thumbnailRequestsPerFrame;

    private DialogConfig(Builder b) {
        this.mode = b.mode;
        this.directory = b.directory;
        this.fileSystem = b.fileSystem;
        this.scanPolicy = b.scanPolicy;
        this.runtimeFactory = b.runtimeFactory;
        this.scanHook = b.scanHook;
        this.maxSelection = b.maxSelection != null ? b.maxSelection : (b.mode.isMultiSelect() ? Integer.MAX_VALUE : 1);
        this.clickAction = b.clickAction;
        this.hiddenPolicy = b.hiddenPolicy;
        this.sort = b.sort;
        this.searchMode = b.searchMode;
        this.filters = List.copyOf(b.filters);
        this.activeFilter = b.activeFilterSet ? b.activeFilter : (filters.isEmpty() ? null : 0);
        this.savePolicy = b.savePolicy;
        this.saveName = b.saveName;
        this.confirmValidator = b.confirmValidator;
        this.placesStore = b.placesStore;
        this.styles = b.styles != null ? b.styles : new FileStyleRegistry();
        this.thumbnailMaxEntries = b.thumbnailMaxEntries;
        this.thumbnailRequestsPerFrame = b.thumbnailRequestsPerFrame;

        if (maxSelection <= 0) {
            throw new IllegalArgumentException("maxSelection must be positive: " + maxSelection);
        }
        if (activeFilter != null && (activeFilter < 0 || activeFilter >= filters.size())) {
            throw new IllegalArgumentException("activeFilter " + activeFilter + " out of range, " + filters.size() + " filters");
        }
        if (thumbnailMaxEntries <= 0 || thumbnailRequestsPerFrame <= 0) {
            throw new IllegalArgumentException("thumbnail limits must be positive");
        }
    }

    public static Builder builder(DialogMode mode) {
        return new Builder(mode);
    }

    public Builder toBuilder() {
        return new Builder(mode)
                .directory(directory)
                .fileSystem(fileSystem)
                .scanPolicy(scanPolicy)
                .runtimeFactory(runtimeFactory)
                .scanHook(scanHook)
                .maxSelection(maxSelection)
                .clickAction(clickAction)
                .hiddenPolicy(hiddenPolicy)
                .sort(sort)
                .searchMode(searchMode)
                .filters(filters)
                .activeFilter(activeFilter)
                .savePolicy(savePolicy)
                .saveName(saveName)
                .confirmValidator(confirmValidator)
                .placesStore(placesStore)
                .styles(styles)
                .thumbnails(thumbnailMaxEntries, thumbnailRequestsPerFrame);
    }

    public DialogMode mode() {
        return mode;
    }

    public Path directory() {
        return directory;
    }

    public FileSystem fileSystem() {
        return fileSystem;
    }

    public ScanPolicy scanPolicy() {
        return scanPolicy;
    }

    @Nullable
    public Function<ScanPolicy, ScanRuntime> runtimeFactory() {
        return runtimeFactory;
    }

    @Nullable
    public ScanHook scanHook() {
        return scanHook;
    }

    public int maxSelection() {
        return maxSelection;
    }

    public ClickAction clickAction() {
        return clickAction;
    }

    public HiddenFilePolicy hiddenPolicy() {
        return hiddenPolicy;
    }

    public SortSpec sort() {
        return sort;
    }

    public SearchMode searchMode() {
        return searchMode;
    }

    public List<FileFilter> filters() {
        return filters;
    }

    @Nullable
    public Integer activeFilter() {
        return activeFilter;
    }

    public SavePolicy savePolicy() {
        return savePolicy;
    }

    public String saveName() {
        return saveName;
    }

    @Nullable
    public ConfirmValidator confirmValidator() {
        return confirmValidator;
    }

    @Nullable
    public PlacesStore placesStore() {
        return placesStore;
    }

    public FileStyleRegistry styles() {
        return styles;
    }

    public int thumbnailMaxEntries() {
        return thumbnailMaxEntries;
    }

    public int thumbnailRequestsPerFrame() {
        return thumbnailRequestsPerFrame;
    }

    public static final class Builder {
        private final DialogMode mode;
        private Path directory = Path.of(System.getProperty("user.home", "/"));
        private FileSystem fileSystem = LocalFileSystem.getInstance();
        private ScanPolicy scanPolicy = ScanPolicy.sync();
        private @Nullable Function<ScanPolicy, ScanRuntime> runtimeFactory;
        private @Nullable ScanHook scanHook;
        private @Nullable Integer maxSelection;
        private ClickAction clickAction = ClickAction.SELECT;
        private HiddenFilePolicy hiddenPolicy = HiddenFilePolicy.HIDE_DOTFILES;
        private SortSpec sort = SortSpec.DEFAULT;
        private SearchMode searchMode = SearchMode.SUBSTRING;
        private final List<FileFilter> filters = new ArrayList<>();
        private @Nullable Integer activeFilter;
        private boolean activeFilterSet;
        private SavePolicy savePolicy = SavePolicy.DEFAULT;
        private String saveName = "";
        private @Nullable ConfirmValidator confirmValidator;
        private @Nullable PlacesStore placesStore;
        private @Nullable FileStyleRegistry styles;
        private int thumbnailMaxEntries = ThumbnailCache.DEFAULT_MAX_ENTRIES;
        private int thumbnailRequestsPerFrame = ThumbnailCache.DEFAULT_MAX_NEW_REQUESTS_PER_FRAME;

        private Builder(DialogMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
        }

        public DialogMode mode() {
            return mode;
        }

        public Builder directory(Path directory) {
            this.directory = Objects.requireNonNull(directory, "directory");
            return this;
        }

        public Builder fileSystem(FileSystem fileSystem) {
            this.fileSystem = Objects.requireNonNull(fileSystem, "fileSystem");
            return this;
        }

        public Builder scanPolicy(ScanPolicy scanPolicy) {
            this.scanPolicy = Objects.requireNonNull(scanPolicy, "scanPolicy");
            return this;
        }

        /**
         * Overrides how runtimes are created for a policy (tests, custom backends).
         */
        public Builder runtimeFactory(@Nullable Function<ScanPolicy, ScanRuntime> runtimeFactory) {
            this.runtimeFactory = runtimeFactory;
            return this;
        }

        public Builder scanHook(@Nullable ScanHook scanHook) {
            this.scanHook = scanHook;
            return this;
        }

        public Builder maxSelection(int maxSelection) {
            this.maxSelection = maxSelection;
            return this;
        }

        public Builder clickAction(ClickAction clickAction) {
            this.clickAction = Objects.requireNonNull(clickAction, "clickAction");
            return this;
        }

        public Builder hiddenPolicy(HiddenFilePolicy hiddenPolicy) {
            this.hiddenPolicy = Objects.requireNonNull(hiddenPolicy, "hiddenPolicy");
            return this;
        }

        public Builder sort(SortSpec sort) {
            this.sort = Objects.requireNonNull(sort, "sort");
            return this;
        }

        public Builder searchMode(SearchMode searchMode) {
            this.searchMode = Objects.requireNonNull(searchMode, "searchMode");
            return this;
        }

        public Builder filter(FileFilter filter) {
            this.filters.add(Objects.requireNonNull(filter, "filter"));
            return this;
        }

        public Builder filters(List<FileFilter> filters) {
            this.filters.clear();
            this.filters.addAll(filters);
            return this;
        }

        /**
         * Index into the filters; null disables filtering. Defaults to the first filter.
         */
        public Builder activeFilter(@Nullable Integer activeFilter) {
            this.activeFilter = activeFilter;
            this.activeFilterSet = true;
            return this;
        }

        public Builder savePolicy(SavePolicy savePolicy) {
            this.savePolicy = Objects.requireNonNull(savePolicy, "savePolicy");
            return this;
        }

        public Builder saveName(String saveName) {
            this.saveName = Objects.requireNonNull(saveName, "saveName");
            return this;
        }

        public Builder confirmValidator(@Nullable ConfirmValidator confirmValidator) {
            this.confirmValidator = confirmValidator;
            return this;
        }

        public Builder placesStore(@Nullable PlacesStore placesStore) {
            this.placesStore = placesStore;
            return this;
        }

        public Builder styles(@Nullable FileStyleRegistry styles) {
            this.styles = styles;
            return this;
        }

        public Builder thumbnails(int maxEntries, int requestsPerFrame) {
            this.thumbnailMaxEntries = maxEntries;
            this.thumbnailRequestsPerFrame = requestsPerFrame;
            return this;
        }

        public DialogConfig build() {
            return new DialogConfig(this);
        }
    }
}
