package com.tyron.filepicker.core.dialog;

import com.tyron.filepicker.api.dialog.ClickAction;
import com.tyron.filepicker.api.dialog.ConfirmGate;
import com.tyron.filepicker.api.dialog.ConfirmValidator;
import com.tyron.filepicker.api.dialog.DialogEvent;
import com.tyron.filepicker.api.dialog.DialogMode;
import com.tyron.filepicker.api.dialog.DialogResult;
import com.tyron.filepicker.api.dialog.FileFilter;
import com.tyron.filepicker.api.dialog.HiddenFilePolicy;
import com.tyron.filepicker.api.dialog.Modifiers;
import com.tyron.filepicker.api.dialog.OperationError;
import com.tyron.filepicker.api.dialog.Selection;
import com.tyron.filepicker.api.dialog.SortSpec;
import com.tyron.filepicker.api.model.EntryId;
import com.tyron.filepicker.api.model.FileMeta;
import com.tyron.filepicker.api.model.SelectionSnapshot;
import com.tyron.filepicker.api.model.ViewModel;
import com.tyron.filepicker.api.places.PlacesStore;
import com.tyron.filepicker.api.scan.ScanPolicy;
import com.tyron.filepicker.api.scan.ScanRuntime;
import com.tyron.filepicker.api.scan.ScanStatus;
import com.tyron.filepicker.api.vfs.ExistingTargetPolicy;
import com.tyron.filepicker.api.vfs.FileSystem;
import com.tyron.filepicker.core.places.Places;
import com.tyron.filepicker.core.places.PlacesCodec;
import com.tyron.filepicker.core.scan.DirSnapshot;
import com.tyron.filepicker.core.scan.EntryIdRegistry;
import com.tyron.filepicker.core.scan.ScanCoordinator;
import com.tyron.filepicker.core.scan.ScanRuntimes;
import com.tyron.filepicker.core.scan.SnapshotStore;
import com.tyron.filepicker.core.selection.SelectionModel;
import com.tyron.filepicker.core.selection.SelectionReconciler;
import com.tyron.filepicker.core.style.FileStyle;
import com.tyron.filepicker.core.style.FileStyleRegistry;
import com.tyron.filepicker.core.thumbnails.ThumbnailCache;
import com.tyron.filepicker.core.view.FilterMatcher;
import com.tyron.filepicker.core.view.ProjectionOptions;
import com.tyron.filepicker.core.view.ViewProjector;
import com.tyron.filepicker.core.vfs.FileOperations;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Headless state machine of one file dialog.
 * <p>
 * The host feeds {@link DialogEvent}s through {@link #handle(DialogEvent)} and calls
 * {@link #tick()} once per frame to apply scan progress and obtain a {@link ViewModel}.
 * Everything runs on the caller's thread; only a background scan runtime owns a thread.
 * <p>
 * States: {@code OPEN -> CONFIRM_OVERWRITE(target) -> FINISHED(result)}. Validation failures
 * and file operation errors are reported on the view model and never change the state.
 */
public final class FileDialogCore implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(FileDialogCore.class.getName());

    private record Clipboard(List<Path> paths, FileOperations.PasteMode mode) {
    }

    private final DialogConfig config;
    private final FileSystem fs;
    private final SnapshotStore store;
    private final ScanCoordinator coordinator;
    private final ViewProjector projector = new ViewProjector();
    private final SelectionModel selection = new SelectionModel();
    private final SelectionReconciler reconciler;
    private final FileOperations operations;
    private final ThumbnailCache thumbnails;
    private final Places places;

    private Path currentDirectory;
    private HiddenFilePolicy hiddenPolicy;
    private @Nullable Integer activeFilter;
    private String search = "";
    private SortSpec sort;
    private String saveName;

    private DialogState state = DialogState.open();
    private @Nullable DialogResult lastValidationFailure;
    private @Nullable OperationError lastOperationError;
    private @Nullable Clipboard clipboard;

    public FileDialogCore(DialogConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.fs = config.fileSystem();
        this.store = new SnapshotStore(new EntryIdRegistry(), config.scanHook());

        Function<ScanPolicy, ScanRuntime> factory = config.runtimeFactory() != null
                ? config.runtimeFactory()
                : ScanRuntimes.factory(fs);
        this.coordinator = new ScanCoordinator(store, factory);
        this.reconciler = new SelectionReconciler(config.maxSelection(), config.mode().isMultiSelect());
        this.operations = new FileOperations(fs);
        this.thumbnails = new ThumbnailCache(config.thumbnailMaxEntries(), config.thumbnailRequestsPerFrame());
        this.places = loadPlaces(config.placesStore());

        this.hiddenPolicy = config.hiddenPolicy();
        this.activeFilter = config.activeFilter();
        this.sort = config.sort();
        this.saveName = config.saveName();

        this.currentDirectory = canonicalOrNormalized(config.directory());
        coordinator.requestScan(currentDirectory, config.scanPolicy());
    }

    private static Places loadPlaces(@Nullable PlacesStore placesStore) {
        if (placesStore == null) {
            return new Places();
        }
        try {
            String text = placesStore.read();
            return text == null ? new Places() : PlacesCodec.decode(text);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "failed to load places, starting empty", e);
            return new Places();
        }
    }

    // --- frame ---

    /**
     * Applies available scan batches, re-projects, reconciles the selection and returns the
     * frame's view model.
     */
    public ViewModel tick() {
        if (!state.isFinished()) {
            coordinator.pollApply();
        }
        thumbnails.beginFrame();
        DirSnapshot snapshot = store.current();
        List<EntryId> visible = projector.project(snapshot, options());
        reconciler.reconcile(selection, snapshot, visible);
        return viewModel(snapshot, visible);
    }

    private ViewModel viewModel(@Nullable DirSnapshot snapshot, List<EntryId> visible) {
        List<FileMeta> metas = new ArrayList<>(visible.size());
        if (snapshot != null) {
            for (EntryId id : visible) {
                FileMeta meta = snapshot.get(id);
                if (meta != null) {
                    metas.add(meta);
                }
            }
        }
        return new ViewModel(
                metas,
                selection.snapshot(),
                coordinator.status(),
                currentDirectory,
                snapshot != null ? snapshot.directory() : null,
                state.kind(),
                state.overwriteTarget(),
                saveName,
                search,
                activeFilter,
                lastValidationFailure != null ? lastValidationFailure.reason() : null,
                lastOperationError,
                places.bookmarks());
    }

    // --- events ---

    public void handle(DialogEvent event) {
        Objects.requireNonNull(event, "event");
        switch (state.kind()) {
            case FINISHED -> {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("dialog finished, ignoring " + event);
                }
            }
            case CONFIRM_OVERWRITE -> handleConfirmOverwrite(event);
            case OPEN -> handleOpen(event);
        }
    }

    private void handleConfirmOverwrite(DialogEvent event) {
        if (event instanceof DialogEvent.ConfirmOverwriteYes) {
            Path target = Objects.requireNonNull(state.overwriteTarget());
            finish(DialogResult.ok(Selection.of(target)));
        } else if (event instanceof DialogEvent.ConfirmOverwriteNo || event instanceof DialogEvent.Cancel) {
            state = DialogState.open();
        } else if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("overwrite confirmation pending, ignoring " + event);
        }
    }

    private void handleOpen(DialogEvent event) {
        if (event instanceof DialogEvent.NavigateInto e) {
            FileMeta meta = resolve(e.id());
            if (meta != null && meta.isDirectory()) {
                navigateTo(meta.getPath());
            }
        } else if (event instanceof DialogEvent.NavigateUp) {
            Path parent = currentDirectory.getParent();
            if (parent != null) {
                navigateTo(parent);
            }
        } else if (event instanceof DialogEvent.NavigateTo e) {
            navigateTo(e.directory());
        } else if (event instanceof DialogEvent.Refresh) {
            coordinator.refresh();
        } else if (event instanceof DialogEvent.ClickEntry e) {
            clickEntry(e.id(), e.modifiers());
        } else if (event instanceof DialogEvent.DoubleClickEntry e) {
            doubleClickEntry(e.id());
        } else if (event instanceof DialogEvent.MoveFocus e) {
            reconciler.moveFocus(selection, visibleIds(), e.delta(), e.modifiers().shift());
            syncSaveNameFromFocus();
        } else if (event instanceof DialogEvent.SelectByPrefix e) {
            DirSnapshot snapshot = store.current();
            if (snapshot != null && reconciler.selectByPrefix(selection, visibleIds(), snapshot, e.prefix())) {
                syncSaveNameFromFocus();
            }
        } else if (event instanceof DialogEvent.SelectAll) {
            reconciler.selectAll(selection, visibleIds());
        } else if (event instanceof DialogEvent.ActivateFocused) {
            activateFocused();
        } else if (event instanceof DialogEvent.SetSearch e) {
            search = e.text();
        } else if (event instanceof DialogEvent.SetSort e) {
            sort = e.sort();
        } else if (event instanceof DialogEvent.SetActiveFilter e) {
            setActiveFilter(e.index());
        } else if (event instanceof DialogEvent.SetShowHidden e) {
            hiddenPolicy = e.show() ? HiddenFilePolicy.SHOW : HiddenFilePolicy.HIDE_DOTFILES;
        } else if (event instanceof DialogEvent.SetSaveName e) {
            saveName = e.name();
            lastValidationFailure = null;
        } else if (event instanceof DialogEvent.Confirm) {
            confirm();
        } else if (event instanceof DialogEvent.Cancel) {
            finish(DialogResult.cancelled());
        } else if (event instanceof DialogEvent.ConfirmOverwriteYes || event instanceof DialogEvent.ConfirmOverwriteNo) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("no overwrite confirmation pending, ignoring " + event);
            }
        } else if (event instanceof DialogEvent.CreateFolder e) {
            runOperation("create folder", currentDirectory.resolve(e.name()),
                    () -> operations.createFolder(currentDirectory, e.name()));
        } else if (event instanceof DialogEvent.RenameEntry e) {
            FileMeta meta = resolve(e.id());
            if (meta != null) {
                runOperation("rename", meta.getPath(), () -> operations.rename(meta.getPath(), e.newName()));
            }
        } else if (event instanceof DialogEvent.DeleteSelected e) {
            List<Path> paths = selectedPaths();
            if (!paths.isEmpty()) {
                runOperation("delete", paths.get(0), () -> operations.delete(paths, e.recursive()));
            }
        } else if (event instanceof DialogEvent.CopySelected) {
            setClipboard(FileOperations.PasteMode.COPY);
        } else if (event instanceof DialogEvent.CutSelected) {
            setClipboard(FileOperations.PasteMode.MOVE);
        } else if (event instanceof DialogEvent.Paste e) {
            paste(e.policy());
        } else if (event instanceof DialogEvent.AddBookmark e) {
            if (places.add(e.label(), e.path())) {
                persistPlaces();
            }
        } else if (event instanceof DialogEvent.RemoveBookmark e) {
            if (places.remove(e.path())) {
                persistPlaces();
            }
        } else {
            throw new IllegalArgumentException("unsupported event: " + event);
        }
    }

    // --- navigation ---

    private void navigateTo(Path directory) {
        Path target = directory.isAbsolute() ? directory : currentDirectory.resolve(directory);
        currentDirectory = canonicalOrNormalized(target);
        selection.reset();
        lastValidationFailure = null;
        coordinator.requestScan(currentDirectory, config.scanPolicy());
    }

    private Path canonicalOrNormalized(Path path) {
        try {
            return fs.canonicalize(path);
        } catch (IOException e) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("cannot canonicalize " + path + ": " + e);
            }
            return path.toAbsolutePath().normalize();
        }
    }

    // --- selection ---

    private void clickEntry(EntryId id, Modifiers modifiers) {
        FileMeta meta = resolve(id);
        if (meta == null || !visibleIds().contains(id)) {
            return;
        }
        if (meta.isDirectory() && modifiers.isNone() && config.clickAction() == ClickAction.NAVIGATE) {
            navigateTo(meta.getPath());
            return;
        }
        if (modifiers.shift()) {
            reconciler.shiftClick(selection, visibleIds(), id);
        } else if (modifiers.ctrl()) {
            reconciler.ctrlClick(selection, id);
        } else {
            reconciler.click(selection, id);
        }
        syncSaveNameFromFocus();
    }

    private void doubleClickEntry(EntryId id) {
        FileMeta meta = resolve(id);
        if (meta == null) {
            return;
        }
        if (meta.isDirectory()) {
            navigateTo(meta.getPath());
            return;
        }
        reconciler.click(selection, id);
        if (config.mode().isSave()) {
            saveName = meta.getName();
        } else {
            confirm();
        }
    }

    private void activateFocused() {
        EntryId focused = selection.focused();
        if (selection.isEmpty() && focused != null && resolve(focused) != null) {
            reconciler.click(selection, focused);
        }
        confirm();
    }

    private void syncSaveNameFromFocus() {
        if (!config.mode().isSave() || selection.size() != 1) {
            return;
        }
        FileMeta meta = resolve(selection.selected().get(0));
        if (meta != null && !meta.isDirectory()) {
            saveName = meta.getName();
        }
    }

    private void setActiveFilter(@Nullable Integer index) {
        if (index != null && (index < 0 || index >= config.filters().size())) {
            throw new IllegalArgumentException("filter index " + index + " out of range, " + config.filters().size() + " filters");
        }
        activeFilter = index;
    }

    // --- confirm ---

    private void confirm() {
        lastValidationFailure = null;
        switch (config.mode()) {
            case OPEN_FILE, OPEN_FILES -> confirmOpen();
            case PICK_FOLDER -> confirmPickFolder();
            case SAVE_FILE -> confirmSave();
        }
    }

    private void confirmOpen() {
        List<FileMeta> selected = selectedMetas();
        if (selected.isEmpty()) {
            return;
        }
        if (selected.size() == 1 && selected.get(0).isDirectory()) {
            navigateTo(selected.get(0).getPath());
            return;
        }
        FilterMatcher matcher = projector.matcherFor(activeFilterOrNull());
        List<Path> files = new ArrayList<>();
        for (FileMeta meta : selected) {
            if (!meta.isDirectory() && matcher.matches(meta)) {
                files.add(meta.getPath());
            }
        }
        if (files.isEmpty()) {
            reject("no file matched filters");
            return;
        }
        finishIfAllowed(files);
    }

    private void confirmPickFolder() {
        List<FileMeta> selected = selectedMetas();
        Path folder = currentDirectory;
        if (selected.size() == 1 && selected.get(0).isDirectory()) {
            folder = selected.get(0).getPath();
        }
        finishIfAllowed(List.of(folder));
    }

    private void confirmSave() {
        String name = saveName.trim();
        String error = SaveTargets.validateName(name);
        if (error != null) {
            reject(error);
            return;
        }
        FileFilter filter = activeFilterOrNull();
        String normalized = SaveTargets.normalize(name, config.savePolicy().extensionPolicy(),
                filter != null ? filter.defaultExtension() : null);
        Path target = currentDirectory.resolve(normalized);

        boolean exists = fs.exists(target);
        if (exists) {
            try {
                if (fs.metadata(target).directory()) {
                    reject(SaveTargets.POINTS_TO_DIRECTORY);
                    return;
                }
            } catch (IOException e) {
                reject("cannot access " + target + ": " + e.getMessage());
                return;
            }
        }
        if (!gateAllows(List.of(target))) {
            return;
        }
        if (exists && config.savePolicy().confirmOverwrite()) {
            state = DialogState.confirmOverwrite(target);
            return;
        }
        finish(DialogResult.ok(Selection.of(target)));
    }

    private void finishIfAllowed(List<Path> paths) {
        if (gateAllows(paths)) {
            finish(DialogResult.ok(new Selection(paths)));
        }
    }

    private boolean gateAllows(List<Path> candidates) {
        ConfirmValidator validator = config.confirmValidator();
        if (validator == null) {
            return true;
        }
        ConfirmGate gate = validator.check(config.mode(), currentDirectory, candidates);
        if (gate.canConfirm()) {
            return true;
        }
        reject(gate.message() != null ? gate.message() : "confirmation blocked");
        return false;
    }

    private void reject(String reason) {
        lastValidationFailure = DialogResult.validationFailed(reason);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("confirm rejected: " + reason);
        }
    }

    private void finish(DialogResult result) {
        state = DialogState.finished(result);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("dialog finished: " + result);
        }
    }

    // --- file operations ---

    @FunctionalInterface
    private interface Operation {
        void run() throws IOException;
    }

    private void runOperation(String name, @Nullable Path path, Operation op) {
        try {
            op.run();
            lastOperationError = null;
            coordinator.refresh();
        } catch (IOException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            lastOperationError = new OperationError(name, path, message);
            LOG.warning(name + " failed for " + path + ": " + message);
        }
    }

    private void setClipboard(FileOperations.PasteMode mode) {
        List<Path> paths = selectedPaths();
        clipboard = paths.isEmpty() ? null : new Clipboard(paths, mode);
    }

    private void paste(ExistingTargetPolicy policy) {
        Clipboard clip = clipboard;
        if (clip == null) {
            return;
        }
        runOperation("paste", currentDirectory, () -> {
            operations.paste(clip.paths(), currentDirectory, clip.mode(), policy);
            if (clip.mode() == FileOperations.PasteMode.MOVE) {
                clipboard = null;
            }
        });
    }

    private void persistPlaces() {
        PlacesStore placesStore = config.placesStore();
        if (placesStore == null) {
            return;
        }
        try {
            placesStore.write(PlacesCodec.encode(places));
        } catch (IOException e) {
            lastOperationError = new OperationError("save places", null, String.valueOf(e.getMessage()));
            LOG.log(Level.WARNING, "failed to persist places", e);
        }
    }

    // --- thumbnails and styles ---

    /**
     * Requests thumbnails for the visible files in {@code [from, to)}.
     */
    public void requestThumbnails(int from, int to, int maxSize) {
        DirSnapshot snapshot = store.current();
        if (snapshot == null) {
            return;
        }
        List<EntryId> visible = visibleIds();
        int end = Math.min(to, visible.size());
        for (int i = Math.max(0, from); i < end; i++) {
            FileMeta meta = snapshot.get(visible.get(i));
            if (meta != null && !meta.isDirectory()) {
                thumbnails.request(meta.getPath(), maxSize);
            }
        }
    }

    @Nullable
    public FileStyle styleFor(FileMeta meta) {
        return config.styles().styleFor(meta);
    }

    // --- queries ---

    private ProjectionOptions options() {
        return new ProjectionOptions(hiddenPolicy, config.mode(), activeFilterOrNull(), search, config.searchMode(), sort);
    }

    @Nullable
    private FileFilter activeFilterOrNull() {
        return activeFilter == null ? null : config.filters().get(activeFilter);
    }

    private List<EntryId> visibleIds() {
        return projector.project(store.current(), options());
    }

    @Nullable
    private FileMeta resolve(EntryId id) {
        DirSnapshot snapshot = store.current();
        return snapshot == null ? null : snapshot.get(id);
    }

    private List<FileMeta> selectedMetas() {
        List<FileMeta> out = new ArrayList<>();
        for (EntryId id : selection.selected()) {
            FileMeta meta = resolve(id);
            if (meta != null) {
                out.add(meta);
            }
        }
        return out;
    }

    private List<Path> selectedPaths() {
        List<Path> out = new ArrayList<>();
        for (FileMeta meta : selectedMetas()) {
            out.add(meta.getPath());
        }
        return out;
    }

    /**
     * Visible entries as of the current snapshot and view settings.
     */
    public List<FileMeta> visibleEntries() {
        List<FileMeta> out = new ArrayList<>();
        for (EntryId id : visibleIds()) {
            FileMeta meta = resolve(id);
            if (meta != null) {
                out.add(meta);
            }
        }
        return out;
    }

    /**
     * Looks up a visible entry by display name.
     */
    public Optional<FileMeta> findVisible(String name) {
        for (FileMeta meta : visibleEntries()) {
            if (meta.getName().equals(name)) {
                return Optional.of(meta);
            }
        }
        return Optional.empty();
    }

    public DialogState state() {
        return state;
    }

    public boolean isFinished() {
        return state.isFinished();
    }

    /**
     * Terminal result, present once the dialog finished. Not consumed by reading.
     */
    public Optional<DialogResult> result() {
        return Optional.ofNullable(state.result());
    }

    /**
     * Reason of the last rejected confirm, cleared by the next confirm or name edit.
     */
    public Optional<DialogResult> lastValidationFailure() {
        return Optional.ofNullable(lastValidationFailure);
    }

    @Nullable
    public OperationError lastOperationError() {
        return lastOperationError;
    }

    public SelectionSnapshot selection() {
        return selection.snapshot();
    }

    public Path currentDirectory() {
        return currentDirectory;
    }

    public ScanStatus scanStatus() {
        return coordinator.status();
    }

    public String saveName() {
        return saveName;
    }

    public DialogMode mode() {
        return config.mode();
    }

    public DialogConfig config() {
        return config;
    }

    public ScanCoordinator coordinator() {
        return coordinator;
    }

    public ViewProjector projector() {
        return projector;
    }

    public ThumbnailCache thumbnails() {
        return thumbnails;
    }

    public Places places() {
        return places;
    }

    public FileStyleRegistry styles() {
        return config.styles();
    }

    @Override
    public void close() {
        coordinator.close();
        thumbnails.clear();
    }
}
