package com.tyron.filepicker.core.view;

import com.tyron.filepicker.api.dialog.DialogMode;
import com.tyron.filepicker.api.dialog.FileFilter;
import com.tyron.filepicker.api.dialog.HiddenFilePolicy;
import com.tyron.filepicker.api.model.EntryId;
import com.tyron.filepicker.api.model.FileMeta;
import com.tyron.filepicker.core.scan.DirSnapshot;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Derives the visible, ordered entry list from a snapshot.
 * <p>
 * The result is memoized by snapshot identity and options: calling {@link #project} again with
 * the same inputs returns the previous list without rebuilding it.
 */
public final class ViewProjector {

    private static final Logger LOG = Logger.getLogger(ViewProjector.class.getName());

    private @Nullable DirSnapshot lastSnapshot;
    private @Nullable ProjectionOptions lastOptions;
    private List<EntryId> lastResult = List.of();

    private @Nullable FileFilter matcherFilter;
    private FilterMatcher matcher = FilterMatcher.all();

    private int rebuildCount;

    public List<EntryId> project(@Nullable DirSnapshot snapshot, ProjectionOptions options) {
        Objects.requireNonNull(options, "options");
        if (snapshot == null) {
            return List.of();
        }
        if (snapshot == lastSnapshot && options.equals(lastOptions)) {
            return lastResult;
        }

        FilterMatcher filter = matcherFor(options.activeFilter());
        SearchMatcher search = SearchMatcher.of(options.search(), options.searchMode());

        List<FileMeta> visible = new ArrayList<>(snapshot.size());
        for (FileMeta meta : snapshot.entries()) {
            if (isVisible(meta, options, filter, search)) {
                visible.add(meta);
            }
        }
        visible.sort(EntryOrdering.comparator(options.sort()));

        List<EntryId> ids = new ArrayList<>(visible.size());
        for (FileMeta meta : visible) {
            ids.add(meta.getId());
        }

        lastSnapshot = snapshot;
        lastOptions = options;
        lastResult = Collections.unmodifiableList(ids);
        rebuildCount++;

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("projected " + ids.size() + "/" + snapshot.size() + " entries of gen " + snapshot.generation());
        }
        return lastResult;
    }

    static boolean isVisible(FileMeta meta, ProjectionOptions options, FilterMatcher filter, SearchMatcher search) {
        if (options.hiddenPolicy() == HiddenFilePolicy.HIDE_DOTFILES && meta.isHidden()) {
            return false;
        }
        if (!isEligible(meta, options.mode(), filter)) {
            return false;
        }
        return search.matches(meta);
    }

    /**
     * Folder pickers show directories only; other modes show directories and matching files.
     */
    public static boolean isEligible(FileMeta meta, DialogMode mode, FilterMatcher filter) {
        if (mode == DialogMode.PICK_FOLDER) {
            return meta.isDirectory();
        }
        return meta.isDirectory() || filter.matches(meta);
    }

    /**
     * Compiled matcher for {@code filter}, reused while the same filter stays active.
     */
    public FilterMatcher matcherFor(@Nullable FileFilter filter) {
        if (!Objects.equals(filter, matcherFilter)) {
            matcher = FilterMatcher.compile(filter);
            matcherFilter = filter;
        }
        return matcher;
    }

    public int rebuildCount() {
        return rebuildCount;
    }
}
