package com.tyron.filepicker.core.dialog;

import com.tyron.filepicker.api.dialog.DialogId;
import com.tyron.filepicker.api.dialog.DialogResult;
import com.tyron.filepicker.api.model.ViewModel;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registry of independent dialogs addressed by {@link DialogId}.
 * <p>
 * Ids are never reused. A finished dialog's result can be taken exactly once; the host should
 * then {@link #close(DialogId)} it. Dialogs may share a filesystem but nothing else.
 */
public final class DialogManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(DialogManager.class.getName());

    private final Object lock = new Object();
    private final Map<DialogId, FileDialogCore> dialogs = new LinkedHashMap<>();
    private final Set<DialogId> resultTaken = new HashSet<>();
    private long nextId = 1;

    public DialogId open(DialogConfig config) {
        return open(new FileDialogCore(Objects.requireNonNull(config, "config")));
    }

    public DialogId open(FileDialogCore dialog) {
        Objects.requireNonNull(dialog, "dialog");
        DialogId id;
        synchronized (lock) {
            if (dialogs.containsValue(dialog)) {
                throw new IllegalArgumentException("dialog is already managed");
            }
            id = new DialogId(nextId);
            nextId = Math.addExact(nextId, 1);
            dialogs.put(id, dialog);
        }
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("opened " + id + " mode=" + dialog.mode() + " dir=" + dialog.currentDirectory());
        }
        return id;
    }

    public Optional<FileDialogCore> dialog(DialogId id) {
        synchronized (lock) {
            return Optional.ofNullable(dialogs.get(id));
        }
    }

    public boolean contains(DialogId id) {
        synchronized (lock) {
            return dialogs.containsKey(id);
        }
    }

    public List<DialogId> openIds() {
        synchronized (lock) {
            return List.copyOf(dialogs.keySet());
        }
    }

    public Optional<ViewModel> tick(DialogId id) {
        return dialog(id).map(FileDialogCore::tick);
    }

    /**
     * Ticks every open dialog, in opening order.
     */
    public Map<DialogId, ViewModel> tickAll() {
        List<Map.Entry<DialogId, FileDialogCore>> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(dialogs.entrySet());
        }
        Map<DialogId, ViewModel> out = new LinkedHashMap<>();
        for (Map.Entry<DialogId, FileDialogCore> e : snapshot) {
            out.put(e.getKey(), e.getValue().tick());
        }
        return out;
    }

    /**
     * Returns the terminal result of a finished dialog the first time it is asked for; empty
     * afterwards, and while the dialog is still open.
     */
    public Optional<DialogResult> takeResult(DialogId id) {
        synchronized (lock) {
            FileDialogCore dialog = dialogs.get(id);
            if (dialog == null || resultTaken.contains(id)) {
                return Optional.empty();
            }
            Optional<DialogResult> result = dialog.result();
            if (result.isPresent()) {
                resultTaken.add(id);
            }
            return result;
        }
    }

    /**
     * Removes and closes a dialog.
     *
     * @return the closed dialog, or null if the id is unknown
     */
    @Nullable
    public FileDialogCore close(DialogId id) {
        FileDialogCore dialog;
        synchronized (lock) {
            dialog = dialogs.remove(id);
            resultTaken.remove(id);
        }
        if (dialog != null) {
            dialog.close();
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("closed " + id);
            }
        }
        return dialog;
    }

    public void closeAll() {
        for (DialogId id : openIds()) {
            close(id);
        }
    }

    public int size() {
        synchronized (lock) {
            return dialogs.size();
        }
    }

    @Override
    public void close() {
        closeAll();
    }
}
