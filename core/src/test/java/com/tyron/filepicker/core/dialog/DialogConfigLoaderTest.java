package com.tyron.filepicker.core.dialog;

import com.tyron.filepicker.api.dialog.ClickAction;
import com.tyron.filepicker.api.dialog.DialogMode;
import com.tyron.filepicker.api.dialog.ExtensionPolicy;
import com.tyron.filepicker.api.dialog.FileFilter;
import com.tyron.filepicker.api.dialog.HiddenFilePolicy;
import com.tyron.filepicker.api.dialog.SearchMode;
import com.tyron.filepicker.api.dialog.SortBy;
import com.tyron.filepicker.api.dialog.SortSpec;
import com.tyron.filepicker.api.scan.ScanPolicy;
import com.tyron.filepicker.core.thumbnails.ThumbnailCache;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class DialogConfigLoaderTest {

    @TempDir
    Path temp;

    @Test
    public void loadsEveryKnownKey() throws IOException {
        DialogConfig config;
        try (InputStream in = DialogConfigLoaderTest.class.getResourceAsStream("/dialog-config.yaml")) {
            Assertions.assertNotNull(in, "fixture missing");
            config = DialogConfigLoader.load(in).build();
        }

        Assertions.assertEquals(DialogMode.SAVE_FILE, config.mode());
        Assertions.assertEquals(Path.of("/srv/reports"), config.directory());
        Assertions.assertEquals(ScanPolicy.background(128, 2), config.scanPolicy());
        Assertions.assertEquals(1, config.maxSelection());
        Assertions.assertEquals(ClickAction.NAVIGATE, config.clickAction());
        Assertions.assertEquals(HiddenFilePolicy.SHOW, config.hiddenPolicy());
        Assertions.assertEquals(SearchMode.FUZZY, config.searchMode());
        Assertions.assertEquals(new SortSpec(SortBy.MODIFIED, false, true), config.sort());
        Assertions.assertEquals("quarterly", config.saveName());
        Assertions.assertFalse(config.savePolicy().confirmOverwrite());
        Assertions.assertEquals(ExtensionPolicy.OVERWRITE_BY_FILTER, config.savePolicy().extensionPolicy());
        Assertions.assertEquals(List.of(
                FileFilter.of("CSV", "csv", "*.tsv"),
                FileFilter.of("((^report))", "((^report))")), config.filters());
        Assertions.assertEquals(1, config.activeFilter());
        Assertions.assertEquals(64, config.thumbnailMaxEntries());
        Assertions.assertEquals(8, config.thumbnailRequestsPerFrame());
    }

    @Test
    public void minimalConfigUsesDefaults() {
        DialogConfig config = DialogConfigLoader.loadString("mode: open_files\ndirectory: /tmp").build();

        Assertions.assertEquals(DialogMode.OPEN_FILES, config.mode());
        Assertions.assertEquals(ScanPolicy.sync(), config.scanPolicy());
        Assertions.assertEquals(Integer.MAX_VALUE, config.maxSelection());
        Assertions.assertEquals(ClickAction.SELECT, config.clickAction());
        Assertions.assertEquals(HiddenFilePolicy.HIDE_DOTFILES, config.hiddenPolicy());
        Assertions.assertEquals(SortSpec.DEFAULT, config.sort());
        Assertions.assertNull(config.activeFilter());
        Assertions.assertEquals(ThumbnailCache.DEFAULT_MAX_ENTRIES, config.thumbnailMaxEntries());
    }

    @Test
    public void incrementalPolicyFallsBackToDefaultSizes() {
        DialogConfig config = DialogConfigLoader.loadString("mode: open_file\nscan: {policy: incremental}").build();

        Assertions.assertEquals(ScanPolicy.incremental(ScanPolicy.DEFAULT_BATCH_SIZE, ScanPolicy.DEFAULT_MAX_BATCHES_PER_TICK),
                config.scanPolicy());
    }

    @Test
    public void homeDirectoryIsExpanded() {
        DialogConfig config = DialogConfigLoader.loadString("mode: pick_folder\ndirectory: ~/projects").build();

        Assertions.assertEquals(Path.of(System.getProperty("user.home"), "projects"), config.directory());
    }

    @Test
    public void loadsFromFile() throws IOException {
        Path file = temp.resolve("dialog.yaml");
        Files.writeString(file, "mode: open_file\nview: {search: substring}\n");

        Assertions.assertEquals(SearchMode.SUBSTRING, DialogConfigLoader.load(file).build().searchMode());
    }

    @Test
    public void invalidValuesAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> DialogConfigLoader.loadString("directory: /tmp"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> DialogConfigLoader.loadString("mode: browse"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> DialogConfigLoader.loadString("- just\n- a list"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> DialogConfigLoader.loadString("mode: open_file\nselection: {max: many}"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> DialogConfigLoader.loadString("mode: open_file\nview: {showHidden: sometimes}"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> DialogConfigLoader.loadString("mode: open_file\nfilters: [csv]"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> DialogConfigLoader.loadString("mode: open_file\nactiveFilter: 3").build());
    }

    @Test
    public void integersOutsideIntRangeAreRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> DialogConfigLoader.loadString("mode: open_files\nselection: {max: 3000000000}"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> DialogConfigLoader.loadString("mode: open_files\nselection: {max: 99999999999999999999}"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> DialogConfigLoader.loadString("mode: open_files\nselection: {max: 2.5}"));
        Assertions.assertEquals(7,
                DialogConfigLoader.loadString("mode: open_files\nselection: {max: 7}").build().maxSelection());
    }
}
