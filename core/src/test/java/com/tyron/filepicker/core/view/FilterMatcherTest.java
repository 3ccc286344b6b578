package com.tyron.filepicker.core.view;

import com.tyron.filepicker.api.dialog.FileFilter;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class FilterMatcherTest {

    @Test
    public void plainExtensionIsCaseInsensitive() {
        FilterMatcher matcher = FilterMatcher.compile(FileFilter.of("Images", "PNG", ".jpg"));

        Assertions.assertTrue(matcher.matchesName("photo.png"));
        Assertions.assertTrue(matcher.matchesName("Photo.JPG"));
        Assertions.assertFalse(matcher.matchesName("photo.gif"));
        Assertions.assertFalse(matcher.matchesName("png"));
    }

    @Test
    public void multiLayerExtensionNeedsStem() {
        FilterMatcher matcher = FilterMatcher.compile(FileFilter.of("Archives", "tar.gz"));

        Assertions.assertTrue(matcher.matchesName("backup.tar.gz"));
        Assertions.assertFalse(matcher.matchesName("backup.gz"));
        Assertions.assertFalse(matcher.matchesName(".tar.gz"));

        Assertions.assertTrue(FilterMatcher.compile(FileFilter.of("Gzip", "gz")).matchesName("backup.tar.gz"));
    }

    @Test
    public void wildcardMatchesWholeName() {
        FilterMatcher matcher = FilterMatcher.compile(FileFilter.of("Reports", "report-??.csv"));

        Assertions.assertTrue(matcher.matchesName("report-01.csv"));
        Assertions.assertTrue(matcher.matchesName("REPORT-AB.CSV"));
        Assertions.assertFalse(matcher.matchesName("report-1.csv"));
        Assertions.assertFalse(matcher.matchesName("old-report-01.csv"));
        Assertions.assertTrue(FilterMatcher.compile(FileFilter.of("Text", "*.txt")).matchesName("a.b.txt"));
    }

    @Test
    public void regexTokenIsSearchedCaseInsensitively() {
        FilterMatcher matcher = FilterMatcher.compile(FileFilter.of("Camera", "((^img_\\d+\\.jpe?g$))"));

        Assertions.assertTrue(matcher.matchesName("IMG_12.JPG"));
        Assertions.assertTrue(matcher.matchesName("img_3.jpeg"));
        Assertions.assertFalse(matcher.matchesName("my_img_3.jpg"));
    }

    @Test
    public void invalidRegexMatchesNothingButOtherTokensStillWork() {
        FilterMatcher matcher = FilterMatcher.compile(FileFilter.of("Mixed", "(([unclosed))", "txt"));

        Assertions.assertTrue(matcher.matchesName("notes.txt"));
        Assertions.assertFalse(matcher.matchesName("[unclosed"));
        Assertions.assertFalse(matcher.isMatchAll());
    }

    @Test
    public void starTokensAndEmptyFiltersMatchEverything() {
        Assertions.assertTrue(FilterMatcher.compile(FileFilter.of("All", "*")).isMatchAll());
        Assertions.assertTrue(FilterMatcher.compile(FileFilter.of("All", "txt", "*.*")).isMatchAll());
        Assertions.assertTrue(FilterMatcher.compile(FileFilter.of("None")).isMatchAll());
        Assertions.assertTrue(FilterMatcher.compile(null).matchesName("anything"));
    }

    @Test
    public void defaultExtensionPicksFirstUsableToken() {
        Assertions.assertEquals("csv", FileFilter.of("CSV", "*.csv").defaultExtension());
        Assertions.assertEquals("csv", FileFilter.of("CSV", ".CSV").defaultExtension());
        Assertions.assertEquals("tar.gz", FileFilter.of("Archive", "((x))", "tar.gz").defaultExtension());
        Assertions.assertNull(FileFilter.of("All", "*").defaultExtension());
    }
}
