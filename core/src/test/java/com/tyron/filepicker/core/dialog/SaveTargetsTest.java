package com.tyron.filepicker.core.dialog;

import com.tyron.filepicker.api.dialog.ExtensionPolicy;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class SaveTargetsTest {

    @Test
    public void validateName() {
        Assertions.assertEquals(SaveTargets.EMPTY_NAME, SaveTargets.validateName(""));
        Assertions.assertEquals(SaveTargets.INVALID_CHARACTERS, SaveTargets.validateName("a/b"));
        Assertions.assertEquals(SaveTargets.INVALID_CHARACTERS, SaveTargets.validateName("what?"));
        Assertions.assertEquals(SaveTargets.INVALID_CHARACTERS, SaveTargets.validateName(".."));
        Assertions.assertEquals(SaveTargets.INVALID_CHARACTERS, SaveTargets.validateName("tab\there"));
        Assertions.assertNull(SaveTargets.validateName("report 2024.csv"));
        Assertions.assertNull(SaveTargets.validateName(".profile"));
    }

    @Test
    public void addIfMissing() {
        Assertions.assertEquals("report.csv", SaveTargets.normalize("report", ExtensionPolicy.ADD_IF_MISSING, "csv"));
        Assertions.assertEquals("report.txt", SaveTargets.normalize("report.txt", ExtensionPolicy.ADD_IF_MISSING, "csv"));
        Assertions.assertEquals(".profile.csv", SaveTargets.normalize(".profile", ExtensionPolicy.ADD_IF_MISSING, "csv"));
        Assertions.assertEquals("report", SaveTargets.normalize("report", ExtensionPolicy.ADD_IF_MISSING, null));
    }

    @Test
    public void overwriteByFilterReplacesLastExtension() {
        Assertions.assertEquals("report.csv", SaveTargets.normalize("report.txt", ExtensionPolicy.OVERWRITE_BY_FILTER, "csv"));
        Assertions.assertEquals("a.tar.zip", SaveTargets.normalize("a.tar.gz", ExtensionPolicy.OVERWRITE_BY_FILTER, "zip"));
        Assertions.assertEquals("report.csv", SaveTargets.normalize("report", ExtensionPolicy.OVERWRITE_BY_FILTER, "csv"));
    }

    @Test
    public void keepUserLeavesNameAlone() {
        Assertions.assertEquals("report", SaveTargets.normalize("report", ExtensionPolicy.KEEP_USER, "csv"));
    }
}
