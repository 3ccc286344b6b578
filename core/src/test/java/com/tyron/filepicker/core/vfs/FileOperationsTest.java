package com.tyron.filepicker.core.vfs;

import com.tyron.filepicker.api.vfs.ExistingTargetPolicy;
import com.tyron.filepicker.testFramework.vfs.InMemoryFileSystem;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.util.List;

public class FileOperationsTest {

    private static final Path HOME = Path.of("/home");
    private static final Path DEST = Path.of("/dest");

    private InMemoryFileSystem fs;
    private FileOperations operations;

    @BeforeEach
    public void setUp() {
        fs = new InMemoryFileSystem()
                .addFile("/home/a.tar.gz", 3)
                .addFile("/home/notes.txt", 5)
                .addFile("/home/.bashrc", 1)
                .addFile("/home/project/src/Main.java", 7)
                .addDir("/dest");
        operations = new FileOperations(fs);
    }

    @Test
    public void uniqueNameKeepsMultiPartExtension() throws IOException {
        Assertions.assertEquals("free.txt", operations.uniqueChildName(HOME, "free.txt"));
        Assertions.assertEquals("a (copy).tar.gz", operations.uniqueChildName(HOME, "a.tar.gz"));

        fs.addFile("/home/a (copy).tar.gz", 3);
        Assertions.assertEquals("a (copy 2).tar.gz", operations.uniqueChildName(HOME, "a.tar.gz"));

        Assertions.assertEquals(".bashrc (copy)", operations.uniqueChildName(HOME, ".bashrc"));
    }

    @Test
    public void splitKeepsLeadingDot() {
        Assertions.assertArrayEquals(new String[]{"a", ".tar.gz"}, FileOperations.splitBaseAndFullExtension("a.tar.gz"));
        Assertions.assertArrayEquals(new String[]{".bashrc", ""}, FileOperations.splitBaseAndFullExtension(".bashrc"));
        Assertions.assertArrayEquals(new String[]{"README", ""}, FileOperations.splitBaseAndFullExtension("README"));
    }

    @Test
    public void createFolderValidatesName() throws IOException {
        Assertions.assertEquals(HOME.resolve("docs"), operations.createFolder(HOME, "  docs "));
        Assertions.assertTrue(fs.isDirectory(HOME.resolve("docs")));

        Assertions.assertThrows(FileAlreadyExistsException.class, () -> operations.createFolder(HOME, "docs"));
        Assertions.assertThrows(IOException.class, () -> operations.createFolder(HOME, "a/b"));
        Assertions.assertThrows(IOException.class, () -> operations.createFolder(HOME, ".."));
        Assertions.assertThrows(IOException.class, () -> operations.createFolder(HOME, " "));
    }

    @Test
    public void renameStaysInDirectory() throws IOException {
        Assertions.assertEquals(HOME.resolve("todo.txt"), operations.rename(HOME.resolve("notes.txt"), "todo.txt"));
        Assertions.assertFalse(fs.contains(HOME.resolve("notes.txt")));

        Assertions.assertThrows(FileAlreadyExistsException.class,
                () -> operations.rename(HOME.resolve("todo.txt"), "a.tar.gz"));
        Assertions.assertThrows(IOException.class,
                () -> operations.rename(HOME.resolve("todo.txt"), "../escape.txt"));
    }

    @Test
    public void deleteNeedsRecursiveForNonEmptyDirectories() throws IOException {
        Assertions.assertThrows(DirectoryNotEmptyException.class,
                () -> operations.delete(List.of(HOME.resolve("project")), false));

        operations.delete(List.of(HOME.resolve("project"), HOME.resolve("notes.txt")), true);

        Assertions.assertFalse(fs.contains(HOME.resolve("project/src/Main.java")));
        Assertions.assertFalse(fs.contains(HOME.resolve("notes.txt")));
    }

    @Test
    public void copyPasteCopiesTrees() throws IOException {
        FileOperations.PasteResult result = operations.paste(List.of(HOME.resolve("project"), HOME.resolve("notes.txt")),
                DEST, FileOperations.PasteMode.COPY, ExistingTargetPolicy.SKIP);

        Assertions.assertEquals(List.of(DEST.resolve("project"), DEST.resolve("notes.txt")), result.created());
        Assertions.assertTrue(fs.contains(DEST.resolve("project/src/Main.java")));
        Assertions.assertTrue(fs.contains(HOME.resolve("project/src/Main.java")));
    }

    @Test
    public void existingTargetPolicies() throws IOException {
        fs.addFile("/dest/notes.txt", 99);
        List<Path> sources = List.of(HOME.resolve("notes.txt"));

        FileOperations.PasteResult skipped = operations.paste(sources, DEST, FileOperations.PasteMode.COPY, ExistingTargetPolicy.SKIP);
        Assertions.assertEquals(sources, skipped.skipped());
        Assertions.assertTrue(skipped.created().isEmpty());

        FileOperations.PasteResult both = operations.paste(sources, DEST, FileOperations.PasteMode.COPY, ExistingTargetPolicy.KEEP_BOTH);
        Assertions.assertEquals(List.of(DEST.resolve("notes (copy).txt")), both.created());

        FileOperations.PasteResult overwritten = operations.paste(sources, DEST, FileOperations.PasteMode.COPY, ExistingTargetPolicy.OVERWRITE);
        Assertions.assertEquals(List.of(DEST.resolve("notes.txt")), overwritten.created());
        Assertions.assertEquals(5, fs.readDir(DEST).stream()
                .filter(e -> e.getName().equals("notes.txt")).findFirst().orElseThrow().getSize());
    }

    @Test
    public void pasteIntoItselfIsRefused() {
        IOException e = Assertions.assertThrows(IOException.class, () -> operations.paste(
                List.of(HOME.resolve("project")), HOME.resolve("project/src"),
                FileOperations.PasteMode.COPY, ExistingTargetPolicy.KEEP_BOTH));
        Assertions.assertTrue(e.getMessage().contains("into itself"), e.getMessage());
    }

    @Test
    public void copyOntoItselfMakesCopyAndMoveOntoItselfIsSkipped() throws IOException {
        FileOperations.PasteResult copied = operations.paste(List.of(HOME.resolve("notes.txt")), HOME,
                FileOperations.PasteMode.COPY, ExistingTargetPolicy.OVERWRITE);
        Assertions.assertEquals(List.of(HOME.resolve("notes (copy).txt")), copied.created());

        FileOperations.PasteResult moved = operations.paste(List.of(HOME.resolve("notes.txt")), HOME,
                FileOperations.PasteMode.MOVE, ExistingTargetPolicy.OVERWRITE);
        Assertions.assertEquals(List.of(HOME.resolve("notes.txt")), moved.skipped());
        Assertions.assertTrue(fs.contains(HOME.resolve("notes.txt")));
    }

    @Test
    public void movePasteRemovesSource() throws IOException {
        operations.paste(List.of(HOME.resolve("project")), DEST, FileOperations.PasteMode.MOVE, ExistingTargetPolicy.SKIP);

        Assertions.assertTrue(fs.contains(DEST.resolve("project/src/Main.java")));
        Assertions.assertFalse(fs.contains(HOME.resolve("project")));
    }
}
