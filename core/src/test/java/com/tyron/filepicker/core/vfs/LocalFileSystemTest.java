package com.tyron.filepicker.core.vfs;

import com.tyron.filepicker.api.vfs.DirectoryCursor;
import com.tyron.filepicker.api.vfs.FsEntry;
import com.tyron.filepicker.api.vfs.FsMetadata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class LocalFileSystemTest {

    @TempDir
    Path temp;

    private final LocalFileSystem fs = LocalFileSystem.getInstance();

    @Test
    public void readDirReportsKindAndSize() throws IOException {
        Files.writeString(temp.resolve("hello.txt"), "hello");
        Files.createDirectory(temp.resolve("dir"));

        Map<String, FsEntry> byName = new HashMap<>();
        for (FsEntry entry : fs.readDir(temp)) {
            byName.put(entry.getName(), entry);
        }

        Assertions.assertEquals(2, byName.size());
        Assertions.assertEquals(5, byName.get("hello.txt").getSize());
        Assertions.assertFalse(byName.get("hello.txt").isDirectory());
        Assertions.assertTrue(byName.get("dir").isDirectory());
        Assertions.assertEquals(-1, byName.get("dir").getSize());
        Assertions.assertEquals(temp.resolve("hello.txt"), byName.get("hello.txt").getPath());
    }

    @Test
    public void cursorReadsInChunks() throws IOException {
        for (int i = 0; i < 7; i++) {
            Files.writeString(temp.resolve("f" + i), "");
        }

        int total = 0;
        try (DirectoryCursor cursor = fs.openDir(temp)) {
            List<FsEntry> chunk;
            while (!(chunk = cursor.next(3)).isEmpty()) {
                Assertions.assertTrue(chunk.size() <= 3);
                total += chunk.size();
            }
        }
        Assertions.assertEquals(7, total);
    }

    @Test
    public void missingPathsThrowNoSuchFile() {
        Path missing = temp.resolve("missing");

        Assertions.assertThrows(NoSuchFileException.class, () -> fs.readDir(missing));
        Assertions.assertThrows(NoSuchFileException.class, () -> fs.metadata(missing));
        Assertions.assertThrows(NoSuchFileException.class, () -> fs.canonicalize(missing));
        Assertions.assertFalse(fs.exists(missing));
    }

    @Test
    public void mutationsRoundTrip() throws IOException {
        Path dir = temp.resolve("a");
        fs.createDir(dir);
        Files.writeString(dir.resolve("x.txt"), "abc");
        Assertions.assertEquals(new FsMetadata(true, false), fs.metadata(dir));

        Assertions.assertEquals(3, fs.copyFile(dir.resolve("x.txt"), temp.resolve("y.txt")));
        fs.rename(temp.resolve("y.txt"), temp.resolve("z.txt"));
        Assertions.assertTrue(fs.exists(temp.resolve("z.txt")));

        Assertions.assertThrows(IOException.class, () -> fs.removeFile(dir));
        Assertions.assertThrows(IOException.class, () -> fs.removeDir(dir));
        fs.removeDirAll(dir);
        fs.removeFile(temp.resolve("z.txt"));

        Assertions.assertTrue(fs.readDir(temp).isEmpty());
    }

    @Test
    public void canonicalizeNormalizes() throws IOException {
        Files.createDirectory(temp.resolve("a"));

        Assertions.assertEquals(temp.toRealPath().resolve("a"), fs.canonicalize(temp.resolve("a/../a/.")));
    }
}
