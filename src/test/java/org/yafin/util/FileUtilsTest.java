package org.yafin.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testFindFiles_recursesAndIgnoresDirectories() throws IOException {
        Path base = tempDir.resolve("base");
        Files.createDirectories(base.resolve("a/b"));
        Files.createFile(base.resolve("top.tif"));
        Files.createFile(base.resolve("a/mid.png"));
        Files.createFile(base.resolve("a/b/deep.jpg"));

        List<Path> files = FileUtils.findFiles(base);
        assertEquals(3, files.size(), "Should find all files in the tree.");
        assertTrue(files.contains(base.resolve("a/b/deep.jpg")));
        assertFalse(files.contains(base.resolve("a")), "Directories must not be listed.");
    }

    @Test
    void testFindFiles_baseDirDoesNotExist() {
        assertThrows(IOException.class, () -> FileUtils.findFiles(tempDir.resolve("missing")));
    }

    @Test
    void testExtensionOf() {
        assertEquals(".tif", FileUtils.extensionOf(Paths.get("x/IMG.TIF")));
        assertEquals(".jpeg", FileUtils.extensionOf(Paths.get("photo.tar.jpeg")));
        assertEquals("", FileUtils.extensionOf(Paths.get("README")));
        assertEquals("", FileUtils.extensionOf(Paths.get(".hidden")));
    }

    @Test
    void testBaseName_stripsOnlyTheFileExtension() {
        assertEquals("sub/dir/img", FileUtils.baseName(Paths.get("sub", "dir", "img.tiff")));
        assertEquals("v1.2/img", FileUtils.baseName(Paths.get("v1.2", "img")));
        assertEquals("img.raw", FileUtils.baseName(Paths.get("img.raw.png")));
    }

    @Test
    void testDeleteRecursively() throws IOException {
        Path root = tempDir.resolve("out");
        Files.createDirectories(root.resolve("x/y"));
        Files.writeString(root.resolve("x/y/f.txt"), "data");

        FileUtils.deleteRecursively(root);
        assertFalse(Files.exists(root));
        // missing path is a no-op
        FileUtils.deleteRecursively(root);
    }
}
