package org.dxworks.probconv;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProbconvConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        ProbconvConfig config = ProbconvConfig.load(tempDir.resolve("probconv-config.yml"));

        assertTrue(config.isInlineCodeFiles());
        assertFalse(config.isCopyImages());
        assertNull(config.getImageDirectory());
    }

    @Test
    void readsYamlKeys() throws Exception {
        Path file = tempDir.resolve("probconv-config.yml");
        Files.writeString(file, "inlineCodeFiles: false\ncopyImages: true\nimageDirectory: images\n");

        ProbconvConfig config = ProbconvConfig.load(file);

        assertFalse(config.isInlineCodeFiles());
        assertTrue(config.isCopyImages());
        assertEquals("images", config.getImageDirectory());
    }

    @Test
    void absentKeysKeepDefaults() throws Exception {
        Path file = tempDir.resolve("probconv-config.yml");
        Files.writeString(file, "copyImages: true\n");

        ProbconvConfig config = ProbconvConfig.load(file);

        assertTrue(config.isInlineCodeFiles());
        assertTrue(config.isCopyImages());
        assertNull(config.getImageDirectory());
    }

    @Test
    void unreadableFileGivesDefaults() throws Exception {
        Path file = tempDir.resolve("probconv-config.yml");
        Files.writeString(file, "copyImages: [not, a, boolean\n");

        ProbconvConfig config = ProbconvConfig.load(file);

        assertTrue(config.isInlineCodeFiles());
        assertFalse(config.isCopyImages());
    }

    @Test
    void withTreatsBlankDirectoryAsNone() {
        assertNull(ProbconvConfig.with(true, true, " ").getImageDirectory());
        assertEquals("img", ProbconvConfig.with(true, true, "img").getImageDirectory());
    }
}
