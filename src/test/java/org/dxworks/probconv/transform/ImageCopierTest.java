package org.dxworks.probconv.transform;

import org.dxworks.probconv.model.Choice;
import org.dxworks.probconv.model.ImageFile;
import org.dxworks.probconv.model.MultipleChoice;
import org.dxworks.probconv.model.Paragraph;
import org.dxworks.probconv.model.Problem;
import org.dxworks.probconv.model.Text;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ImageCopierTest {

    @TempDir
    Path tempDir;

    @Test
    void copiesImagesFromDistinctDirectories() throws Exception {
        Path source = tempDir.resolve("source");
        Path destination = tempDir.resolve("destination");
        byte[] first = {1, 2, 3, 4};
        byte[] second = {9, 8, 7};
        write(source.resolve("figures/a.png"), first);
        write(source.resolve("other/b.png"), second);

        Problem problem = new Problem(
                new Paragraph(new Text("See:")),
                new ImageFile("figures/a.png"),
                new MultipleChoice(new Choice(true, new ImageFile("other/b.png"))));

        Problem copied = ImageCopier.copyImages(problem, source, destination, path -> "img/" + path);

        assertArrayEquals(first, Files.readAllBytes(destination.resolve("img/figures/a.png")));
        assertArrayEquals(second, Files.readAllBytes(destination.resolve("img/other/b.png")));
        assertEquals(new Problem(
                new Paragraph(new Text("See:")),
                new ImageFile("img/figures/a.png"),
                new MultipleChoice(new Choice(true, new ImageFile("img/other/b.png")))), copied);
    }

    @Test
    void identityTransformKeepsPaths() throws Exception {
        Path source = tempDir.resolve("source");
        Path destination = tempDir.resolve("destination");
        write(source.resolve("a.png"), new byte[]{42});
        Problem problem = new Problem(new ImageFile("a.png"));

        Problem copied = ImageCopier.copyImages(problem, source, destination);

        assertEquals(problem, copied);
        assertArrayEquals(new byte[]{42}, Files.readAllBytes(destination.resolve("a.png")));
    }

    @Test
    void replacesExistingFiles() throws Exception {
        Path source = tempDir.resolve("source");
        Path destination = tempDir.resolve("destination");
        write(source.resolve("a.png"), new byte[]{1});
        write(destination.resolve("a.png"), new byte[]{2, 2});

        ImageCopier.copyImages(new Problem(new ImageFile("a.png")), source, destination);

        assertArrayEquals(new byte[]{1}, Files.readAllBytes(destination.resolve("a.png")));
    }

    @Test
    void missingImagePropagatesIoError() {
        Problem problem = new Problem(new ImageFile("missing.png"));

        assertThrows(NoSuchFileException.class,
                () -> ImageCopier.copyImages(problem, tempDir, tempDir.resolve("out")));
    }

    private static void write(Path file, byte[] content) throws Exception {
        Files.createDirectories(file.getParent());
        Files.write(file, content);
    }
}
