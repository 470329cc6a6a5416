package org.dxworks.probconv.transform;

import org.dxworks.probconv.model.ImageFile;
import org.dxworks.probconv.model.Problem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Copies the images a tree references next to a converted document.
 */
public final class ImageCopier {

    private static final Logger LOG = LoggerFactory.getLogger(ImageCopier.class);

    private ImageCopier() {
        // utility class
    }

    public static Problem copyImages(Problem tree, Path sourceDir, Path destDir) throws IOException {
        return copyImages(tree, sourceDir, destDir, UnaryOperator.identity());
    }

    /**
     * Copies {@code sourceDir/path} to {@code destDir/pathTransform(path)} for every image,
     * creating missing directories and replacing existing files.
     *
     * @return a copy of {@code tree} whose image paths are the transformed ones
     */
    public static Problem copyImages(Problem tree, Path sourceDir, Path destDir,
                                                        UnaryOperator<String> pathTransform) throws IOException {
        Objects.requireNonNull(pathTransform, "pathTransform");
        return TreeRewriter.rewriteLeaves(tree, leaf -> {
            if (!(leaf instanceof ImageFile image)) {
                return leaf;
            }
            String newPath = pathTransform.apply(image.getRelativePath());
            Path source = sourceDir.resolve(image.getRelativePath());
            Path destination = destDir.resolve(newPath);
            if (destination.getParent() != null) {
                Files.createDirectories(destination.getParent());
            }
            Files.copy(source, destination, StandardCopyOption.REPLACE_EXISTING);
            LOG.debug("Copied image {} to {}", source, destination);
            return image.withRelativePath(newPath);
        });
    }
}
