package org.dxworks.probconv;

import java.nio.file.Path;
import java.util.Optional;

public class FormatDetector {

    public static Optional<Format> detectFormat(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase();

        if (fileName.endsWith(".tex")) {
            return Optional.of(Format.DSCTEX);
        } else if (fileName.endsWith(".md")) {
            return Optional.of(Format.GSMD);
        } else if (fileName.endsWith(".html") || fileName.endsWith(".htm")) {
            return Optional.of(Format.HTML);
        } else if (fileName.endsWith(".json")) {
            return Optional.of(Format.JSON);
        }

        return Optional.empty();
    }
}
