package org.dxworks.probconv;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class ProbconvConfig {

    private static final String CONFIG_FILE_NAME = "probconv-config.yml";
    private static final boolean DEFAULT_INLINE_CODE_FILES = true;
    private static final boolean DEFAULT_COPY_IMAGES = false;

    private final boolean inlineCodeFiles;
    private final boolean copyImages;
    private final String imageDirectory;

    private ProbconvConfig(boolean inlineCodeFiles, boolean copyImages, String imageDirectory) {
        this.inlineCodeFiles = inlineCodeFiles;
        this.copyImages = copyImages;
        this.imageDirectory = imageDirectory;
    }

    /** Replace code file references with the files' contents before rendering. */
    public boolean isInlineCodeFiles() {
        return inlineCodeFiles;
    }

    /** Copy referenced images next to the output file. */
    public boolean isCopyImages() {
        return copyImages;
    }

    /**
     * Directory, relative to the output file, that copied images go to. {@code null} keeps
     * their original relative paths.
     */
    public String getImageDirectory() {
        return imageDirectory;
    }

    public static ProbconvConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static ProbconvConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean effectiveInlineCodeFiles = yamlConfig.inlineCodeFiles != null
                        ? yamlConfig.inlineCodeFiles
                        : DEFAULT_INLINE_CODE_FILES;
                boolean effectiveCopyImages = yamlConfig.copyImages != null
                        ? yamlConfig.copyImages
                        : DEFAULT_COPY_IMAGES;
                String effectiveImageDirectory = yamlConfig.imageDirectory != null && !yamlConfig.imageDirectory.isBlank()
                        ? yamlConfig.imageDirectory.strip()
                        : null;

                return new ProbconvConfig(effectiveInlineCodeFiles, effectiveCopyImages, effectiveImageDirectory);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    public static ProbconvConfig defaults() {
        return new ProbconvConfig(DEFAULT_INLINE_CODE_FILES, DEFAULT_COPY_IMAGES, null);
    }

    public static ProbconvConfig with(boolean inlineCodeFiles, boolean copyImages, String imageDirectory) {
        String effectiveImageDirectory = imageDirectory != null && !imageDirectory.isBlank() ? imageDirectory : null;
        return new ProbconvConfig(inlineCodeFiles, copyImages, effectiveImageDirectory);
    }

    private static class YamlConfig {
        public Boolean inlineCodeFiles;
        public Boolean copyImages;
        public String imageDirectory;
    }
}
