package org.dxworks.probconv;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class TestUtils {
    public static final Path SAMPLES = Paths.get("src/test/resources/samples");

    public static String readSample(String relativePath) throws IOException {
        return Files.readString(SAMPLES.resolve(relativePath), StandardCharsets.UTF_8);
    }
}
