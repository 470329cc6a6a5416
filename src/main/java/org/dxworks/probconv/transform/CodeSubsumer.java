package org.dxworks.probconv.transform;

import org.dxworks.probconv.model.Code;
import org.dxworks.probconv.model.CodeFile;
import org.dxworks.probconv.model.Problem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Inlines referenced source files: every {@link CodeFile} becomes a {@link Code} holding the
 * file's contents.
 */
public final class CodeSubsumer {

    private static final Logger LOG = LoggerFactory.getLogger(CodeSubsumer.class);

    private CodeSubsumer() {
        // utility class
    }

    /**
     * @param rootDir directory the code file paths are relative to
     * @throws IOException if a referenced file cannot be read
     */
    public static Problem subsumeCode(Problem tree, Path rootDir) throws IOException {
        return TreeRewriter.rewriteLeaves(tree, leaf -> {
            if (!(leaf instanceof CodeFile codeFile)) {
                return leaf;
            }
            Path file = rootDir.resolve(codeFile.getRelativePath());
            String code = Files.readString(file, StandardCharsets.UTF_8);
            LOG.debug("Inlined {} ({} chars)", file, code.length());
            return new Code(codeFile.getLanguage(), code);
        });
    }
}
