package org.dxworks.probconv.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reference to a source file whose contents should be shown as a code block.
 *
 * @see org.dxworks.probconv.transform.CodeSubsumer
 */
public final class CodeFile extends LeafNode {

    private final String language;
    private final String relativePath;

    public CodeFile(String language, String relativePath) {
        this.language = Objects.requireNonNull(language, "language");
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
    }

    public String getLanguage() {
        return language;
    }

    public String getRelativePath() {
        return relativePath;
    }

    @Override
    public NodeType getType() {
        return NodeType.CODE_FILE;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("language", language);
        attributes.put("relativePath", relativePath);
        return attributes;
    }
}
