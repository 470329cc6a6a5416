package org.dxworks.probconv.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Block-level image, referenced by a path relative to the problem's directory.
 */
public final class ImageFile extends LeafNode {

    private final String relativePath;

    public ImageFile(String relativePath) {
        this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
    }

    public String getRelativePath() {
        return relativePath;
    }

    public ImageFile withRelativePath(String newPath) {
        return new ImageFile(newPath);
    }

    @Override
    public NodeType getType() {
        return NodeType.IMAGE_FILE;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("relativePath", relativePath);
        return attributes;
    }
}
