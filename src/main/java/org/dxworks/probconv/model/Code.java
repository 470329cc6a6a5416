package org.dxworks.probconv.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A block of source code.
 */
public final class Code extends LeafNode {

    private final String language;
    private final String code;

    public Code(String language, String code) {
        this.language = Objects.requireNonNull(language, "language");
        this.code = Objects.requireNonNull(code, "code");
    }

    /** Language used for syntax highlighting. */
    public String getLanguage() {
        return language;
    }

    public String getCode() {
        return code;
    }

    @Override
    public NodeType getType() {
        return NodeType.CODE;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("language", language);
        attributes.put("code", code);
        return attributes;
    }
}
