package org.dxworks.probconv.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class InlineCode extends LeafNode {

    private final String language;
    private final String code;

    public InlineCode(String language, String code) {
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
        return NodeType.INLINE_CODE;
    }

    @Override
    public Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("language", language);
        attributes.put("code", code);
        return attributes;
    }
}
