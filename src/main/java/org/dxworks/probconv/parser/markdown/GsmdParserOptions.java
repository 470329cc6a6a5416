package org.dxworks.probconv.parser.markdown;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converters that replace or extend the built-in Gradescope Markdown table, keyed by
 * construct name ({@code paragraph}, {@code inline_math}, ...).
 */
public final class GsmdParserOptions {

    private static final GsmdParserOptions DEFAULTS = builder().build();

    private final Map<String, MarkdownConverter> converters;

    private GsmdParserOptions(Builder builder) {
        this.converters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.converters));
    }

    public static GsmdParserOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, MarkdownConverter> getConverters() {
        return converters;
    }

    public static final class Builder {
        private final Map<String, MarkdownConverter> converters = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder converter(String constructName, MarkdownConverter converter) {
            converters.put(Objects.requireNonNull(constructName), Objects.requireNonNull(converter));
            return this;
        }

        public GsmdParserOptions build() {
            return new GsmdParserOptions(this);
        }
    }
}
