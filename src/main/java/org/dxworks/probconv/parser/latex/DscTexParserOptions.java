package org.dxworks.probconv.parser.latex;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Converters that replace or extend the built-in DSCTeX tables, keyed by command name
 * (without the backslash) or environment name.
 */
public final class DscTexParserOptions {

    private static final DscTexParserOptions DEFAULTS = builder().build();

    private final Map<String, CommandConverter> commandConverters;
    private final Map<String, EnvironmentConverter> environmentConverters;

    private DscTexParserOptions(Builder builder) {
        this.commandConverters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.commandConverters));
        this.environmentConverters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.environmentConverters));
    }

    public static DscTexParserOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, CommandConverter> getCommandConverters() {
        return commandConverters;
    }

    public Map<String, EnvironmentConverter> getEnvironmentConverters() {
        return environmentConverters;
    }

    public static final class Builder {
        private final Map<String, CommandConverter> commandConverters = new LinkedHashMap<>();
        private final Map<String, EnvironmentConverter> environmentConverters = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder commandConverter(String name, CommandConverter converter) {
            commandConverters.put(Objects.requireNonNull(name), Objects.requireNonNull(converter));
            return this;
        }

        public Builder environmentConverter(String name, EnvironmentConverter converter) {
            environmentConverters.put(Objects.requireNonNull(name), Objects.requireNonNull(converter));
            return this;
        }

        public DscTexParserOptions build() {
            return new DscTexParserOptions(this);
        }
    }
}
