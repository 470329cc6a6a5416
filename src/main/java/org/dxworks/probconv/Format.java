package org.dxworks.probconv;

public enum Format {
    DSCTEX("dsctex", ".tex", true, true),
    GSMD("gsmd", ".md", true, true),
    HTML("html", ".html", false, true),
    JSON("json", ".json", false, true);

    private final String name;
    private final String extension;
    private final boolean readable;
    private final boolean writable;

    Format(String name, String extension, boolean readable, boolean writable) {
        this.name = name;
        this.extension = extension;
        this.readable = readable;
        this.writable = writable;
    }

    public String getName() {
        return name;
    }

    public String getExtension() {
        return extension;
    }

    /** True if there is a parser for this format. */
    public boolean isReadable() {
        return readable;
    }

    public boolean isWritable() {
        return writable;
    }
}
