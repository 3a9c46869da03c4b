package dev.py2flow.render;

import java.util.Locale;

/**
 * Diagram formats a flow can be rendered to.
 */
public enum RenderFormat {
    ASCII("ascii", "txt"),
    SVG("svg", "svg"),
    HTML("html", "html"),
    MERMAID("mermaid", "mmd"),
    PLANTUML("plantuml", "puml");

    private final String value;
    private final String extension;

    RenderFormat(String value, String extension) {
        this.value = value;
        this.extension = extension;
    }

    public String value() {
        return value;
    }

    /** File extension without the dot. */
    public String extension() {
        return extension;
    }

    /** True for formats that need an acyclic flow to assign layers. */
    public boolean isLayered() {
        return this == ASCII || this == SVG || this == HTML;
    }

    /**
     * Parse a format name, case-insensitively. {@code interactive} is an alias
     * for {@code html} and {@code text} for {@code ascii}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static RenderFormat fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Format name must not be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "interactive":
                return HTML;
            case "text":
                return ASCII;
            default:
                for (RenderFormat format : values()) {
                    if (format.value.equals(normalized)) {
                        return format;
                    }
                }
                throw new IllegalArgumentException("Unknown format: " + name);
        }
    }
}
