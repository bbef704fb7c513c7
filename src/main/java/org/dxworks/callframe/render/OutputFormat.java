package org.dxworks.callframe.render;

import java.util.Locale;
import java.util.Optional;

public enum OutputFormat {
    DOT("dot", ".dot"),
    JSON("json", ".json");

    private final String name;
    private final String extension;

    OutputFormat(String name, String extension) {
        this.name = name;
        this.extension = extension;
    }

    public String getName() {
        return name;
    }

    public String getExtension() {
        return extension;
    }

    public GraphRenderer createRenderer() {
        switch (this) {
            case JSON:
                return new JsonModelRenderer();
            case DOT:
            default:
                return new DotGraphRenderer();
        }
    }

    public static Optional<OutputFormat> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat format : values()) {
            if (format.name.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
