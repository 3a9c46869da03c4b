package dev.py2flow.serialization;

import dev.py2flow.Py2FlowException;

/**
 * A flow document is malformed. {@link #getPath()} points at the offending
 * node, e.g. {@code $.recipes[2].kind}.
 */
public class SerializationFormatException extends Py2FlowException {

    private static final long serialVersionUID = 1L;

    private final String path;

    public SerializationFormatException(String path, String message) {
        super("%s: %s".formatted(path, message), "SERIALIZATION_FORMAT");
        this.path = path;
    }

    public SerializationFormatException(String path, String message, Throwable cause) {
        super("%s: %s".formatted(path, message), "SERIALIZATION_FORMAT", cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
