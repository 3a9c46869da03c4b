package dev.py2flow.export;

import dev.py2flow.Py2FlowException;

import java.nio.file.Path;

/**
 * A bundle export failed. Everything the export had written was removed
 * before this was thrown.
 */
public class BundleExportException extends Py2FlowException {

    private static final long serialVersionUID = 1L;

    private final transient Path destination;

    public BundleExportException(String message, Path destination, Throwable cause) {
        super("Export to %s failed: %s".formatted(destination, message), "BUNDLE_EXPORT", cause);
        this.destination = destination;
    }

    public BundleExportException(String message, Path destination) {
        this(message, destination, null);
    }

    public Path getDestination() {
        return destination;
    }
}
