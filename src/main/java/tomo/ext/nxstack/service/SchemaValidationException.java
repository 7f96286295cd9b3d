package tomo.ext.nxstack.service;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a candidate file is not a genuine projection of the expected facility and
 * experiment type. The file is skipped; the run continues.
 */
public class SchemaValidationException extends IOException {

    private final Path path;

    public SchemaValidationException(Path path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public SchemaValidationException(Path path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
