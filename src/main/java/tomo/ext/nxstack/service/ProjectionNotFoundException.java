package tomo.ext.nxstack.service;

/**
 * Thrown when no projection matches the requested identifiers.
 */
public class ProjectionNotFoundException extends IllegalStateException {

    public ProjectionNotFoundException(String message) {
        super(message);
    }
}
