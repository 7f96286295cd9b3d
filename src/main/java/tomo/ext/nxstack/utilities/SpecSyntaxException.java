package tomo.ext.nxstack.utilities;

/**
 * Thrown when an identifier range specification or list file is malformed.
 */
public class SpecSyntaxException extends IllegalArgumentException {

    public SpecSyntaxException(String message) {
        super(message);
    }

    public SpecSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
