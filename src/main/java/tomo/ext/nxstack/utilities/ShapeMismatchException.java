package tomo.ext.nxstack.utilities;

/**
 * Thrown when stack entries of one role differ in shape and padding is disabled.
 * Fatal for the affected role only.
 */
public class ShapeMismatchException extends IllegalStateException {

    private final String role;

    public ShapeMismatchException(String role, String message) {
        super(message);
        this.role = role;
    }

    public String getRole() {
        return role;
    }
}
