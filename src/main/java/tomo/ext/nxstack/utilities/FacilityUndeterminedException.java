package tomo.ext.nxstack.utilities;

/**
 * Thrown when the facility cannot be identified, or several facilities match a path equally well.
 */
public class FacilityUndeterminedException extends IllegalArgumentException {

    public FacilityUndeterminedException(String message) {
        super(message);
    }
}
