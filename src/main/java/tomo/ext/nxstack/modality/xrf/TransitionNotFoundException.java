package tomo.ext.nxstack.modality.xrf;

import java.io.IOException;

/**
 * Thrown when a requested emission line is absent from an XRF file.
 */
public class TransitionNotFoundException extends IOException {

    private final String transition;

    public TransitionNotFoundException(String transition, String message) {
        super(message);
        this.transition = transition;
    }

    public String getTransition() {
        return transition;
    }
}
