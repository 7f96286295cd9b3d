package tomo.ext.nxstack.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Tomography experiment types. The short name is used for modality handler lookup,
 * configuration keys and output file names.
 */
public enum ExperimentType {

    PTYCHO("ptycho", "ptychography"),
    XRF("xrf", "x-ray fluorescence");

    private final String shortName;
    private final String description;

    ExperimentType(String shortName, String description) {
        this.shortName = shortName;
        this.description = description;
    }

    public String shortName() {
        return shortName;
    }

    public String description() {
        return description;
    }

    /**
     * Resolves an experiment type from its short name or description.
     *
     * @param name the name, case-insensitive
     * @return the experiment type
     * @throws IllegalArgumentException if the name is not recognised
     */
    public static ExperimentType fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (ExperimentType type : values()) {
                if (type.shortName.equals(normalized) || type.description.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown experiment type '" + name + "'. Expected one of "
                + Arrays.toString(Arrays.stream(values()).map(ExperimentType::shortName).toArray()));
    }

    @Override
    public String toString() {
        return shortName;
    }
}
