package tomo.ext.nxstack.model;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Static description of a facility: its directory naming convention, how the raw data
 * directory is inferred, and the layouts of the experiment types it produces.
 *
 * @param facility            the facility
 * @param directoryPattern    matches paths that belong to this facility
 * @param rawDirDepth         path depth of the raw data directory
 * @param stagingRawDirDepth  path depth of the raw data directory inside the staging area
 * @param detectorDistance    fixed sample to detector distance in metres, or null
 * @param rawMetadataFiles    raw metadata file templates, tried in order
 * @param rawAngleAttributes  rotation angle candidates inside the raw metadata file
 * @param modalities          layout per experiment type
 */
public record FacilitySchema(
        Facility facility,
        Pattern directoryPattern,
        int rawDirDepth,
        int stagingRawDirDepth,
        Double detectorDistance,
        List<String> rawMetadataFiles,
        List<AttributeRef> rawAngleAttributes,
        Map<ExperimentType, ModalitySchema> modalities) {

    public FacilitySchema {
        rawMetadataFiles = List.copyOf(rawMetadataFiles);
        rawAngleAttributes = List.copyOf(rawAngleAttributes);
        modalities = Map.copyOf(modalities);
    }

    /**
     * @param experiment the experiment type
     * @return the layout for that experiment type
     * @throws IllegalArgumentException if this facility does not produce that experiment type
     */
    public ModalitySchema modality(ExperimentType experiment) {
        ModalitySchema schema = modalities.get(experiment);
        if (schema == null) {
            throw new IllegalArgumentException("Facility " + facility + " has no " + experiment.description()
                    + " layout. Supported: " + modalities.keySet());
        }
        return schema;
    }

    /**
     * @param path an absolute or relative path, as text
     * @return true if the path follows this facility's directory naming convention
     */
    public boolean matchesDirectory(String path) {
        return path != null && directoryPattern.matcher(path).find();
    }
}
