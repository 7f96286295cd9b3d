package tomo.ext.nxstack.model;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Describes how one facility lays out the files of one experiment type: how to recognise
 * them, how to extract their identifiers, and where the arrays and metadata live.
 *
 * <p>Optional paths and attribute references are null when the layout does not provide them.</p>
 *
 * @param software              name of the reconstruction or processing software
 * @param extensions            accepted file extensions, including the leading dot
 * @param filenamePatterns      patterns with named groups {@code scan} and/or {@code proj}, tried in order
 * @param scanAttribute         string attribute whose value identifies the scan
 * @param scanAttributePatterns patterns applied to {@code scanAttribute}, named group {@code scan}
 * @param projAttribute         numeric attribute holding the projection number
 * @param saveDirAttribute      string attribute holding the directory the file was written to
 * @param essentialPaths        paths that must exist in every genuine file
 * @param signature             attribute identifying the producing software
 * @param signatureValue        expected value of {@code signature}
 * @param complexPath           complex object array, trailing axis of 2 (real, imaginary)
 * @param modulusPath           object modulus array
 * @param phasePath             object phase array
 * @param transitionPath        emission-line array template containing {@code {transition}}
 * @param pixelSizePath         array whose mean is the pixel size in metres
 * @param angleAttributes       rotation angle candidates inside the projection file
 * @param scanPadding           zero padding applied to scan numbers in naming patterns
 * @param projPadding           zero padding applied to projection numbers in naming patterns
 */
public record ModalitySchema(
        String software,
        List<String> extensions,
        List<Pattern> filenamePatterns,
        AttributeRef scanAttribute,
        List<Pattern> scanAttributePatterns,
        AttributeRef projAttribute,
        AttributeRef saveDirAttribute,
        List<String> essentialPaths,
        AttributeRef signature,
        String signatureValue,
        String complexPath,
        String modulusPath,
        String phasePath,
        String transitionPath,
        String pixelSizePath,
        List<AttributeRef> angleAttributes,
        int scanPadding,
        int projPadding) {

    public ModalitySchema {
        extensions = List.copyOf(extensions);
        filenamePatterns = List.copyOf(filenamePatterns);
        scanAttributePatterns = List.copyOf(scanAttributePatterns);
        essentialPaths = List.copyOf(essentialPaths);
        angleAttributes = List.copyOf(angleAttributes);
    }

    /**
     * @param fileName a file name without directories
     * @return true if the name ends with one of the accepted extensions
     */
    public boolean acceptsExtension(String fileName) {
        return extensions.stream().anyMatch(fileName::endsWith);
    }

    public boolean storesComplex() {
        return complexPath != null;
    }
}
