package tomo.ext.nxstack.modality.ptycho;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.modality.Extraction;
import tomo.ext.nxstack.modality.ModalityHandler;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.JoinRequest;
import tomo.ext.nxstack.model.ModalitySchema;
import tomo.ext.nxstack.model.Plane;
import tomo.ext.nxstack.model.ProjectionRecord;
import tomo.ext.nxstack.service.container.ContainerReader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ptychography handler producing up to three roles per projection: the complex object,
 * its modulus and its phase.
 *
 * <p>When the file stores the complex object, modulus and phase are derived from it;
 * otherwise they are read from their own arrays (the complex role is then unavailable).
 * Only object mode 0 is used. Transforms run in this order, each when enabled: ramp
 * removal, median normalisation, phase unwrapping, rescaling.</p>
 */
public class PtychoModalityHandler implements ModalityHandler {
    private static final Logger logger = LoggerFactory.getLogger(PtychoModalityHandler.class);

    public static final String COMPLEX = "complex";
    public static final String MODULUS = "modulus";
    public static final String PHASE = "phase";

    @Override
    public ExperimentType experiment() {
        return ExperimentType.PTYCHO;
    }

    @Override
    public List<String> roles(JoinRequest request) {
        List<String> roles = new ArrayList<>();
        if (request.saveComplex()) roles.add(COMPLEX);
        if (request.saveModulus()) roles.add(MODULUS);
        if (request.savePhase()) roles.add(PHASE);
        if (roles.isEmpty()) {
            throw new IllegalArgumentException("Nothing to save: enable at least one of complex, modulus and phase");
        }
        return roles;
    }

    @Override
    public Extraction extract(ContainerReader reader, ProjectionRecord record, ModalitySchema schema,
                              JoinRequest request) throws IOException {
        Extraction extraction = new Extraction();
        Optional<String> complexPath = dataset(reader, schema.complexPath());

        Plane complex = null;
        Plane modulus = null;
        Plane phase = null;
        if (complexPath.isPresent()) {
            complex = Plane.fromInterleaved(reader.readArray(complexPath.get()));
            // Corrections feed modulus and phase only, the complex role keeps the stored object
            Plane corrected = complex;
            if (request.removeRamp()) corrected = PhaseCorrections.removeRamp(corrected);
            if (request.medianNorm()) corrected = PhaseCorrections.medianNormalise(corrected);
            if (request.saveModulus()) modulus = corrected.modulus();
            if (request.savePhase()) phase = corrected.phase();
        } else {
            if (request.saveModulus()) {
                modulus = readReal(reader, schema.modulusPath()).orElse(null);
            }
            if (request.savePhase()) {
                phase = readReal(reader, schema.phasePath()).orElse(null);
                if (phase != null) {
                    if (request.removeRamp()) phase = PhaseCorrections.removeRamp(phase);
                    if (request.medianNorm()) phase = PhaseCorrections.medianNormalise(phase);
                }
            }
        }
        if (phase != null && request.unwrapPhase()) {
            phase = PhaseCorrections.unwrap(phase);
        }
        if (request.rescale()) {
            if (complex != null) complex = PhaseCorrections.rescale(complex);
            if (modulus != null) modulus = PhaseCorrections.rescale(modulus);
            if (phase != null) phase = PhaseCorrections.rescale(phase);
        }

        if (complex == null && modulus == null && phase == null) {
            throw new IOException("No object array found in " + record.path() + " for " + schema.software());
        }
        addRole(extraction, request.saveComplex(), COMPLEX, complex, record, schema);
        addRole(extraction, request.saveModulus(), MODULUS, modulus, record, schema);
        addRole(extraction, request.savePhase(), PHASE, phase, record, schema);
        logger.debug("Extracted {} from {}", extraction.planes().keySet(), record.label());
        return extraction;
    }

    @Override
    public String describeTransforms(JoinRequest request) {
        List<String> steps = new ArrayList<>();
        if (request.removeRamp()) steps.add("ramp removal (no-op)");
        if (request.medianNorm()) steps.add("median normalisation");
        if (request.unwrapPhase()) steps.add("phase unwrapping");
        if (request.rescale()) steps.add("rescale (no-op)");
        return steps.isEmpty() ? "none" : String.join(", ", steps);
    }

    private static void addRole(Extraction extraction, boolean requested, String role, Plane plane,
                                ProjectionRecord record, ModalitySchema schema) {
        if (!requested) {
            return;
        }
        if (plane != null) {
            extraction.put(role, plane);
        } else {
            extraction.fail(role, new IOException(schema.software() + " file " + record.path().getFileName()
                    + " provides no " + role + " array"));
        }
    }

    private static Optional<Plane> readReal(ContainerReader reader, String template) throws IOException {
        Optional<String> path = dataset(reader, template);
        if (path.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(Plane.fromReal(reader.readArray(path.get())));
    }

    /**
     * Resolves a configured array path, returning empty when it is not configured or absent.
     */
    private static Optional<String> dataset(ContainerReader reader, String template) {
        if (template == null) {
            return Optional.empty();
        }
        try {
            String path = reader.resolvePath(template);
            return reader.isDataset(path) ? Optional.of(path) : Optional.empty();
        } catch (IOException e) {
            logger.debug("Array {} not available: {}", template, e.getMessage());
            return Optional.empty();
        }
    }
}
