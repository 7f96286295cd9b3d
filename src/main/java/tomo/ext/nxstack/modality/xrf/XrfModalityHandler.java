package tomo.ext.nxstack.modality.xrf;

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
import java.util.List;

/**
 * XRF handler producing one role per requested emission line.
 *
 * <p>A file that lacks a requested transition reports a {@link TransitionNotFoundException}
 * for that role only; its other transitions are still extracted.</p>
 */
public class XrfModalityHandler implements ModalityHandler {
    private static final Logger logger = LoggerFactory.getLogger(XrfModalityHandler.class);

    public static final String TRANSITION_PLACEHOLDER = "{transition}";

    @Override
    public ExperimentType experiment() {
        return ExperimentType.XRF;
    }

    @Override
    public List<String> roles(JoinRequest request) {
        if (request.transitions().isEmpty()) {
            throw new IllegalArgumentException("No emission-line transition requested");
        }
        return request.transitions();
    }

    @Override
    public Extraction extract(ContainerReader reader, ProjectionRecord record, ModalitySchema schema,
                              JoinRequest request) throws IOException {
        if (schema.transitionPath() == null) {
            throw new IOException("No transition path configured for " + schema.software());
        }
        Extraction extraction = new Extraction();
        for (String transition : request.transitions()) {
            String path = schema.transitionPath().replace(TRANSITION_PLACEHOLDER, transition);
            if (!reader.isDataset(path)) {
                extraction.fail(transition, new TransitionNotFoundException(transition,
                        "Transition " + transition + " not found in " + record.path().getFileName() + " (" + path + ")"));
                continue;
            }
            try {
                extraction.put(transition, Plane.fromReal(reader.readArray(path)));
            } catch (IOException | IllegalArgumentException e) {
                extraction.fail(transition, new IOException("Cannot read transition " + transition + " from "
                        + record.path().getFileName() + ": " + e.getMessage(), e));
            }
        }
        logger.debug("Extracted transitions {} from {}", extraction.planes().keySet(), record.label());
        return extraction;
    }

    @Override
    public String describeTransforms(JoinRequest request) {
        return "transitions " + request.transitions();
    }
}
