package tomo.ext.nxstack.modality;

import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.JoinRequest;
import tomo.ext.nxstack.model.ModalitySchema;
import tomo.ext.nxstack.model.ProjectionRecord;
import tomo.ext.nxstack.service.container.ContainerReader;

import java.io.IOException;
import java.util.List;

/**
 * Extracts the output planes of one experiment type from a projection file.
 *
 * <p>Handlers register with {@link ModalityRegistry} under the experiment's short name.
 * Each requested role becomes one output stack; a handler reports, per projection, which
 * roles it produced and which it could not produce.</p>
 *
 * <p>Implementations must be stateless: the same handler extracts many projections
 * concurrently.</p>
 *
 * @see ModalityRegistry
 * @see tomo.ext.nxstack.modality.ptycho.PtychoModalityHandler
 * @see tomo.ext.nxstack.modality.xrf.XrfModalityHandler
 */
public interface ModalityHandler {

    ExperimentType experiment();

    /**
     * Lists the roles a run produces, in output order.
     *
     * @param request the run request
     * @return role tags, never empty for a valid request
     * @throws IllegalArgumentException if the request selects no role
     */
    List<String> roles(JoinRequest request);

    /**
     * Reads one projection and applies the configured numeric transforms.
     *
     * @param reader  open reader on the projection
     * @param record  the projection being read
     * @param schema  the facility layout for this experiment type
     * @param request the run request
     * @return planes per role, plus per-role failures
     * @throws IOException if nothing can be read from the projection
     */
    Extraction extract(ContainerReader reader, ProjectionRecord record, ModalitySchema schema, JoinRequest request)
            throws IOException;

    /**
     * Human-readable description of the transforms a request enables, for the run log.
     */
    default String describeTransforms(JoinRequest request) {
        return "none";
    }
}
