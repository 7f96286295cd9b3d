package tomo.ext.nxstack.controller.workflow;

import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.Facility;
import tomo.ext.nxstack.model.ProjectionRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Settings shared by every output of one run.
 *
 * @param experiment       experiment type
 * @param facility         facility that produced the projections
 * @param outputDir        directory receiving the containers
 * @param sortByAngle      order slices by rotation angle instead of identifier
 * @param compress         compress datasets
 * @param dryRun           compute names without touching the filesystem
 * @param runRecords       projections of the run, used for naming
 * @param skippedByRole    per-role skip counters carried into the reports
 * @param pixelSize        pixel size in metres, or null
 * @param detectorDistance sample to detector distance in metres, or null
 * @param source           light source description
 */
public record AssemblyOptions(ExperimentType experiment,
                              Facility facility,
                              Path outputDir,
                              boolean sortByAngle,
                              boolean compress,
                              boolean dryRun,
                              List<ProjectionRecord> runRecords,
                              Map<String, Integer> skippedByRole,
                              Double pixelSize,
                              Double detectorDistance,
                              Map<String, String> source) {

    public AssemblyOptions {
        runRecords = List.copyOf(runRecords);
        skippedByRole = Map.copyOf(skippedByRole);
        source = Map.copyOf(source);
    }
}
