package tomo.ext.nxstack.controller.workflow;

import tomo.ext.nxstack.model.ProjectionRecord;
import tomo.ext.nxstack.model.StackEntry;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Output of the load stage: entries per role in projection order, plus skip counters.
 *
 * @param entries        stack entries per role, roles in output order
 * @param skippedByRole  projections excluded from each role
 * @param records        projections that were loaded, with their angles
 * @param skippedFiles   projections that could not be loaded at all
 * @param notLoaded      projections left unread after an early abort
 * @param pixelSize      pixel size in metres from the first projection that records it, or null
 */
public record LoadedProjections(Map<String, List<StackEntry>> entries,
                                Map<String, Integer> skippedByRole,
                                List<ProjectionRecord> records,
                                int skippedFiles,
                                int notLoaded,
                                Double pixelSize) {

    public LoadedProjections {
        entries = Collections.unmodifiableMap(entries);
        skippedByRole = Collections.unmodifiableMap(skippedByRole);
        records = List.copyOf(records);
    }

    public int skipped(String role) {
        return skippedByRole.getOrDefault(role, 0);
    }
}
