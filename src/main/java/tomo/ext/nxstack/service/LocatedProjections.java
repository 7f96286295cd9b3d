package tomo.ext.nxstack.service;

import tomo.ext.nxstack.model.ProjectionRecord;

import java.util.List;

/**
 * Projections selected by {@link ProjectionLocator}, ordered by identifier, with the counts
 * reported at the end of a run.
 *
 * @param records   selected projections
 * @param located   candidate files found
 * @param validated candidates that passed validation (all candidates when validation is skipped)
 * @param skipped   candidates dropped by validation or read errors, and missing pattern files
 */
public record LocatedProjections(List<ProjectionRecord> records, int located, int validated, int skipped) {

    public LocatedProjections {
        records = List.copyOf(records);
    }
}
