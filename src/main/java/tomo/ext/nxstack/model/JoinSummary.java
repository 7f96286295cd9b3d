package tomo.ext.nxstack.model;

import java.util.List;

/**
 * Counters reported at the end of a run. Serialised as-is by the {@code --summary-json} option.
 *
 * @param experiment experiment short name
 * @param facility   facility identifier
 * @param located    candidate files found
 * @param validated  candidates that passed structural validation
 * @param skipped    files dropped by per-file faults (validation, read errors, missing angles)
 * @param loaded     files whose planes reached the aligner
 * @param dryRun     whether the run wrote nothing
 * @param roles      per-role outcomes, in role order
 */
public record JoinSummary(String experiment, String facility, int located, int validated, int skipped,
                          int loaded, boolean dryRun, List<RoleReport> roles) {

    public JoinSummary {
        roles = List.copyOf(roles);
    }

    public long written() {
        return roles.stream().filter(RoleReport::succeeded).count();
    }
}
