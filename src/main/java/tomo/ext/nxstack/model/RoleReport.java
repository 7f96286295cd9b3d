package tomo.ext.nxstack.model;

/**
 * Outcome for one output role.
 *
 * @param role    the role tag
 * @param output  the written (or, in a dry run, planned) container path; null on failure
 * @param slices  number of slices in the stack
 * @param skipped number of projections excluded from this role by per-file faults
 * @param failure failure message, or null when the role succeeded
 */
public record RoleReport(String role, String output, int slices, int skipped, String failure) {

    public boolean succeeded() {
        return failure == null && output != null;
    }

    public static RoleReport failed(String role, int skipped, String failure) {
        return new RoleReport(role, null, 0, skipped, failure);
    }
}
