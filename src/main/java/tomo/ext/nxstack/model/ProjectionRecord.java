package tomo.ext.nxstack.model;

import java.nio.file.Path;
import java.util.Comparator;

/**
 * One located projection file and the identifiers it carries. Any identifier may be null
 * when the file layout does not provide it.
 *
 * @param path       the container path
 * @param facility   the facility that produced it
 * @param experiment the experiment type
 * @param scan       scan number
 * @param proj       projection number
 * @param angle      rotation angle in degrees
 */
public record ProjectionRecord(Path path, Facility facility, ExperimentType experiment,
                               Integer scan, Integer proj, Double angle) {

    /** Orders by scan, then projection number, then path. Missing identifiers sort first. */
    public static final Comparator<ProjectionRecord> BY_IDENTIFIER = Comparator
            .comparing(ProjectionRecord::scan, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ProjectionRecord::proj, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ProjectionRecord::path);

    public ProjectionRecord withProj(Integer newProj) {
        return new ProjectionRecord(path, facility, experiment, scan, newProj, angle);
    }

    public ProjectionRecord withScan(Integer newScan) {
        return new ProjectionRecord(path, facility, experiment, newScan, proj, angle);
    }

    public ProjectionRecord withAngle(Double newAngle) {
        return new ProjectionRecord(path, facility, experiment, scan, proj, newAngle);
    }

    /**
     * @return a short description for log and error messages
     */
    public String label() {
        StringBuilder sb = new StringBuilder();
        if (scan != null) {
            sb.append("scan ").append(scan);
        }
        if (proj != null) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append("proj ").append(proj);
        }
        if (sb.length() == 0) {
            sb.append(path.getFileName());
        }
        return sb.toString();
    }
}
