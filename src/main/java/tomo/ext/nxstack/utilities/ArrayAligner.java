package tomo.ext.nxstack.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.model.StackEntry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Brings the entries of one output role to a common shape.
 *
 * <p>The target is the element-wise maximum of all entry shapes. Smaller entries are
 * zero-padded at their trailing edges when padding is enabled; otherwise any difference
 * raises {@link ShapeMismatchException}. Entries are never cropped.</p>
 */
public final class ArrayAligner {

    private static final Logger logger = LoggerFactory.getLogger(ArrayAligner.class);

    /** Offending entries listed in a mismatch message. */
    private static final int MAX_REPORTED = 10;

    private ArrayAligner() {
        // Utility class - no instantiation
    }

    /**
     * @param entries entries of a single role, in any order
     * @return element-wise maximum {rows, cols}, or {0, 0} for no entries
     */
    public static int[] maxShape(List<StackEntry> entries) {
        int[] max = {0, 0};
        for (StackEntry entry : entries) {
            max[0] = Math.max(max[0], entry.plane().rows());
            max[1] = Math.max(max[1], entry.plane().cols());
        }
        return max;
    }

    /**
     * @param entries  entries of a single role
     * @param padToMax pad smaller entries instead of failing
     * @return entries in the same order, all of the maximum shape
     * @throws ShapeMismatchException if shapes differ and {@code padToMax} is false
     */
    public static List<StackEntry> align(List<StackEntry> entries, boolean padToMax) {
        if (entries.isEmpty()) {
            return entries;
        }
        int[] target = maxShape(entries);
        List<StackEntry> offending = entries.stream()
                .filter(e -> !Arrays.equals(e.shape(), target))
                .collect(Collectors.toList());
        if (offending.isEmpty()) {
            return entries;
        }

        String role = entries.get(0).role();
        if (!padToMax) {
            String detail = offending.stream()
                    .limit(MAX_REPORTED)
                    .map(e -> e.source().label() + " " + Arrays.toString(e.shape()))
                    .collect(Collectors.joining(", "));
            String more = offending.size() > MAX_REPORTED ? " and " + (offending.size() - MAX_REPORTED) + " more" : "";
            throw new ShapeMismatchException(role, "Role '" + role + "': " + offending.size() + " of " + entries.size()
                    + " entries differ from shape " + Arrays.toString(target) + ": " + detail + more);
        }

        logger.info("Padding {} of {} '{}' entries to shape {}", offending.size(), entries.size(), role,
                Arrays.toString(target));
        List<StackEntry> aligned = new ArrayList<>(entries.size());
        for (StackEntry entry : entries) {
            aligned.add(entry.withPlane(entry.plane().padTo(target[0], target[1])));
        }
        return aligned;
    }
}
