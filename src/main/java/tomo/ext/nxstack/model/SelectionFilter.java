package tomo.ext.nxstack.model;

import java.util.Collections;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * The three independent selection axes of a run. An empty set means the axis is not
 * filtered; a non-empty set admits only its members.
 *
 * @param scans  resolved scan numbers
 * @param projs  resolved projection numbers
 * @param angles resolved rotation angles in degrees
 */
public record SelectionFilter(NavigableSet<Integer> scans, NavigableSet<Integer> projs, NavigableSet<Double> angles) {

    /** Angles closer than this are considered equal. */
    public static final double ANGLE_TOLERANCE = 1e-3;

    public SelectionFilter {
        scans = Collections.unmodifiableNavigableSet(new TreeSet<>(scans));
        projs = Collections.unmodifiableNavigableSet(new TreeSet<>(projs));
        angles = Collections.unmodifiableNavigableSet(new TreeSet<>(angles));
    }

    public static SelectionFilter unfiltered() {
        return new SelectionFilter(new TreeSet<>(), new TreeSet<>(), new TreeSet<>());
    }

    public boolean filtersScans() {
        return !scans.isEmpty();
    }

    public boolean filtersProjs() {
        return !projs.isEmpty();
    }

    public boolean filtersAngles() {
        return !angles.isEmpty();
    }

    /**
     * A null identifier is only admitted when the axis is unfiltered.
     */
    public boolean acceptsScan(Integer scan) {
        return scans.isEmpty() || (scan != null && scans.contains(scan));
    }

    public boolean acceptsProj(Integer proj) {
        return projs.isEmpty() || (proj != null && projs.contains(proj));
    }

    public boolean acceptsAngle(Double angle) {
        if (angles.isEmpty()) {
            return true;
        }
        if (angle == null) {
            return false;
        }
        Double below = angles.floor(angle);
        Double above = angles.ceiling(angle);
        return (below != null && angle - below <= ANGLE_TOLERANCE)
                || (above != null && above - angle <= ANGLE_TOLERANCE);
    }
}
