package tomo.ext.nxstack.model;

/**
 * One slice waiting to be stacked: a plane tagged with its source projection and output role.
 *
 * @param source the projection the plane was read from
 * @param role   {@code complex}, {@code modulus}, {@code phase} or an emission-line name
 * @param plane  the slice data
 */
public record StackEntry(ProjectionRecord source, String role, Plane plane) {

    public StackEntry withPlane(Plane newPlane) {
        return new StackEntry(source, role, newPlane);
    }

    public int[] shape() {
        return plane.shape();
    }
}
