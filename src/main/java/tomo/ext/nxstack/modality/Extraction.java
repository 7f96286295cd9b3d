package tomo.ext.nxstack.modality;

import tomo.ext.nxstack.model.Plane;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Planes extracted from one projection, keyed by role, and the roles that failed.
 */
public final class Extraction {

    private final Map<String, Plane> planes = new LinkedHashMap<>();
    private final Map<String, IOException> failures = new LinkedHashMap<>();

    public Extraction put(String role, Plane plane) {
        planes.put(role, plane);
        return this;
    }

    public Extraction fail(String role, IOException cause) {
        failures.put(role, cause);
        return this;
    }

    public Map<String, Plane> planes() {
        return Collections.unmodifiableMap(planes);
    }

    public Map<String, IOException> failures() {
        return Collections.unmodifiableMap(failures);
    }
}
