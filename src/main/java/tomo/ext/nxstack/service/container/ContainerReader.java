package tomo.ext.nxstack.service.container;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import tomo.ext.nxstack.model.AttributeRef;
import tomo.ext.nxstack.model.NdArray;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Read access to one container. Paths are absolute within the container, e.g.
 * {@code /entry/data}. Array shapes are reported slowest axis first.
 */
public interface ContainerReader extends AutoCloseable {

    /** Placeholder resolving to the first child, in name order, of the preceding group. */
    String FIRST_CHILD = "{first}";

    boolean exists(String path);

    boolean isDataset(String path);

    /**
     * @return child names of a group, sorted
     */
    List<String> list(String path) throws IOException;

    int[] shape(String dataset) throws IOException;

    NdArray readArray(String dataset) throws IOException;

    /**
     * @return the attribute value, or null if the path or key does not exist
     */
    JsonElement readAttribute(String path, String key) throws IOException;

    @Override
    void close();

    /**
     * Resolves {@value #FIRST_CHILD} placeholders against the container's groups.
     *
     * @param template path that may contain placeholders
     * @return the concrete path
     * @throws IOException if a group preceding a placeholder is missing or empty
     */
    default String resolvePath(String template) throws IOException {
        String resolved = template;
        int at;
        while ((at = resolved.indexOf(FIRST_CHILD)) >= 0) {
            String parent = at == 0 ? "/" : resolved.substring(0, at);
            if (parent.length() > 1 && parent.endsWith("/")) {
                parent = parent.substring(0, parent.length() - 1);
            }
            List<String> children = exists(parent) ? list(parent) : List.of();
            if (children.isEmpty()) {
                throw new IOException("No entries under " + parent + " to resolve " + template);
            }
            resolved = resolved.substring(0, at) + children.get(0) + resolved.substring(at + FIRST_CHILD.length());
        }
        return resolved;
    }

    /**
     * @return the attribute as text, or null if missing
     */
    default String readString(AttributeRef ref) throws IOException {
        JsonElement element = readAttribute(resolvePath(ref.path()), ref.key());
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonArray() && element.getAsJsonArray().size() == 1) {
            element = element.getAsJsonArray().get(0);
        }
        return element.isJsonPrimitive() ? element.getAsString() : element.toString();
    }

    /**
     * Reads a numeric attribute: a number, or nested arrays of numbers of uniform length.
     *
     * @return the value as an array (rank 0 for a scalar), or null if missing
     * @throws IOException if the attribute is not numeric
     */
    default NdArray readNumbers(AttributeRef ref) throws IOException {
        JsonElement element = readAttribute(resolvePath(ref.path()), ref.key());
        if (element == null || element.isJsonNull()) {
            return null;
        }
        List<Integer> shape = new ArrayList<>();
        JsonElement probe = element;
        while (probe.isJsonArray()) {
            JsonArray array = probe.getAsJsonArray();
            shape.add(array.size());
            if (array.size() == 0) {
                break;
            }
            probe = array.get(0);
        }
        List<Double> values = new ArrayList<>();
        flatten(element, values, ref);
        int[] dims = shape.stream().mapToInt(Integer::intValue).toArray();
        double[] flat = values.stream().mapToDouble(Double::doubleValue).toArray();
        try {
            return new NdArray(dims, flat);
        } catch (IllegalArgumentException e) {
            throw new IOException("Attribute " + ref + " is a ragged array", e);
        }
    }

    private static void flatten(JsonElement element, List<Double> into, AttributeRef ref) throws IOException {
        if (element.isJsonArray()) {
            for (JsonElement child : element.getAsJsonArray()) {
                flatten(child, into, ref);
            }
        } else if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
            into.add(element.getAsDouble());
        } else if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
            try {
                into.add(Double.parseDouble(element.getAsString().trim()));
            } catch (NumberFormatException e) {
                throw new IOException("Attribute " + ref + " is not numeric: " + element, e);
            }
        } else {
            throw new IOException("Attribute " + ref + " is not numeric: " + element);
        }
    }
}
