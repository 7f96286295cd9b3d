package tomo.ext.nxstack.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.model.ModalitySchema;
import tomo.ext.nxstack.service.container.ContainerReader;
import tomo.ext.nxstack.service.container.ContainerStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Confirms that a candidate file is a projection of the expected layout: a readable
 * container holding every essential path and, where the layout declares one, the
 * expected software signature.
 */
public class ProjectionValidator {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionValidator.class);

    private final ContainerStore store;

    public ProjectionValidator(ContainerStore store) {
        this.store = store;
    }

    /**
     * @param path   candidate file
     * @param schema expected layout
     * @return true when the file conforms
     * @throws SchemaValidationException describing the first structural problem found
     */
    public boolean validate(Path path, ModalitySchema schema) throws SchemaValidationException {
        if (!store.isContainer(path)) {
            throw new SchemaValidationException(path, "not a readable container");
        }
        try (ContainerReader reader = store.openReader(path)) {
            List<String> missing = new ArrayList<>();
            for (String essential : schema.essentialPaths()) {
                if (!reader.exists(essential)) {
                    missing.add(essential);
                }
            }
            if (!missing.isEmpty()) {
                throw new SchemaValidationException(path, "missing " + missing + " expected in "
                        + schema.software() + " files");
            }
            if (schema.signature() != null && schema.signatureValue() != null) {
                String found = reader.readString(schema.signature());
                if (!schema.signatureValue().equals(found)) {
                    throw new SchemaValidationException(path, "signature " + schema.signature() + " is '" + found
                            + "', expected '" + schema.signatureValue() + "'");
                }
            }
        } catch (SchemaValidationException e) {
            throw e;
        } catch (IOException e) {
            throw new SchemaValidationException(path, "unreadable: " + e.getMessage(), e);
        }
        logger.debug("Validated {} as {}", path, schema.software());
        return true;
    }
}
