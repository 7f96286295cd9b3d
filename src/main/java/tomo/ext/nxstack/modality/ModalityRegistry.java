package tomo.ext.nxstack.modality;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tomo.ext.nxstack.modality.ptycho.PtychoModalityHandler;
import tomo.ext.nxstack.modality.xrf.XrfModalityHandler;
import tomo.ext.nxstack.model.ExperimentType;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe static registry mapping experiment name prefixes to {@link ModalityHandler}s.
 *
 * <p>Lookup is case-insensitive and uses {@link String#startsWith(String)} semantics, so a
 * handler registered as {@code "ptycho"} also serves {@code "ptychography"}. Unlike a
 * best-effort lookup, an unknown experiment is an error: there is no sensible default
 * for which arrays to stack.</p>
 *
 * <pre>{@code
 * ModalityHandler handler = ModalityRegistry.getHandler("xrf");
 * }</pre>
 */
public final class ModalityRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ModalityRegistry.class);

    private static final Map<String, ModalityHandler> HANDLERS = new ConcurrentHashMap<>();

    static {
        registerHandler(ExperimentType.PTYCHO.shortName(), new PtychoModalityHandler());
        registerHandler(ExperimentType.XRF.shortName(), new XrfModalityHandler());
        logger.debug("ModalityRegistry initialised with {} handlers", HANDLERS.size());
    }

    private ModalityRegistry() {
        // Utility class - no instantiation
    }

    /**
     * Registers a handler for experiment names starting with the given prefix, replacing
     * any handler already registered for it.
     *
     * @param prefix  name prefix, case-insensitive
     * @param handler the handler
     * @throws IllegalArgumentException if either argument is null or the prefix is blank
     */
    public static void registerHandler(String prefix, ModalityHandler handler) {
        if (prefix == null || prefix.trim().isEmpty()) {
            throw new IllegalArgumentException("Handler prefix must not be empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler for prefix '" + prefix + "' must not be null");
        }
        String normalizedPrefix = prefix.toLowerCase().trim();
        ModalityHandler existingHandler = HANDLERS.put(normalizedPrefix, handler);
        if (existingHandler != null) {
            logger.warn("Replaced existing handler for prefix '{}'. Old handler: {}, New handler: {}",
                    normalizedPrefix, existingHandler.getClass().getSimpleName(), handler.getClass().getSimpleName());
        } else {
            logger.debug("Registered modality handler for prefix '{}': {}",
                    normalizedPrefix, handler.getClass().getSimpleName());
        }
    }

    /**
     * @param experimentName experiment name, e.g. {@code "ptycho"} or {@code "xrf"}
     * @return the handler whose prefix starts the name; the longest prefix wins
     * @throws IllegalArgumentException if no handler matches
     */
    public static ModalityHandler getHandler(String experimentName) {
        if (experimentName == null || experimentName.trim().isEmpty()) {
            throw new IllegalArgumentException("Experiment name must not be empty");
        }
        String normalizedName = experimentName.toLowerCase().trim();
        String bestPrefix = null;
        for (String prefix : HANDLERS.keySet()) {
            if (normalizedName.startsWith(prefix) && (bestPrefix == null || prefix.length() > bestPrefix.length())) {
                bestPrefix = prefix;
            }
        }
        if (bestPrefix == null) {
            throw new IllegalArgumentException("No handler registered for experiment '" + experimentName
                    + "'. Registered prefixes: " + HANDLERS.keySet());
        }
        ModalityHandler handler = HANDLERS.get(bestPrefix);
        logger.debug("Resolved experiment '{}' to {}", experimentName, handler.getClass().getSimpleName());
        return handler;
    }

    public static ModalityHandler getHandler(ExperimentType experiment) {
        return getHandler(experiment.shortName());
    }
}
