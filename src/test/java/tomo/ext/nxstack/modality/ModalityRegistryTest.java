package tomo.ext.nxstack.modality;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tomo.ext.nxstack.modality.ptycho.PtychoModalityHandler;
import tomo.ext.nxstack.modality.xrf.XrfModalityHandler;
import tomo.ext.nxstack.model.ExperimentType;

import static org.junit.jupiter.api.Assertions.*;

class ModalityRegistryTest {

    @Test
    void testBuiltInHandlers() {
        assertInstanceOf(PtychoModalityHandler.class, ModalityRegistry.getHandler(ExperimentType.PTYCHO));
        assertInstanceOf(XrfModalityHandler.class, ModalityRegistry.getHandler(ExperimentType.XRF));
    }

    @Test
    @DisplayName("Lookup is case-insensitive and prefix based")
    void testPrefixLookup() {
        assertInstanceOf(PtychoModalityHandler.class, ModalityRegistry.getHandler("Ptychography"));
        assertInstanceOf(XrfModalityHandler.class, ModalityRegistry.getHandler(" XRF "));
    }

    @Test
    void testUnknownExperiment() {
        assertThrows(IllegalArgumentException.class, () -> ModalityRegistry.getHandler("dpc"));
        assertThrows(IllegalArgumentException.class, () -> ModalityRegistry.getHandler(""));
    }

    @Test
    void testInvalidRegistration() {
        assertThrows(IllegalArgumentException.class, () -> ModalityRegistry.registerHandler(" ", new XrfModalityHandler()));
        assertThrows(IllegalArgumentException.class, () -> ModalityRegistry.registerHandler("xrf", null));
    }

    @Test
    @DisplayName("Longest registered prefix wins")
    void testLongestPrefixWins() {
        XrfModalityHandler special = new XrfModalityHandler();
        ModalityRegistry.registerHandler("xrf-fast", special);
        assertSame(special, ModalityRegistry.getHandler("xrf-fast-maps"));
        assertNotSame(special, ModalityRegistry.getHandler("xrf"));
    }
}
