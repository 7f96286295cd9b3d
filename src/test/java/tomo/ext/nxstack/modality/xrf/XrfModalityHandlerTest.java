package tomo.ext.nxstack.modality.xrf;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tomo.ext.nxstack.ProjectionFixtures;
import tomo.ext.nxstack.modality.Extraction;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.Facility;
import tomo.ext.nxstack.model.JoinRequest;
import tomo.ext.nxstack.model.ModalitySchema;
import tomo.ext.nxstack.model.ProjectionRecord;
import tomo.ext.nxstack.service.container.ContainerReader;
import tomo.ext.nxstack.service.container.N5ContainerStore;
import tomo.ext.nxstack.utilities.FacilityConfigManager;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class XrfModalityHandlerTest {

    private final N5ContainerStore store = new N5ContainerStore();
    private final XrfModalityHandler handler = new XrfModalityHandler();
    private final ModalitySchema schema = FacilityConfigManager.getInstance()
            .getSchema(Facility.I14).modality(ExperimentType.XRF);

    @TempDir
    Path tempDir;

    private JoinRequest request(String transitions) {
        return JoinRequest.builder()
                .experiment(ExperimentType.XRF)
                .outputDir(tempDir.resolve("out"))
                .projDir(tempDir)
                .transitions(transitions)
                .build();
    }

    @Test
    @DisplayName("One role per requested transition, duplicates dropped")
    void testRoles() {
        assertEquals(List.of("Pt-La", "Fe-Ka"), handler.roles(request("Pt-La, Fe-Ka,Pt-La")));
    }

    @Test
    void testTransitionsAreRequired() {
        assertThrows(IllegalArgumentException.class, () -> request(" , "));
    }

    @Test
    @DisplayName("A missing transition fails only that role")
    void testMissingTransition() throws IOException {
        Path path = ProjectionFixtures.writeXrf(tempDir, 10, 0.0,
                Map.of("Fe-Ka", new double[][]{{1, 2}, {3, 4}}));
        ProjectionRecord record = new ProjectionRecord(path, Facility.I14, ExperimentType.XRF, 10, null, 0.0);
        try (ContainerReader reader = store.openReader(path)) {
            Extraction extraction = handler.extract(reader, record, schema, request("Pt-La,Fe-Ka"));
            assertEquals(3.0, extraction.planes().get("Fe-Ka").get(1, 0));
            assertFalse(extraction.planes().containsKey("Pt-La"));
            IOException failure = extraction.failures().get("Pt-La");
            TransitionNotFoundException missing = assertInstanceOf(TransitionNotFoundException.class, failure);
            assertEquals("Pt-La", missing.getTransition());
        }
    }
}
