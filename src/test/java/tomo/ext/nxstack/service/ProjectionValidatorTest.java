package tomo.ext.nxstack.service;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tomo.ext.nxstack.model.ExperimentType;
import tomo.ext.nxstack.model.Facility;
import tomo.ext.nxstack.model.ModalitySchema;
import tomo.ext.nxstack.service.container.ContainerReader;
import tomo.ext.nxstack.service.container.ContainerStore;
import tomo.ext.nxstack.utilities.FacilityConfigManager;

import java.io.IOException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ProjectionValidator against a mocked container layer.
 */
@ExtendWith(MockitoExtension.class)
class ProjectionValidatorTest {

    private static ModalitySchema ptypy;

    private final Path path = Path.of("/dls/i14/data/2024/cm1-1/processing/scan_12.ptyr");

    @Mock
    ContainerStore store;

    @Mock
    ContainerReader reader;

    @BeforeAll
    static void loadLayout() {
        ptypy = FacilityConfigManager.getInstance().getSchema(Facility.I14).modality(ExperimentType.PTYCHO);
    }

    @Test
    void testValidProjection() throws IOException {
        when(store.isContainer(path)).thenReturn(true);
        when(store.openReader(path)).thenReturn(reader);
        when(reader.exists(anyString())).thenReturn(true);
        when(reader.readString(ptypy.signature())).thenReturn("PtyPy");

        assertTrue(new ProjectionValidator(store).validate(path, ptypy));
        verify(reader).close();
    }

    @Test
    void testNotAContainer() {
        when(store.isContainer(path)).thenReturn(false);
        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> new ProjectionValidator(store).validate(path, ptypy));
        assertEquals(path, e.getPath());
    }

    @Test
    @DisplayName("Missing essential paths are listed")
    void testMissingEssentialPath() throws IOException {
        when(store.isContainer(path)).thenReturn(true);
        when(store.openReader(path)).thenReturn(reader);
        when(reader.exists("/content/obj")).thenReturn(true);
        when(reader.exists("/content/probe")).thenReturn(false);

        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> new ProjectionValidator(store).validate(path, ptypy));
        assertTrue(e.getMessage().contains("/content/probe"));
        verify(reader, never()).readString(any());
    }

    @Test
    @DisplayName("A file written by other software is rejected")
    void testSignatureMismatch() throws IOException {
        when(store.isContainer(path)).thenReturn(true);
        when(store.openReader(path)).thenReturn(reader);
        when(reader.exists(anyString())).thenReturn(true);
        when(reader.readString(ptypy.signature())).thenReturn("PtyREX");

        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> new ProjectionValidator(store).validate(path, ptypy));
        assertTrue(e.getMessage().contains("PtyREX"));
    }

    @Test
    void testUnreadableContainer() throws IOException {
        when(store.isContainer(path)).thenReturn(true);
        when(store.openReader(path)).thenThrow(new IOException("corrupt"));

        SchemaValidationException e = assertThrows(SchemaValidationException.class,
                () -> new ProjectionValidator(store).validate(path, ptypy));
        assertInstanceOf(IOException.class, e.getCause());
    }
}
