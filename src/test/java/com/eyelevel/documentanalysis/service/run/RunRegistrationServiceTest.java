package com.eyelevel.documentanalysis.service.run;

import com.eyelevel.documentanalysis.exception.InvalidModelException;
import com.eyelevel.documentanalysis.exception.RunAlreadyExistsException;
import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.ModelVariant;
import com.eyelevel.documentanalysis.model.RunStatus;
import com.eyelevel.documentanalysis.store.InMemoryRunStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RunRegistrationService Tests")
class RunRegistrationServiceTest {

    private InMemoryRunStore runStore;
    private RunRegistrationService service;

    @BeforeEach
    void setUp() {
        runStore = new InMemoryRunStore(Clock.systemUTC());
        service = new RunRegistrationService(runStore);
    }

    @Test
    @DisplayName("Should register a run with a generated identifier")
    void testRegisterGeneratesId() {
        AnalysisRun run = service.register("u1", null, "B", "uploads/informe.pdf");

        assertNotNull(run.getRunId());
        assertFalse(run.getRunId().isBlank());
        assertEquals(RunStatus.UPLOADED, run.getStatus());
        assertEquals(ModelVariant.B, run.getModelVariant());
    }

    @Test
    @DisplayName("Should reject an unsupported variant before creating anything")
    void testRegisterInvalidVariant() {
        assertThrows(InvalidModelException.class, () -> service.register("u1", "r1", "a", "uploads/informe.pdf"));

        assertTrue(runStore.listRuns("u1", 10).isEmpty());
    }

    @Test
    @DisplayName("Should reject a taken run identifier")
    void testRegisterDuplicate() {
        service.register("u1", "r1", null, "uploads/informe.pdf");

        assertThrows(RunAlreadyExistsException.class,
                     () -> service.register("u1", "r1", null, "uploads/otro.pdf"));
    }

    @Test
    @DisplayName("Should return the registered run instead of creating another")
    void testFindOrRegisterExisting() {
        service.register("u1", "r1", "A", "uploads/contrato.pdf");

        AnalysisRun run = service.findOrRegister("u1", "r1", "uploads/otro.pdf");

        assertEquals("uploads/contrato.pdf", run.getSourceFileReference());
        assertEquals(1, runStore.listRuns("u1", 10).size());
    }

    @Test
    @DisplayName("Should create the run when the trigger names an unknown one")
    void testFindOrRegisterMissing() {
        AnalysisRun run = service.findOrRegister("u1", "r9", "uploads/contrato.pdf");

        assertEquals("r9", run.getRunId());
        assertEquals(RunStatus.UPLOADED, run.getStatus());
    }
}
