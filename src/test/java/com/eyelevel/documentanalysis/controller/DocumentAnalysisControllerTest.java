package com.eyelevel.documentanalysis.controller;

import com.eyelevel.documentanalysis.dto.run.RunSummary;
import com.eyelevel.documentanalysis.exception.InvalidModelException;
import com.eyelevel.documentanalysis.exception.RunAlreadyExistsException;
import com.eyelevel.documentanalysis.exception.RunNotFoundException;
import com.eyelevel.documentanalysis.exception.StatusConflictException;
import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.model.AsyncStage;
import com.eyelevel.documentanalysis.model.ExtractionMethod;
import com.eyelevel.documentanalysis.model.ModelVariant;
import com.eyelevel.documentanalysis.model.RunStatus;
import com.eyelevel.documentanalysis.service.analysis.AnalysisCoordinator;
import com.eyelevel.documentanalysis.service.extraction.ExtractionCoordinator;
import com.eyelevel.documentanalysis.service.run.RunRegistrationService;
import com.eyelevel.documentanalysis.service.status.RunStatusService;
import com.eyelevel.documentanalysis.dto.run.RunStatusView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(DocumentAnalysisController.class)
@ActiveProfiles("test")
@DisplayName("DocumentAnalysisController Tests")
class DocumentAnalysisControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RunRegistrationService runRegistrationService;

    @MockBean
    private ExtractionCoordinator extractionCoordinator;

    @MockBean
    private AnalysisCoordinator analysisCoordinator;

    @MockBean
    private RunStatusService runStatusService;

    private static AnalysisRun run(RunStatus status) {
        return AnalysisRun.builder().userId("web-user").runId("r1").status(status)
                          .sourceFileReference("uploads/contrato.pdf").sourceFileName("contrato.pdf")
                          .createdAt(Instant.parse("2024-11-04T10:00:00Z")).build();
    }

    @Test
    @DisplayName("POST /v1/runs registers a run and answers 201")
    void testRegisterRun() throws Exception {
        when(runRegistrationService.register("web-user", null, "A", "uploads/contrato.pdf"))
                .thenReturn(run(RunStatus.UPLOADED));

        mockMvc.perform(post("/documents/v1/runs").contentType(MediaType.APPLICATION_JSON).content(
                       "{\"userId\":\"web-user\",\"fileReference\":\"uploads/contrato.pdf\",\"modelVariant\":\"A\"}"))
               .andExpect(status().isCreated())
               .andExpect(jsonPath("$.statusCode").value(201))
               .andExpect(jsonPath("$.response.runId").value("r1"))
               .andExpect(jsonPath("$.response.status").value("UPLOADED"))
               .andExpect(jsonPath("$.response.fileName").value("contrato.pdf"));
    }

    @Test
    @DisplayName("POST /v1/runs answers 409 for a taken run identifier")
    void testRegisterDuplicate() throws Exception {
        when(runRegistrationService.register(anyString(), anyString(), isNull(), anyString()))
                .thenThrow(new RunAlreadyExistsException("Run r1 already exists for user web-user"));

        mockMvc.perform(post("/documents/v1/runs").contentType(MediaType.APPLICATION_JSON).content(
                       "{\"userId\":\"web-user\",\"fileReference\":\"uploads/contrato.pdf\",\"runId\":\"r1\"}"))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.showMessage").value(true));
    }

    @Test
    @DisplayName("POST /v1/runs answers 400 when required fields are missing")
    void testRegisterValidation() throws Exception {
        mockMvc.perform(post("/documents/v1/runs").contentType(MediaType.APPLICATION_JSON)
                                                  .content("{\"userId\":\"web-user\"}"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.displayMessage").value("Invalid input provided."));

        verifyNoInteractions(runRegistrationService);
    }

    @Test
    @DisplayName("POST /v1/extractions answers 200 with the extracted run")
    void testExtractionCompleted() throws Exception {
        AnalysisRun extracted = run(RunStatus.EXTRACTED);
        extracted.setExtractedTextLength(1_200);
        extracted.setExtractedTextReference("extracted/r1.txt");
        extracted.setExtractionMethod(ExtractionMethod.TEXTRACT);
        when(extractionCoordinator.startExtraction("web-user", null, "uploads/contrato.pdf")).thenReturn(extracted);

        mockMvc.perform(post("/documents/v1/extractions").contentType(MediaType.APPLICATION_JSON).content(
                       "{\"userId\":\"web-user\",\"fileReference\":\"uploads/contrato.pdf\"}"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.showMessage").value(false))
               .andExpect(jsonPath("$.response.status").value("EXTRACTED"))
               .andExpect(jsonPath("$.response.extractedTextLength").value(1_200))
               .andExpect(jsonPath("$.response.extractedTextReference").value("extracted/r1.txt"))
               .andExpect(jsonPath("$.response.extractionMethod").value("TEXTRACT"));
    }

    @Test
    @DisplayName("POST /v1/extractions answers 202 while the fallback runs")
    void testExtractionDeferred() throws Exception {
        AnalysisRun deferred = run(RunStatus.PROCESSING_ASYNC);
        deferred.setAsyncStage(AsyncStage.EXTRACTION);
        when(extractionCoordinator.startExtraction(anyString(), any(), anyString())).thenReturn(deferred);

        mockMvc.perform(post("/documents/v1/extractions").contentType(MediaType.APPLICATION_JSON).content(
                       "{\"userId\":\"web-user\",\"fileReference\":\"uploads/escaneo.png\",\"runId\":\"r1\"}"))
               .andExpect(status().isAccepted())
               .andExpect(jsonPath("$.statusCode").value(202))
               .andExpect(jsonPath("$.response.stage").value("EXTRACTION"));
    }

    @Test
    @DisplayName("POST /v1/analyses answers 200 with the analysis")
    void testAnalysisCompleted() throws Exception {
        AnalysisRun completed = run(RunStatus.COMPLETED);
        completed.setModelVariant(ModelVariant.B);
        completed.setAnalysisResult("Resumen del informe social");
        when(analysisCoordinator.analyze("web-user", "r1", "B", "extracted/r1.txt")).thenReturn(completed);

        mockMvc.perform(post("/documents/v1/analyses").contentType(MediaType.APPLICATION_JSON).content(
                       "{\"userId\":\"web-user\",\"runId\":\"r1\",\"modelVariant\":\"B\","
                               + "\"extractedTextReference\":\"extracted/r1.txt\"}"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.analysis").value("Resumen del informe social"))
               .andExpect(jsonPath("$.response.modelVariant").value("B"));
    }

    @Test
    @DisplayName("POST /v1/analyses answers 502 when the model failed")
    void testAnalysisFailed() throws Exception {
        AnalysisRun failed = run(RunStatus.FAILED);
        failed.setErrorMessage("Analysis failed: Model invocation failed: throttled");
        when(analysisCoordinator.analyze(anyString(), anyString(), anyString(), any())).thenReturn(failed);

        mockMvc.perform(post("/documents/v1/analyses").contentType(MediaType.APPLICATION_JSON)
                                                      .content("{\"userId\":\"web-user\",\"runId\":\"r1\",\"modelVariant\":\"A\"}"))
               .andExpect(status().isBadGateway())
               .andExpect(jsonPath("$.response.errorMessage")
                                  .value("Analysis failed: Model invocation failed: throttled"));
    }

    @Test
    @DisplayName("POST /v1/analyses answers 400 for an unsupported variant")
    void testAnalysisInvalidModel() throws Exception {
        when(analysisCoordinator.analyze(anyString(), anyString(), eq("C"), any()))
                .thenThrow(new InvalidModelException("Unsupported model variant 'C'. Supported variants are: A, B."));

        mockMvc.perform(post("/documents/v1/analyses").contentType(MediaType.APPLICATION_JSON)
                                                      .content("{\"userId\":\"web-user\",\"runId\":\"r1\",\"modelVariant\":\"C\"}"))
               .andExpect(status().isBadRequest())
               .andExpect(jsonPath("$.displayMessage")
                                  .value("Unsupported model variant 'C'. Supported variants are: A, B."));
    }

    @Test
    @DisplayName("POST /v1/analyses answers 409 before extraction has completed")
    void testAnalysisConflict() throws Exception {
        when(analysisCoordinator.analyze(anyString(), anyString(), anyString(), any()))
                .thenThrow(new StatusConflictException("Run r1 is EXTRACTING: extraction has not completed.",
                                                       RunStatus.EXTRACTING));

        mockMvc.perform(post("/documents/v1/analyses").contentType(MediaType.APPLICATION_JSON)
                                                      .content("{\"userId\":\"web-user\",\"runId\":\"r1\",\"modelVariant\":\"A\"}"))
               .andExpect(status().isConflict())
               .andExpect(jsonPath("$.response").value("EXTRACTING"));
    }

    @Test
    @DisplayName("GET /v1/runs/{runId}/status answers 404 for an unknown run")
    void testStatusNotFound() throws Exception {
        when(runStatusService.getStatus("web-user", "missing"))
                .thenThrow(new RunNotFoundException("Run missing not found for user web-user"));

        mockMvc.perform(get("/documents/v1/runs/missing/status").param("userId", "web-user"))
               .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /v1/runs/{runId}/status reports the stored state")
    void testStatus() throws Exception {
        AnalysisRun analyzing = run(RunStatus.PROCESSING_ASYNC);
        analyzing.setAsyncStage(AsyncStage.ANALYSIS);
        when(runStatusService.getStatus("web-user", "r1")).thenReturn(RunStatusView.of(analyzing));

        mockMvc.perform(get("/documents/v1/runs/r1/status").param("userId", "web-user"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response.status").value("PROCESSING_ASYNC"))
               .andExpect(jsonPath("$.response.stage").value("ANALYSIS"));
    }

    @Test
    @DisplayName("GET /v1/runs/{runId}/status answers 400 without a user")
    void testStatusMissingUser() throws Exception {
        mockMvc.perform(get("/documents/v1/runs/r1/status")).andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /v1/users/{userId}/runs lists the history")
    void testHistory() throws Exception {
        when(runStatusService.getHistory("web-user", 2)).thenReturn(List.of(RunSummary.of(run(RunStatus.COMPLETED))));

        mockMvc.perform(get("/documents/v1/users/web-user/runs").param("limit", "2"))
               .andExpect(status().isOk())
               .andExpect(jsonPath("$.response[0].runId").value("r1"))
               .andExpect(jsonPath("$.response[0].status").value("COMPLETED"));
    }

    @Test
    @DisplayName("GET /v1/users/{userId}/runs rejects a non-positive limit")
    void testHistoryInvalidLimit() throws Exception {
        mockMvc.perform(get("/documents/v1/users/web-user/runs").param("limit", "0"))
               .andExpect(status().isBadRequest());

        verifyNoInteractions(runStatusService);
    }
}
