package com.eyelevel.documentanalysis.controller;

import com.eyelevel.documentanalysis.dto.common.ApiResponse;
import com.eyelevel.documentanalysis.dto.request.AnalysisRequest;
import com.eyelevel.documentanalysis.dto.request.ExtractionRequest;
import com.eyelevel.documentanalysis.dto.request.RegisterRunRequest;
import com.eyelevel.documentanalysis.dto.run.RunStatusView;
import com.eyelevel.documentanalysis.dto.run.RunSummary;
import com.eyelevel.documentanalysis.model.AnalysisRun;
import com.eyelevel.documentanalysis.service.analysis.AnalysisCoordinator;
import com.eyelevel.documentanalysis.service.extraction.ExtractionCoordinator;
import com.eyelevel.documentanalysis.service.run.RunRegistrationService;
import com.eyelevel.documentanalysis.service.status.RunStatusService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for document runs: registration, extraction, analysis, status and history.
 * All responses follow the standardized {@link ApiResponse} format.
 */
@Slf4j
@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
@Validated
public class DocumentAnalysisController implements DocumentAnalysisApi {

    private final RunRegistrationService runRegistrationService;
    private final ExtractionCoordinator extractionCoordinator;
    private final AnalysisCoordinator analysisCoordinator;
    private final RunStatusService runStatusService;

    @Override
    @PostMapping("/v1/runs")
    public ResponseEntity<ApiResponse<RunSummary>> registerRun(@Valid @RequestBody final RegisterRunRequest request) {
        log.info("Registering run for user: {}, file: {}", request.getUserId(), request.getFileReference());

        final AnalysisRun run = runRegistrationService.register(request.getUserId(), request.getRunId(),
                                                                request.getModelVariant(), request.getFileReference());

        ApiResponse<RunSummary> response = ApiResponse.<RunSummary>builder()
                                                      .response(RunSummary.of(run))
                                                      .displayMessage("Run registered successfully.")
                                                      .showMessage(false)
                                                      .statusCode(HttpStatus.CREATED.value())
                                                      .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @Override
    @PostMapping("/v1/extractions")
    public ResponseEntity<ApiResponse<RunStatusView>> startExtraction(
            @Valid @RequestBody final ExtractionRequest request) {
        log.info("Starting extraction for user: {}, file: {}, run: {}", request.getUserId(),
                 request.getFileReference(), request.getRunId());

        final AnalysisRun run = extractionCoordinator.startExtraction(request.getUserId(), request.getRunId(),
                                                                      request.getFileReference());
        return toRunResponse(run, "Text extracted successfully.", "Text extraction continues in the background.",
                             "Text extraction failed.");
    }

    @Override
    @PostMapping("/v1/analyses")
    public ResponseEntity<ApiResponse<RunStatusView>> startAnalysis(@Valid @RequestBody final AnalysisRequest request) {
        log.info("Starting analysis for user: {}, run: {}, model variant: {}", request.getUserId(), request.getRunId(),
                 request.getModelVariant());

        final AnalysisRun run = analysisCoordinator.analyze(request.getUserId(), request.getRunId(),
                                                            request.getModelVariant(),
                                                            request.getExtractedTextReference());
        return toRunResponse(run, "Analysis completed successfully.", "Analysis continues in the background.",
                             "Analysis failed.");
    }

    @Override
    @GetMapping("/v1/runs/{runId}/status")
    public ResponseEntity<ApiResponse<RunStatusView>> getRunStatus(
            @PathVariable("runId") @NotBlank(message = "The 'runId' cannot be empty.") final String runId,
            @RequestParam("userId") @NotBlank(message = "The 'userId' parameter cannot be empty.") final String userId) {
        log.debug("Fetching status of run {}/{}", userId, runId);

        ApiResponse<RunStatusView> response = ApiResponse.<RunStatusView>builder()
                                                         .response(runStatusService.getStatus(userId, runId))
                                                         .displayMessage("Run status retrieved successfully.")
                                                         .showMessage(false)
                                                         .statusCode(HttpStatus.OK.value())
                                                         .build();
        return ResponseEntity.ok(response);
    }

    @Override
    @GetMapping("/v1/users/{userId}/runs")
    public ResponseEntity<ApiResponse<List<RunSummary>>> getRunHistory(
            @PathVariable("userId") @NotBlank(message = "The 'userId' cannot be empty.") final String userId,
            @RequestParam(value = "limit", required = false) @Positive(message = "The 'limit' must be a positive number.") final Integer limit) {
        log.debug("Fetching run history for user: {}, limit: {}", userId, limit);

        ApiResponse<List<RunSummary>> response = ApiResponse.<List<RunSummary>>builder()
                                                            .response(runStatusService.getHistory(userId, limit))
                                                            .displayMessage("Run history retrieved successfully.")
                                                            .showMessage(false)
                                                            .statusCode(HttpStatus.OK.value())
                                                            .build();
        return ResponseEntity.ok(response);
    }

    /**
     * Failed runs answer 502, runs still in flight 202, settled runs 200.
     */
    private static ResponseEntity<ApiResponse<RunStatusView>> toRunResponse(final AnalysisRun run,
                                                                           final String doneMessage,
                                                                           final String pendingMessage,
                                                                           final String failedMessage) {
        final HttpStatus httpStatus;
        final String message;
        switch (run.getStatus()) {
            case FAILED -> {
                httpStatus = HttpStatus.BAD_GATEWAY;
                message = failedMessage;
            }
            case UPLOADED, EXTRACTING, ANALYZING, PROCESSING_ASYNC -> {
                httpStatus = HttpStatus.ACCEPTED;
                message = pendingMessage;
            }
            default -> {
                httpStatus = HttpStatus.OK;
                message = doneMessage;
            }
        }

        ApiResponse<RunStatusView> response = ApiResponse.<RunStatusView>builder()
                                                         .response(RunStatusView.of(run))
                                                         .displayMessage(message)
                                                         .showMessage(httpStatus != HttpStatus.OK)
                                                         .statusCode(httpStatus.value())
                                                         .build();
        return ResponseEntity.status(httpStatus).body(response);
    }
}
