package com.eyelevel.documentanalysis.controller;

import com.eyelevel.documentanalysis.dto.common.ApiResponse;
import com.eyelevel.documentanalysis.dto.request.AnalysisRequest;
import com.eyelevel.documentanalysis.dto.request.ExtractionRequest;
import com.eyelevel.documentanalysis.dto.request.RegisterRunRequest;
import com.eyelevel.documentanalysis.dto.run.RunStatusView;
import com.eyelevel.documentanalysis.dto.run.RunSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "Document Analysis Workflow", description = "Endpoints for running uploaded documents through extraction and analysis, and for following their progress.")
public interface DocumentAnalysisApi {

    @Operation(summary = "Register Run",
            description = "Registers an uploaded document as a new run in status UPLOADED. A run identifier is generated when none is supplied.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "201", description = "Run registered.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Missing fields or unsupported model variant.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - The run identifier is already taken for this user.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<RunSummary>> registerRun(@Valid @RequestBody RegisterRunRequest request);

    @Operation(summary = "Start Extraction",
            description = "Extracts the text of an uploaded document. Answers 200 when OCR finished within its budget, or 202 when the vision-model fallback continues in the background.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Text extracted.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Extracted", value = """
                                    {
                                        "displayMessage": "Text extracted successfully.",
                                        "response": {
                                            "runId": "3f2b1c9e-6f0a-4a51-9d0e-2f1b7c1d8e11",
                                            "status": "EXTRACTED",
                                            "extractedTextLength": 5123,
                                            "extractedTextReference": "extracted/3f2b1c9e-6f0a-4a51-9d0e-2f1b7c1d8e11.txt",
                                            "extractionMethod": "TEXTRACT"
                                        },
                                        "showMessage": false,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Extraction continues in the background. Poll the run status.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Extraction failed. The run is FAILED.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<RunStatusView>> startExtraction(@Valid @RequestBody ExtractionRequest request);

    @Operation(summary = "Start Analysis",
            description = "Analyzes the extracted text of a run with the prompt of model variant A or B. Answers 200 with the analysis, or 202 when the model call continues in the background.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Analysis completed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Analysis continues in the background. Poll the run status.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Bad Request - Unsupported model variant.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Run not found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409", description = "Conflict - Extraction has not completed.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "502", description = "Analysis failed. The run is FAILED.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<RunStatusView>> startAnalysis(@Valid @RequestBody AnalysisRequest request);

    @Operation(summary = "Get Run Status",
            description = "Returns the current state of a run. Clients poll this until the status is COMPLETED or FAILED.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Run status retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Run not found.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<RunStatusView>> getRunStatus(
            @Parameter(description = "The run identifier.", required = true) @PathVariable("runId") String runId,
            @Parameter(description = "The user owning the run.", required = true, example = "web-user")
            @RequestParam("userId") String userId);

    @Operation(summary = "Get Run History",
            description = "Lists a user's runs, newest first.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "History retrieved.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<List<RunSummary>>> getRunHistory(
            @Parameter(description = "The user whose runs to list.", required = true, example = "web-user")
            @PathVariable("userId") String userId,
            @Parameter(description = "The maximum number of runs to return. Defaults to 50, at most 200.", example = "50")
            @RequestParam(value = "limit", required = false) Integer limit);
}
