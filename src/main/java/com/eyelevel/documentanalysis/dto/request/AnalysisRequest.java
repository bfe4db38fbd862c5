package com.eyelevel.documentanalysis.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "Starts the analysis of an extracted run.")
public class AnalysisRequest {

    @NotBlank(message = "The 'userId' field is required.")
    @Schema(description = "The user owning the run.", example = "web-user")
    private String userId;

    @NotBlank(message = "The 'runId' field is required.")
    @Schema(description = "The run to analyze.")
    private String runId;

    @NotBlank(message = "The 'modelVariant' field is required.")
    @Schema(description = "The analysis variant: A (counter-guarantees) or B (social reports).", example = "A")
    private String modelVariant;

    @Schema(description = "The extracted text reference returned by the extraction call.", nullable = true)
    private String extractedTextReference;
}
