package com.eyelevel.documentanalysis.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "Starts text extraction for an uploaded document.")
public class ExtractionRequest {

    @NotBlank(message = "The 'userId' field is required.")
    @Schema(description = "The user owning the run.", example = "web-user")
    private String userId;

    @NotBlank(message = "The 'fileReference' field is required.")
    @Schema(description = "The object key the document was uploaded to.", example = "uploads/web-user/escaneo.png")
    private String fileReference;

    @Schema(description = "An existing run to extract. A new run is created when absent.", nullable = true)
    private String runId;
}
