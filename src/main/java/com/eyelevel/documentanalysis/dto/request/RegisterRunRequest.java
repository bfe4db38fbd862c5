package com.eyelevel.documentanalysis.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "Registers an uploaded document as a new run.")
public class RegisterRunRequest {

    @NotBlank(message = "The 'userId' field is required.")
    @Schema(description = "The user owning the run.", example = "web-user")
    private String userId;

    @NotBlank(message = "The 'fileReference' field is required.")
    @Schema(description = "The object key the document was uploaded to.", example = "uploads/web-user/contrato.pdf")
    private String fileReference;

    @Schema(description = "The analysis variant, if already chosen.", example = "A", nullable = true)
    private String modelVariant;

    @Schema(description = "A client-chosen run identifier. Generated when absent.", nullable = true)
    private String runId;
}
