package com.archintent.resolver.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "Manual acceptance of the current hypothesis for a question")
public class OverrideRequest {
    @Schema(description = "Id of the question to override", required = true)
    private String questionId;

    @Schema(description = "Optional note kept in the resolution log")
    private String note;
}
