package com.archintent.resolver.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "Natural-language change request to analyze")
public class AnalysisRequest {
    @Schema(description = "Change request text", required = true,
            example = "When a premium customer submits a support ticket, show their priority status on the agent dashboard")
    private String text;
}
