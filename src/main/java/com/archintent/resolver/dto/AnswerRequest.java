package com.archintent.resolver.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "Answer to a refinement question")
public class AnswerRequest {
    @Schema(description = "Id of the question being answered", required = true, example = "ownership:Integration & Event:notification-service")
    private String questionId;

    @Schema(description = "Answer value: yes/no, a component name, a domain name, an event or API name", example = "yes")
    private String answer;
}
