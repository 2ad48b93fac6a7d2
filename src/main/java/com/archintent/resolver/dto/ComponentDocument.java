package com.archintent.resolver.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * A catalog entry as written in the catalog file and as accepted by the registration endpoint.
 */
@Data
@Schema(description = "Component catalog entry")
public class ComponentDocument {
    @Schema(description = "Unique component name", required = true, example = "order-service")
    private String name;

    @Schema(description = "Owning domain, must exist in the ontology", required = true, example = "Order Management")
    private String domain;

    @Schema(description = "backend-service, frontend-app, shared-library or integration", example = "backend-service")
    private String type;

    @Schema(description = "Optional technology, unknown until discovered", example = "spring-boot")
    private String technology;

    @Schema(description = "Exposed API names")
    private List<String> apis = new ArrayList<>();

    @Schema(description = "Published event names")
    private List<String> publishes = new ArrayList<>();

    @Schema(description = "Consumed event names")
    private List<String> consumes = new ArrayList<>();
}
