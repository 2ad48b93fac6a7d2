package com.archintent.resolver.controller;

import com.archintent.resolver.dto.ComponentDocument;
import com.archintent.resolver.model.ComponentDescriptor;
import com.archintent.resolver.model.DiscoveryMatch;
import com.archintent.resolver.model.Ontology;
import com.archintent.resolver.repository.ComponentCatalogRepository;
import com.archintent.resolver.service.DiscoveryBackend;
import com.archintent.resolver.service.OntologyLoader;
import com.archintent.resolver.service.OntologyValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/catalog")
@Tag(name = "Component Catalog", description = "Catalog listing, registration and discovery search")
public class CatalogController {

    private static final Logger logger = LoggerFactory.getLogger(CatalogController.class);

    private final ComponentCatalogRepository catalogRepository;
    private final DiscoveryBackend discoveryBackend;
    private final OntologyLoader ontologyLoader;
    private final Ontology ontology;

    public CatalogController(ComponentCatalogRepository catalogRepository,
                             DiscoveryBackend discoveryBackend,
                             OntologyLoader ontologyLoader,
                             Ontology ontology) {
        this.catalogRepository = catalogRepository;
        this.discoveryBackend = discoveryBackend;
        this.ontologyLoader = ontologyLoader;
        this.ontology = ontology;
    }

    @Operation(summary = "List registered components in insertion order")
    @GetMapping("/components")
    public List<ComponentDescriptor> components() {
        return catalogRepository.snapshot().components();
    }

    @Operation(summary = "Register a component", description = "The component's domain must exist in the ontology.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Component registered",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ComponentDescriptor.class))),
            @ApiResponse(responseCode = "400", description = "Invalid entry, unknown domain or duplicate name", content = @Content)
    })
    @PostMapping("/components")
    public ResponseEntity<ComponentDescriptor> register(@RequestBody(required = false) ComponentDocument request) {
        if (request == null) {
            return ResponseEntity.badRequest().build();
        }
        try {
            ComponentDescriptor descriptor = ontologyLoader.toDescriptor(request, ontology, "registration");
            return ResponseEntity.ok(catalogRepository.register(descriptor));
        } catch (OntologyValidationException | IllegalArgumentException e) {
            logger.warn("Component registration rejected: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).build();
        }
    }

    @Operation(summary = "Ranked discovery search of the catalog for business-context terms")
    @GetMapping("/discover")
    public List<DiscoveryMatch> discover(
            @Parameter(description = "Business-context terms", required = true) @RequestParam List<String> terms) {
        return discoveryBackend.discover(terms);
    }
}
