package com.archintent.resolver.controller;

import com.archintent.resolver.dto.AnalysisRequest;
import com.archintent.resolver.dto.AnswerRequest;
import com.archintent.resolver.dto.OverrideRequest;
import com.archintent.resolver.dto.SessionView;
import com.archintent.resolver.model.AnswerOutcome;
import com.archintent.resolver.model.Hypothesis;
import com.archintent.resolver.model.OpenQuestion;
import com.archintent.resolver.service.HypothesisAssemblerService;
import com.archintent.resolver.service.IntentAnalysisService;
import com.archintent.resolver.service.RefinementSession;
import com.archintent.resolver.service.RefinementSessionRegistry;
import com.archintent.resolver.service.UnknownQuestionException;
import com.archintent.resolver.service.UnknownSessionException;
import com.google.common.util.concurrent.RateLimiter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/intent")
@Tag(name = "Intent Resolution", description = "Change-request analysis and refinement dialogue")
public class IntentSessionController {

    private static final Logger logger = LoggerFactory.getLogger(IntentSessionController.class);

    private final IntentAnalysisService intentAnalysisService;
    private final RefinementSessionRegistry sessionRegistry;
    private final HypothesisAssemblerService assemblerService;
    private final RateLimiter analysisRateLimiter;

    public IntentSessionController(IntentAnalysisService intentAnalysisService,
                                   RefinementSessionRegistry sessionRegistry,
                                   HypothesisAssemblerService assemblerService,
                                   @Qualifier("analysisRateLimiter") RateLimiter analysisRateLimiter) {
        this.intentAnalysisService = intentAnalysisService;
        this.sessionRegistry = sessionRegistry;
        this.assemblerService = assemblerService;
        this.analysisRateLimiter = analysisRateLimiter;
    }

    @Operation(
            summary = "One-shot analysis",
            description = "Tags, scores and resolves the change request and returns the hypothesis without refinement. " +
                    "Open questions are listed in the hypothesis."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Hypothesis produced",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = Hypothesis.class))),
            @ApiResponse(responseCode = "400", description = "Text is null or empty", content = @Content),
            @ApiResponse(responseCode = "429", description = "Analysis rate limit exceeded", content = @Content)
    })
    @PostMapping("/analyze")
    @SuppressWarnings("UnstableApiUsage")
    public ResponseEntity<Hypothesis> analyze(@RequestBody(required = false) AnalysisRequest request) {
        if (request == null || !StringUtils.hasText(request.getText())) {
            return ResponseEntity.badRequest().build();
        }
        if (!analysisRateLimiter.tryAcquire()) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).build();
        }
        return ResponseEntity.ok(intentAnalysisService.analyze(request.getText()));
    }

    @Operation(
            summary = "Start a refinement session",
            description = "Analyzes the change request and dispatches the first question, if any."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Session created",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = SessionView.class))),
            @ApiResponse(responseCode = "400", description = "Text is null or empty", content = @Content),
            @ApiResponse(responseCode = "429", description = "Analysis rate limit exceeded", content = @Content)
    })
    @PostMapping("/sessions")
    @SuppressWarnings("UnstableApiUsage")
    public ResponseEntity<SessionView> startSession(@RequestBody(required = false) AnalysisRequest request) {
        if (request == null || !StringUtils.hasText(request.getText())) {
            return ResponseEntity.badRequest().build();
        }
        if (!analysisRateLimiter.tryAcquire()) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).build();
        }
        RefinementSession session = sessionRegistry.register(intentAnalysisService.startSession(request.getText()));
        return ResponseEntity.ok(view(session, null));
    }

    @Operation(summary = "Get the question currently awaiting an answer")
    @GetMapping("/sessions/{sessionId}/next-question")
    public ResponseEntity<SessionView> nextQuestion(
            @Parameter(description = "Session id", required = true) @PathVariable UUID sessionId) {
        try {
            RefinementSession session = sessionRegistry.get(sessionId);
            OpenQuestion question = session.nextQuestion().orElse(null);
            return ResponseEntity.ok(new SessionView(session.id(), session.state(), question, null, null));
        } catch (UnknownSessionException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(
            summary = "Answer a question",
            description = "Applies the answer and dispatches the next question. A STALLED state means the answer " +
                    "did not resolve anything; answer differently or override."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Answer processed"),
            @ApiResponse(responseCode = "400", description = "Question id missing", content = @Content),
            @ApiResponse(responseCode = "404", description = "Unknown session or question", content = @Content),
            @ApiResponse(responseCode = "409", description = "Question already answered", content = @Content)
    })
    @PostMapping("/sessions/{sessionId}/answers")
    public ResponseEntity<SessionView> answer(@PathVariable UUID sessionId,
                                              @RequestBody(required = false) AnswerRequest request) {
        if (request == null || !StringUtils.hasText(request.getQuestionId())) {
            return ResponseEntity.badRequest().build();
        }
        try {
            RefinementSession session = sessionRegistry.get(sessionId);
            AnswerOutcome outcome = session.answer(request.getQuestionId(), request.getAnswer());
            return ResponseEntity.ok(view(session, outcome));
        } catch (UnknownSessionException | UnknownQuestionException e) {
            logger.debug("Answer rejected: {}", e.getMessage());
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    @Operation(summary = "Manually accept the current hypothesis for a question")
    @PostMapping("/sessions/{sessionId}/overrides")
    public ResponseEntity<SessionView> override(@PathVariable UUID sessionId,
                                                @RequestBody(required = false) OverrideRequest request) {
        if (request == null || !StringUtils.hasText(request.getQuestionId())) {
            return ResponseEntity.badRequest().build();
        }
        try {
            RefinementSession session = sessionRegistry.get(sessionId);
            AnswerOutcome outcome = session.override(request.getQuestionId(), request.getNote());
            return ResponseEntity.ok(view(session, outcome));
        } catch (UnknownSessionException | UnknownQuestionException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).build();
        }
    }

    @Operation(summary = "Current hypothesis snapshot of a session")
    @GetMapping("/sessions/{sessionId}/hypothesis")
    public ResponseEntity<Hypothesis> hypothesis(@PathVariable UUID sessionId) {
        try {
            return ResponseEntity.ok(assemblerService.assemble(sessionRegistry.get(sessionId)));
        } catch (UnknownSessionException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Abandon a session", description = "Discards the session state; nothing else is affected.")
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> abandon(@PathVariable UUID sessionId) {
        try {
            sessionRegistry.abandon(sessionId);
            return ResponseEntity.noContent().build();
        } catch (UnknownSessionException e) {
            return ResponseEntity.notFound().build();
        }
    }

    private SessionView view(RefinementSession session, AnswerOutcome outcome) {
        OpenQuestion next = session.nextQuestion().orElse(null);
        return new SessionView(session.id(), session.state(), next, outcome, assemblerService.assemble(session));
    }
}
