package com.bko.conductor.api;

import com.bko.conductor.orchestration.OrchestrationRun;
import com.bko.conductor.orchestration.OrchestratorService;
import com.bko.conductor.orchestration.model.OrchestrationSnapshot;
import com.bko.conductor.stream.OrchestrationStreamService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private final OrchestratorService orchestratorService;
    private final OrchestrationStreamService streamService;

    public ChatController(OrchestratorService orchestratorService, OrchestrationStreamService streamService) {
        this.orchestratorService = orchestratorService;
        this.streamService = streamService;
    }

    @PostMapping
    public ChatResponse chat(@Valid @RequestBody ChatRequest request) {
        return ChatResponse.from(orchestratorService.run(request.message(), request.toRunOptions()));
    }

    @PostMapping("/stream")
    public ChatStreamResponse stream(@Valid @RequestBody ChatRequest request) {
        String runId = streamService.createRun();
        streamService.emitStatus(runId, "Queued");
        OrchestrationRun run = orchestratorService.startRun(runId, request.message(), request.toRunOptions(),
                streamService.listenerFor(runId));
        run.completion().thenAccept(result -> streamService.emitResult(runId, result));
        return new ChatStreamResponse(runId, Instant.now());
    }

    @GetMapping("/{runId}")
    public ResponseEntity<OrchestrationSnapshot> snapshot(@PathVariable String runId) {
        return ResponseEntity.of(orchestratorService.snapshot(runId));
    }

    @PostMapping("/{runId}/approve")
    public ResponseEntity<ReviewDecisionResponse> approve(@PathVariable String runId) {
        return reviewResponse(ReviewDecisionResponse.from(orchestratorService.approve(runId), "approved"));
    }

    @PostMapping("/{runId}/reject")
    public ResponseEntity<ReviewDecisionResponse> reject(@PathVariable String runId) {
        return reviewResponse(ReviewDecisionResponse.from(orchestratorService.reject(runId), "rejected"));
    }

    @PostMapping("/cancel/{runId}")
    public CancelRunResponse cancelStream(@PathVariable String runId) {
        return cancel(runId);
    }

    @PostMapping("/cancel")
    public CancelRunResponse cancelStream(@Valid @RequestBody CancelRunRequest request) {
        return cancel(request.runId());
    }

    private CancelRunResponse cancel(String runId) {
        if (!orchestratorService.cancel(runId)) {
            return CancelRunResponse.notFound();
        }
        streamService.cancelRun(runId);
        return CancelRunResponse.success();
    }

    private static ResponseEntity<ReviewDecisionResponse> reviewResponse(ReviewDecisionResponse body) {
        HttpStatus status = switch (body.status()) {
            case "not-found" -> HttpStatus.NOT_FOUND;
            case "conflict" -> HttpStatus.CONFLICT;
            default -> HttpStatus.OK;
        };
        return ResponseEntity.status(status).body(body);
    }
}
