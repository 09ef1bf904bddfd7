package io.github.drompincen.turnstile.gateway.controller;

import io.github.drompincen.turnstile.gateway.service.ThreadAgents;
import io.github.drompincen.turnstile.protocol.api.ApprovalResponseRequest;
import io.github.drompincen.turnstile.protocol.api.PendingApprovalDto;
import io.github.drompincen.turnstile.protocol.api.TurnOutcomeDto;
import io.github.drompincen.turnstile.runtime.agent.TurnOutcome;
import io.github.drompincen.turnstile.runtime.thread.ThreadStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

@RestController
@RequestMapping("/api/threads/{threadId}/approvals")
public class ApprovalController {

    private final ThreadStore threadStore;
    private final ThreadAgents agents;

    public ApprovalController(ThreadStore threadStore, ThreadAgents agents) {
        this.threadStore = threadStore;
        this.agents = agents;
    }

    @GetMapping
    public List<PendingApprovalDto> pending(@PathVariable String threadId) {
        agents.requireThread(threadId);
        return threadStore.getPendingApprovals(threadId).stream()
                .map(p -> new PendingApprovalDto(p.toolCallId(), p.toolCall().name(), p.toolCall().arguments(),
                        p.requestedAt()))
                .toList();
    }

    @PostMapping("/{toolCallId}")
    public ResponseEntity<TurnOutcomeDto> respond(@PathVariable String threadId, @PathVariable String toolCallId,
                                                  @RequestBody ApprovalResponseRequest req) {
        if (req == null || req.decision() == null) {
            throw new IllegalArgumentException("decision is required");
        }
        Optional<TurnOutcome> outcome = agents.await(agents.agentFor(threadId).respondToApproval(toolCallId, req.decision()));
        if (outcome.isEmpty()) {
            return ResponseEntity.accepted()
                    .body(new TurnOutcomeDto(threadId, ThreadController.RUNNING, List.of(), null));
        }
        return ResponseEntity.ok(ThreadController.toDto(threadId, outcome.get()));
    }
}
