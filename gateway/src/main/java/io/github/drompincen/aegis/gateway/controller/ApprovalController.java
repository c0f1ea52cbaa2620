package io.github.drompincen.aegis.gateway.controller;

import io.github.drompincen.aegis.protocol.api.ApprovalRequestDto;
import io.github.drompincen.aegis.protocol.api.DecisionRequest;
import io.github.drompincen.aegis.runtime.approval.ApprovalService;
import io.github.drompincen.aegis.runtime.approval.ApprovalService.RespondResult;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Operator side of the approval workflow. Agents waiting on a request pick up
 * the decision on their next poll.
 */
@RestController
@RequestMapping("/api/approvals")
public class ApprovalController {

    private final ApprovalService approvalService;

    public ApprovalController(ApprovalService approvalService) {
        this.approvalService = approvalService;
    }

    @GetMapping("/pending")
    public List<ApprovalRequestDto> pending() {
        return approvalService.pending();
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApprovalRequestDto> get(@PathVariable long id) {
        return approvalService.get(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{id}/decide")
    public ResponseEntity<?> decide(@PathVariable long id, @RequestBody DecisionRequest request) {
        if (request == null || request.decision() == null || !request.decision().isOperatorDecision()) {
            return ResponseEntity.badRequest().body(Map.of("error", "decision must be APPROVED or DENIED"));
        }

        RespondResult result = approvalService.respond(id, request.decision());
        return switch (result) {
            case RESOLVED -> get(id);
            case NOT_FOUND -> ResponseEntity.notFound().build();
            case ALREADY_DECIDED -> ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "approval #" + id + " was already decided"));
        };
    }
}
