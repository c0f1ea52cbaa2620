package io.github.drompincen.aegis.gateway.controller;

import io.github.drompincen.aegis.protocol.api.AuditLogEntryDto;
import io.github.drompincen.aegis.runtime.audit.AuditService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    /** Most recent entries, returned oldest first. */
    @GetMapping
    public List<AuditLogEntryDto> recent(@RequestParam(required = false) String agent,
                                         @RequestParam(required = false, defaultValue = "10") int limit) {
        return auditService.recent(agent, Math.max(limit, 0));
    }
}
