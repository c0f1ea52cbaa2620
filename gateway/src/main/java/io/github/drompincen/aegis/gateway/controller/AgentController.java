package io.github.drompincen.aegis.gateway.controller;

import io.github.drompincen.aegis.protocol.api.AgentSummaryDto;
import io.github.drompincen.aegis.protocol.api.PolicyDto;
import io.github.drompincen.aegis.runtime.error.AgentNotFoundException;
import io.github.drompincen.aegis.runtime.killswitch.KillSwitchService;
import io.github.drompincen.aegis.runtime.registry.AgentRegistry;
import io.github.drompincen.aegis.runtime.stats.FirewallStatsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private final AgentRegistry agentRegistry;
    private final KillSwitchService killSwitch;
    private final FirewallStatsService statsService;

    public AgentController(AgentRegistry agentRegistry, KillSwitchService killSwitch,
                           FirewallStatsService statsService) {
        this.agentRegistry = agentRegistry;
        this.killSwitch = killSwitch;
        this.statsService = statsService;
    }

    /** Every agent with its audit counters and risk score. */
    @GetMapping
    public List<AgentSummaryDto> list() {
        return statsService.agents();
    }

    @GetMapping("/{name}")
    public ResponseEntity<AgentSummaryDto> get(@PathVariable String name) {
        return statsService.agent(name)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{name}/policies")
    public ResponseEntity<List<PolicyDto>> policies(@PathVariable String name) {
        if (agentRegistry.find(name).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(agentRegistry.policies(name));
    }

    /** Kill switch: every later call by this agent fails until it is revived. */
    @PostMapping("/{name}/pause")
    public ResponseEntity<AgentSummaryDto> pause(@PathVariable String name) {
        try {
            killSwitch.pause(name);
        } catch (AgentNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
        return get(name);
    }

    @PostMapping("/{name}/revive")
    public ResponseEntity<AgentSummaryDto> revive(@PathVariable String name) {
        try {
            killSwitch.revive(name);
        } catch (AgentNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
        return get(name);
    }
}
