package io.github.drompincen.aegis.gateway.controller;

import io.github.drompincen.aegis.protocol.api.FirewallStatsDto;
import io.github.drompincen.aegis.runtime.stats.FirewallStatsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/stats")
public class StatsController {

    private final FirewallStatsService statsService;

    public StatsController(FirewallStatsService statsService) {
        this.statsService = statsService;
    }

    @GetMapping
    public FirewallStatsDto stats() {
        return statsService.stats();
    }
}
