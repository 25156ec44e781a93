package com.rightsparser.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Health check endpoints.
 */
@RestController
@RequestMapping
public class HealthController {

    static final String SERVICE = "rights-parser";
    static final String VERSION = "1.0.0";

    private final Clock clock;
    private final Instant startedAt;

    public HealthController(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping({"/", "/api/health"})
    public Mono<Map<String, Object>> health() {
        return Mono.just(Map.of(
            "status", "healthy",
            "service", SERVICE,
            "version", VERSION,
            "uptime_seconds", Duration.between(startedAt, clock.instant()).getSeconds()
        ));
    }
}
