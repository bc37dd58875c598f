package com.jiralert.adapter.web;

import org.springframework.boot.availability.ApplicationAvailability;
import org.springframework.boot.availability.ReadinessState;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;

/**
 * Liveness and readiness probes. Neither calls Jira.
 *
 * <p>Readiness follows the application's {@link ReadinessState}: traffic is
 * refused until startup has completed, and again once shutdown begins.</p>
 */
@RestController
public class HealthController {

    private final ApplicationAvailability availability;

    public HealthController(ApplicationAvailability availability) {
        this.availability = availability;
    }

    @GetMapping(path = "/-/health", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<String> health() {
        return Mono.just("OK");
    }

    @GetMapping(path = "/-/ready", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> ready() {
        if (availability.getReadinessState() != ReadinessState.ACCEPTING_TRAFFIC) {
            return Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body("Not ready yet"));
        }
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
