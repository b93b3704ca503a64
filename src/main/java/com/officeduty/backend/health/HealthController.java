package com.officeduty.backend.health;

import java.time.Clock;
import java.time.Instant;

import org.springframework.boot.actuate.health.CompositeHealth;
import org.springframework.boot.actuate.health.HealthComponent;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Probes used by the container platform. {@code /readyz} reports the database contributor.
 */
@RestController
public class HealthController {

    private final HealthEndpoint healthEndpoint;
    private final Clock clock;

    public HealthController(HealthEndpoint healthEndpoint, Clock clock) {
        this.healthEndpoint = healthEndpoint;
        this.clock = clock;
    }

    @GetMapping("/healthz")
    public HealthResponse healthz() {
        return new HealthResponse(Status.UP.getCode(), Instant.now(clock).toString());
    }

    @GetMapping("/readyz")
    public ResponseEntity<HealthResponse> readyz() {
        HealthComponent overall = healthEndpoint.health();
        String status = overall.getStatus().getCode();
        if (overall instanceof CompositeHealth composite) {
            HealthComponent db = composite.getComponents().get("db");
            if (db != null) {
                status = db.getStatus().getCode();
            }
        }
        HttpStatus httpStatus = Status.UP.getCode().equals(status) ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
        return ResponseEntity.status(httpStatus).body(new HealthResponse(status, Instant.now(clock).toString()));
    }

    public record HealthResponse(
            String status,
            String timestamp
    ) {
    }
}
