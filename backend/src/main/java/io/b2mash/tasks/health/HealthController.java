package io.b2mash.tasks.health;

import java.time.Instant;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

  @GetMapping("/api/health")
  public ResponseEntity<HealthResponse> health() {
    return ResponseEntity.ok(new HealthResponse(true, "API is running", Instant.now()));
  }

  public record HealthResponse(boolean success, String message, Instant timestamp) {}
}
