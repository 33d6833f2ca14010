package io.b2mash.tasks.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/** Logs where the API is listening and which endpoints it serves once the application is ready. */
@Component
public class StartupBanner {

  private static final Logger log = LoggerFactory.getLogger(StartupBanner.class);

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady(ApplicationReadyEvent event) {
    Environment environment = event.getApplicationContext().getEnvironment();
    String port =
        environment.getProperty(
            "local.server.port", environment.getProperty("server.port", "3000"));
    String baseUrl = "http://localhost:" + port + "/api";

    log.info("Server listening on port {}", port);
    log.info("API available at {}", baseUrl);
    log.info("Health check at {}/health", baseUrl);
    log.info("Endpoints:");
    log.info("  GET    /api/tasks      - list tasks");
    log.info("  GET    /api/tasks/{id} - fetch a task");
    log.info("  POST   /api/tasks      - create a task");
    log.info("  PUT    /api/tasks/{id} - update a task");
    log.info("  DELETE /api/tasks/{id} - delete a task");
  }
}
