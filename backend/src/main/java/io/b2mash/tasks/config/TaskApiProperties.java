package io.b2mash.tasks.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the task API.
 *
 * @param cors cross-origin settings applied to {@code /api/**}
 */
@ConfigurationProperties(prefix = "tasks.api")
public record TaskApiProperties(Cors cors) {

  public TaskApiProperties {
    cors = cors != null ? cors : new Cors(List.of());
  }

  /**
   * @param allowedOrigins origins allowed to call the API; empty allows any origin
   */
  public record Cors(List<String> allowedOrigins) {

    public Cors {
      allowedOrigins = allowedOrigins != null ? List.copyOf(allowedOrigins) : List.of();
    }
  }
}
