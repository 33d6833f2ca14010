package io.b2mash.tasks.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(TaskApiProperties.class)
public class CorsConfig implements WebMvcConfigurer {

  private final TaskApiProperties properties;

  public CorsConfig(TaskApiProperties properties) {
    this.properties = properties;
  }

  @Override
  public void addCorsMappings(CorsRegistry registry) {
    var origins = properties.cors().allowedOrigins();
    registry
        .addMapping("/api/**")
        .allowedOrigins(origins.isEmpty() ? new String[] {"*"} : origins.toArray(String[]::new))
        .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
        .allowedHeaders("*")
        .maxAge(3600L);
  }
}
