package io.b2mash.tasks.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error envelope written for every failed request. {@code path} is only set for requests that
 * matched no route.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String path) {

  public ErrorResponse(String error) {
    this(error, null);
  }
}
