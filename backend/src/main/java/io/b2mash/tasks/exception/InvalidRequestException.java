package io.b2mash.tasks.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when request input is missing or malformed. Results in HTTP 400 Bad Request. */
public class InvalidRequestException extends ErrorResponseException {

  public InvalidRequestException(String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid request");
    problem.setDetail(detail);
    return problem;
  }
}
