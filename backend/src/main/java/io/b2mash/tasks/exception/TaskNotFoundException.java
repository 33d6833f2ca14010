package io.b2mash.tasks.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when no task row has the requested id. The title is what clients see; the detail names
 * the id and only goes to the log.
 */
public class TaskNotFoundException extends ErrorResponseException {

  private final Long taskId;

  public TaskNotFoundException(Long taskId) {
    super(HttpStatus.NOT_FOUND, createProblem(taskId), null);
    this.taskId = taskId;
  }

  public Long getTaskId() {
    return taskId;
  }

  private static ProblemDetail createProblem(Long taskId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle("Task not found");
    problem.setDetail("No task found with id " + taskId);
    return problem;
  }
}
