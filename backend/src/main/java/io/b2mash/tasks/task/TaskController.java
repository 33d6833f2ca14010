package io.b2mash.tasks.task;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

  private final TaskService taskService;

  public TaskController(TaskService taskService) {
    this.taskService = taskService;
  }

  @GetMapping
  public ResponseEntity<TaskListResponse> listTasks() {
    var tasks = taskService.listTasks().stream().map(TaskResponse::from).toList();
    return ResponseEntity.ok(new TaskListResponse(true, tasks, tasks.size()));
  }

  @GetMapping("/{id}")
  public ResponseEntity<TaskDataResponse> getTask(@PathVariable Long id) {
    var task = taskService.getTask(id);
    return ResponseEntity.ok(new TaskDataResponse(true, TaskResponse.from(task)));
  }

  @PostMapping
  public ResponseEntity<TaskMessageResponse> createTask(
      @Valid @RequestBody CreateTaskRequest request) {
    var task = taskService.createTask(request.title(), request.description(), request.priority());
    return ResponseEntity.created(URI.create("/api/tasks/" + task.getId()))
        .body(
            new TaskMessageResponse(true, "Task created successfully", TaskResponse.from(task)));
  }

  @PutMapping("/{id}")
  public ResponseEntity<TaskMessageResponse> updateTask(
      @PathVariable Long id, @RequestBody UpdateTaskRequest request) {
    var task = taskService.updateTask(id, request.toUpdate());
    return ResponseEntity.ok(
        new TaskMessageResponse(true, "Task updated successfully", TaskResponse.from(task)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<TaskMessageResponse> deleteTask(@PathVariable Long id) {
    var task = taskService.deleteTask(id);
    return ResponseEntity.ok(
        new TaskMessageResponse(true, "Task deleted successfully", TaskResponse.from(task)));
  }

  // --- DTOs ---

  public record CreateTaskRequest(
      @NotBlank(message = "title required") String title, String description, String priority) {}

  /**
   * Request body for a partial update. Omitted and {@code null} fields are left unchanged. {@code
   * completed} accepts any JSON scalar and is coerced to a boolean: {@code false}, {@code 0} and
   * the empty string are false, everything else is true.
   */
  public record UpdateTaskRequest(
      String title, String description, Object completed, String priority) {

    TaskUpdate toUpdate() {
      return TaskUpdate.of(
          title, description, completed != null ? coerceToBoolean(completed) : null, priority);
    }

    private static boolean coerceToBoolean(Object value) {
      if (value instanceof Boolean bool) {
        return bool;
      }
      if (value instanceof Number number) {
        return number.doubleValue() != 0;
      }
      if (value instanceof String text) {
        return !text.isEmpty();
      }
      return true;
    }
  }

  public record TaskResponse(
      Long id,
      String title,
      String description,
      boolean completed,
      TaskPriority priority,
      Instant createdAt,
      Instant updatedAt) {

    public static TaskResponse from(Task task) {
      return new TaskResponse(
          task.getId(),
          task.getTitle(),
          task.getDescription(),
          task.isCompleted(),
          task.getPriority(),
          task.getCreatedAt(),
          task.getUpdatedAt());
    }
  }

  public record TaskListResponse(boolean success, List<TaskResponse> data, int count) {}

  public record TaskDataResponse(boolean success, TaskResponse data) {}

  public record TaskMessageResponse(boolean success, String message, TaskResponse data) {}
}
