package io.b2mash.tasks.task;

import java.util.Objects;
import java.util.Optional;

/**
 * A partial update of a task. An empty {@link Optional} means the field was not supplied and keeps
 * its current value; a present one replaces it. Values are raw and validated by {@link
 * TaskService#updateTask}.
 */
public record TaskUpdate(
    Optional<String> title,
    Optional<String> description,
    Optional<Boolean> completed,
    Optional<String> priority) {

  public TaskUpdate {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(description, "description");
    Objects.requireNonNull(completed, "completed");
    Objects.requireNonNull(priority, "priority");
  }

  /** Builds an update from nullable values, treating {@code null} as "not supplied". */
  public static TaskUpdate of(
      String title, String description, Boolean completed, String priority) {
    return new TaskUpdate(
        Optional.ofNullable(title),
        Optional.ofNullable(description),
        Optional.ofNullable(completed),
        Optional.ofNullable(priority));
  }

  /** Returns true if no field was supplied. */
  public boolean isEmpty() {
    return title.isEmpty() && description.isEmpty() && completed.isEmpty() && priority.isEmpty();
  }
}
