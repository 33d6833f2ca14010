package io.b2mash.tasks.task;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.Optional;

/** Urgency tag of a task. Serialized and stored by its lower-case value. */
public enum TaskPriority {
  LOW("low"),
  MEDIUM("medium"),
  HIGH("high");

  private final String value;

  TaskPriority(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** Resolves a wire value. Matching is exact and case-sensitive. */
  public static Optional<TaskPriority> fromValue(String value) {
    return Arrays.stream(values()).filter(p -> p.value.equals(value)).findFirst();
  }
}
