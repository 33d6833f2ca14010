package io.b2mash.tasks.task;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class TaskPriorityConverter implements AttributeConverter<TaskPriority, String> {

  @Override
  public String convertToDatabaseColumn(TaskPriority priority) {
    return priority != null ? priority.value() : null;
  }

  @Override
  public TaskPriority convertToEntityAttribute(String column) {
    if (column == null) {
      return null;
    }
    return TaskPriority.fromValue(column)
        .orElseThrow(
            () -> new IllegalStateException("Unknown task priority in storage: " + column));
  }
}
