package io.b2mash.tasks.task;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

@Entity
@Table(name = "tasks")
public class Task {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "title", nullable = false)
  private String title;

  @Column(name = "description")
  private String description;

  @Column(name = "completed", nullable = false)
  private boolean completed;

  @Convert(converter = TaskPriorityConverter.class)
  @Column(name = "priority", nullable = false, length = 10)
  private TaskPriority priority;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  public Task(String title, String description, TaskPriority priority) {
    this.title = title;
    this.description = description != null ? description : "";
    this.completed = false;
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.createdAt = now();
    this.updatedAt = this.createdAt;
  }

  /**
   * Replaces the mutable fields and refreshes {@code updatedAt}. Callers resolve omitted fields to
   * their current values before calling.
   */
  public void update(String title, String description, boolean completed, TaskPriority priority) {
    this.title = title;
    this.description = description;
    this.completed = completed;
    this.priority = priority;
    this.updatedAt = now();
  }

  /** Column precision is microseconds; anything finer would not survive a round trip. */
  private static Instant now() {
    return Instant.now().truncatedTo(ChronoUnit.MICROS);
  }

  public Long getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public boolean isCompleted() {
    return completed;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
