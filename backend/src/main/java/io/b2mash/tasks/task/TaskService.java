package io.b2mash.tasks.task;

import io.b2mash.tasks.exception.InvalidRequestException;
import io.b2mash.tasks.exception.TaskNotFoundException;
import jakarta.persistence.EntityManager;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Owns the task table: listing, lookup, creation, partial update and deletion of tasks. */
@Service
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskRepository taskRepository;
  private final EntityManager entityManager;

  public TaskService(TaskRepository taskRepository, EntityManager entityManager) {
    this.taskRepository = taskRepository;
    this.entityManager = entityManager;
  }

  @Transactional(readOnly = true)
  public List<Task> listTasks() {
    var tasks = taskRepository.findAllNewestFirst();
    log.debug("Found {} tasks", tasks.size());
    return tasks;
  }

  @Transactional(readOnly = true)
  public Task getTask(Long taskId) {
    return requireTask(taskId);
  }

  /**
   * Creates a task. The title is trimmed; an omitted description becomes the empty string and an
   * omitted priority becomes {@link TaskPriority#MEDIUM}.
   */
  @Transactional
  public Task createTask(String title, String description, String priority) {
    String validTitle = requireTitle(title);
    TaskPriority validPriority = priority != null ? requirePriority(priority) : TaskPriority.MEDIUM;

    var task = taskRepository.saveAndFlush(new Task(validTitle, description, validPriority));
    log.info("Created task {}", task.getId());

    return reload(task);
  }

  /**
   * Applies a partial update. Supplied fields are validated before the emptiness check, so a blank
   * title is reported as such even when it is the only field. {@code updatedAt} is always
   * refreshed.
   */
  @Transactional
  public Task updateTask(Long taskId, TaskUpdate update) {
    var task = requireTask(taskId);

    var title = update.title().map(TaskService::requireTitle);
    var priority = update.priority().map(TaskService::requirePriority);

    if (update.isEmpty()) {
      throw new InvalidRequestException("no fields to update");
    }

    task.update(
        title.orElse(task.getTitle()),
        update.description().orElse(task.getDescription()),
        update.completed().orElse(task.isCompleted()),
        priority.orElse(task.getPriority()));
    taskRepository.saveAndFlush(task);
    log.info("Updated task {}", taskId);

    return reload(task);
  }

  /** Deletes a task and returns it as it was immediately before deletion. */
  @Transactional
  public Task deleteTask(Long taskId) {
    var task = requireTask(taskId);
    taskRepository.delete(task);
    log.info("Deleted task {} ({})", taskId, task.getTitle());
    return task;
  }

  /** Evicts the managed instance so the returned task is read back from the table. */
  private Task reload(Task task) {
    entityManager.detach(task);
    return requireTask(task.getId());
  }

  private Task requireTask(Long taskId) {
    return taskRepository
        .findOneById(taskId)
        .orElseThrow(
            () -> {
              log.debug("Task {} not found", taskId);
              return new TaskNotFoundException(taskId);
            });
  }

  private static String requireTitle(String title) {
    if (title == null || title.isBlank()) {
      throw new InvalidRequestException("title required");
    }
    return title.strip();
  }

  private static TaskPriority requirePriority(String priority) {
    return TaskPriority.fromValue(priority)
        .orElseThrow(() -> new InvalidRequestException("invalid priority"));
  }
}
