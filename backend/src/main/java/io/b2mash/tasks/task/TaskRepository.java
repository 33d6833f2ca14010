package io.b2mash.tasks.task;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, Long> {

  /** All tasks, newest first. Ids break ties between tasks created in the same instant. */
  @Query("SELECT t FROM Task t ORDER BY t.createdAt DESC, t.id DESC")
  List<Task> findAllNewestFirst();

  @Query("SELECT t FROM Task t WHERE t.id = :id")
  Optional<Task> findOneById(@Param("id") Long id);
}
