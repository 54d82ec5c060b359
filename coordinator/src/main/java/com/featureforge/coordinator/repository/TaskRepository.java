package com.featureforge.coordinator.repository;

import com.featureforge.coordinator.model.Task;
import com.featureforge.coordinator.model.TaskStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * CRUD + query operations for the tasks table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface TaskRepository extends JpaRepository<Task, String> {

    /**
     * Load a task and hold its row lock (SELECT ... FOR UPDATE) until the
     * surrounding transaction ends. Every read-check-write on a task goes
     * through this, so concurrent writers queue up instead of overwriting
     * each other.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Task t WHERE t.id = :id")
    Optional<Task> findByIdForUpdate(@Param("id") String id);

    /** Oldest task in the given status; the FIFO pick for QUEUED. */
    Optional<Task> findFirstByStatusOrderByCreatedAtAsc(TaskStatus status);

    List<Task> findByStatusInOrderByCreatedAtAsc(Collection<TaskStatus> statuses);

    List<Task> findByStatusOrderByCreatedAtDesc(TaskStatus status, Pageable page);

    List<Task> findAllByOrderByCreatedAtDesc(Pageable page);
}
