package com.featureforge.coordinator.repository;

import com.featureforge.coordinator.model.Chunk;
import com.featureforge.coordinator.model.ChunkStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * CRUD + scheduler queries for the chunks table.
 */
public interface ChunkRepository extends JpaRepository<Chunk, String> {

    /** Load a chunk holding its row lock until the surrounding transaction ends. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM Chunk c WHERE c.id = :id")
    Optional<Chunk> findByIdForUpdate(@Param("id") String id);

    /** All chunks of a task, in creation order (ties broken by id). */
    List<Chunk> findByTaskIdOrderByCreatedAtAscIdAsc(String taskId);

    List<Chunk> findByStatusOrderByCreatedAtAsc(ChunkStatus status);

    List<Chunk> findAllByOrderByCreatedAtAsc();

    /** IN_PROGRESS chunks whose assignment started before 'cutoff'. */
    List<Chunk> findByStatusAndStartedAtBefore(ChunkStatus status, Instant cutoff);

    long countByTaskId(String taskId);
}
