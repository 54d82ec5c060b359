package com.featureforge.coordinator.repository;

import com.featureforge.coordinator.model.FileLock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

/**
 * Lock table queries. Only ChunkStore writes through this repository.
 */
public interface FileLockRepository extends JpaRepository<FileLock, String> {

    /** Locks currently held on any of the given paths. */
    List<FileLock> findByFilePathIn(Collection<String> filePaths);

    List<FileLock> findByChunkId(String chunkId);

    /** Delete every lock held by this actor for this chunk; returns the row count. */
    @Transactional
    @Modifying
    @Query("DELETE FROM FileLock l WHERE l.actor = :actor AND l.chunkId = :chunkId")
    int deleteByActorAndChunkId(@Param("actor") String actor, @Param("chunkId") String chunkId);

    /** Delete only the locks taken for one attempt of the chunk. */
    @Transactional
    @Modifying
    @Query("DELETE FROM FileLock l WHERE l.actor = :actor AND l.chunkId = :chunkId AND l.attempt = :attempt")
    int deleteByActorAndChunkIdAndAttempt(@Param("actor") String actor,
                                          @Param("chunkId") String chunkId,
                                          @Param("attempt") int attempt);
}
