package com.featureforge.coordinator.service;

import com.featureforge.coordinator.model.Chunk;
import com.featureforge.coordinator.model.ChunkStatus;
import com.featureforge.coordinator.model.FileLock;
import com.featureforge.coordinator.repository.ChunkRepository;
import com.featureforge.coordinator.repository.FileLockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Persistent state of chunks and file locks.
 *
 * acquire() is the only multi-row atomic operation in the system. The
 * check for existing locks and the insert of the new ones run in a single
 * transaction while holding a store-wide mutex; the file_path primary key
 * catches anything the mutex cannot see (another process on the same DB).
 *
 * Lock rows record the chunk attempt they were taken for. A chunk's
 * attempt count only grows, so it doubles as the token that tells the
 * current run of a chunk from a superseded one: completeAttempt,
 * recordFailedAttempt(id, attempt) and release(actor, id, attempt) act
 * only for the run they name.
 *
 * Storage failures surface as Spring DataAccessException.
 */
@Service
public class ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(ChunkStore.class);

    private final ChunkRepository     chunkRepo;
    private final FileLockRepository  lockRepo;
    private final TransactionTemplate tx;

    // Serialises acquire() within this process.
    private final ReentrantLock acquireMutex = new ReentrantLock();

    public ChunkStore(ChunkRepository chunkRepo,
                      FileLockRepository lockRepo,
                      PlatformTransactionManager txManager) {
        this.chunkRepo = chunkRepo;
        this.lockRepo  = lockRepo;
        this.tx        = new TransactionTemplate(txManager);
    }

    // ------------------------------------------------------------------
    // File locks
    // ------------------------------------------------------------------

    /**
     * Lock every file in {@code files} for (actor, chunkId), or none of them.
     *
     * @return true if all locks were taken; false if any file is already
     *         locked (by anyone, including this actor)
     * @throws IllegalArgumentException if {@code files} is empty
     */
    public boolean acquire(String actor, String chunkId, Collection<String> files) {
        return acquire(actor, chunkId, 0, files);
    }

    /**
     * As {@link #acquire(String, String, Collection)}, tagging the locks with
     * the chunk attempt they are taken for.
     */
    public boolean acquire(String actor, String chunkId, int attempt, Collection<String> files) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("Chunk " + chunkId + " declares no files to lock");
        }
        Set<String> paths = new LinkedHashSet<>(files);

        acquireMutex.lock();
        try {
            Boolean acquired = tx.execute(status -> {
                List<FileLock> held = lockRepo.findByFilePathIn(paths);
                if (!held.isEmpty()) {
                    log.debug("Chunk {} deferred: {} already locked", chunkId,
                            held.stream().map(FileLock::getFilePath).collect(Collectors.toList()));
                    return false;
                }
                lockRepo.saveAllAndFlush(paths.stream()
                        .map(path -> new FileLock(path, actor, chunkId, attempt))
                        .collect(Collectors.toList()));
                return true;
            });
            if (Boolean.TRUE.equals(acquired)) {
                log.info("Actor '{}' locked {} file(s) for chunk {}", actor, paths.size(), chunkId);
                return true;
            }
            return false;
        } catch (DataIntegrityViolationException e) {
            // Another holder committed between our check and insert; the whole insert rolled back.
            log.info("Lock race lost for chunk {}: {}", chunkId, e.getMostSpecificCause().getMessage());
            return false;
        } finally {
            acquireMutex.unlock();
        }
    }

    /**
     * Drop every lock held by (actor, chunkId). Safe to call repeatedly.
     *
     * @return number of locks removed (0 when nothing was held)
     */
    public int release(String actor, String chunkId) {
        int removed = lockRepo.deleteByActorAndChunkId(actor, chunkId);
        if (removed > 0) {
            log.info("Actor '{}' released {} lock(s) for chunk {}", actor, removed, chunkId);
        }
        return removed;
    }

    /**
     * Drop the locks (actor, chunkId) took for one attempt. Locks taken for
     * any other attempt of the chunk stay in place.
     */
    public int release(String actor, String chunkId, int attempt) {
        int removed = lockRepo.deleteByActorAndChunkIdAndAttempt(actor, chunkId, attempt);
        if (removed > 0) {
            log.info("Actor '{}' released {} lock(s) for chunk {} attempt {}", actor, removed, chunkId, attempt);
        }
        return removed;
    }

    @Transactional(readOnly = true)
    public List<FileLock> locks() {
        return lockRepo.findAll();
    }

    @Transactional(readOnly = true)
    public Set<String> lockedFiles() {
        return lockRepo.findAll().stream()
                .map(FileLock::getFilePath)
                .collect(Collectors.toSet());
    }

    @Transactional(readOnly = true)
    public List<FileLock> locksForChunk(String chunkId) {
        return lockRepo.findByChunkId(chunkId);
    }

    // ------------------------------------------------------------------
    // Chunks
    // ------------------------------------------------------------------

    @Transactional
    public Chunk createChunk(Chunk chunk) {
        return chunkRepo.save(chunk);
    }

    /** Insert a whole decomposition at once: either every chunk exists afterwards or none does. */
    @Transactional
    public List<Chunk> createChunks(List<Chunk> chunks) {
        List<Chunk> saved = chunkRepo.saveAll(chunks);
        log.info("Created {} chunk(s)", saved.size());
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Chunk> getChunk(String chunkId) {
        return chunkRepo.findById(chunkId);
    }

    /** All chunks, or only those in {@code status} when it is non-null. */
    @Transactional(readOnly = true)
    public List<Chunk> listChunks(ChunkStatus status) {
        return status == null
                ? chunkRepo.findAllByOrderByCreatedAtAsc()
                : chunkRepo.findByStatusOrderByCreatedAtAsc(status);
    }

    @Transactional(readOnly = true)
    public List<Chunk> listChunksForTask(String taskId) {
        return chunkRepo.findByTaskIdOrderByCreatedAtAscIdAsc(taskId);
    }

    /**
     * Change a chunk's status, optionally setting its worker and integration
     * handle. Null optional arguments leave the stored values untouched.
     *
     * @throws NoSuchElementException          if the chunk does not exist
     * @throws IllegalChunkTransitionException if the move is not a legal transition
     */
    @Transactional
    public Chunk updateStatus(String chunkId, ChunkStatus next,
                              String assignedWorker, String integrationHandle) {
        Chunk chunk = requireForUpdate(chunkId);
        ChunkStatus current = chunk.getStatus();
        if (current != next && !current.canTransitionTo(next)) {
            throw new IllegalChunkTransitionException(chunkId, current, next);
        }

        chunk.setStatus(next);
        if (next == ChunkStatus.IN_PROGRESS && current != ChunkStatus.IN_PROGRESS) {
            chunk.setStartedAt(Instant.now());
        }
        if (assignedWorker != null)    chunk.setAssignedWorker(assignedWorker);
        if (integrationHandle != null) chunk.setIntegrationHandle(integrationHandle);

        log.debug("Chunk {}: {} -> {}", chunkId, current, next);
        return chunkRepo.save(chunk);
    }

    public Chunk updateStatus(String chunkId, ChunkStatus next) {
        return updateStatus(chunkId, next, null, null);
    }

    /**
     * Mark the run {@code attempt} of a chunk COMPLETE with its integration
     * handle.
     *
     * @return false, changing nothing, when the chunk is no longer
     *         IN_PROGRESS for that attempt (the run was superseded or
     *         already reported)
     */
    @Transactional
    public boolean completeAttempt(String chunkId, int attempt, String integrationHandle) {
        Chunk chunk = requireForUpdate(chunkId);
        if (chunk.getStatus() != ChunkStatus.IN_PROGRESS || chunk.getAttempts() != attempt) {
            log.warn("Ignoring completion of chunk {} attempt {}: chunk is {} at attempt {}",
                    chunkId, attempt, chunk.getStatus(), chunk.getAttempts());
            return false;
        }
        chunk.setStatus(ChunkStatus.COMPLETE);
        chunk.setIntegrationHandle(integrationHandle);
        chunkRepo.save(chunk);
        log.debug("Chunk {}: IN_PROGRESS -> COMPLETE ({})", chunkId, integrationHandle);
        return true;
    }

    /**
     * Count a failed attempt and put the chunk back to PLANNED so it can be
     * scheduled again. A chunk that is no longer IN_PROGRESS is returned
     * unchanged (its attempt was already accounted for).
     */
    @Transactional
    public Chunk recordFailedAttempt(String chunkId) {
        Chunk chunk = requireForUpdate(chunkId);
        if (chunk.getStatus() != ChunkStatus.IN_PROGRESS) {
            log.warn("Ignoring failed attempt for chunk {} in status {}", chunkId, chunk.getStatus());
            return chunk;
        }
        return retry(chunk);
    }

    /**
     * As {@link #recordFailedAttempt(String)}, but only for the run
     * {@code attempt}.
     *
     * @return the chunk back in PLANNED, or empty when that run is no longer
     *         the chunk's current one
     */
    @Transactional
    public Optional<Chunk> recordFailedAttempt(String chunkId, int attempt) {
        Chunk chunk = requireForUpdate(chunkId);
        if (chunk.getStatus() != ChunkStatus.IN_PROGRESS || chunk.getAttempts() != attempt) {
            log.warn("Ignoring failure of chunk {} attempt {}: chunk is {} at attempt {}",
                    chunkId, attempt, chunk.getStatus(), chunk.getAttempts());
            return Optional.empty();
        }
        return Optional.of(retry(chunk));
    }

    private Chunk retry(Chunk chunk) {
        String chunkId = chunk.getId();
        chunk.incrementAttempts();
        chunk.setStatus(ChunkStatus.PLANNED);
        chunk.setAssignedWorker(null);
        chunk.setStartedAt(null);
        log.warn("Chunk {} failed (attempt {}), back to PLANNED", chunkId, chunk.getAttempts());
        return chunkRepo.save(chunk);
    }

    /** IN_PROGRESS chunks whose current assignment started before {@code cutoff}. */
    @Transactional(readOnly = true)
    public List<Chunk> findStaleInProgress(Instant cutoff) {
        return chunkRepo.findByStatusAndStartedAtBefore(ChunkStatus.IN_PROGRESS, cutoff);
    }

    private Chunk requireForUpdate(String chunkId) {
        return chunkRepo.findByIdForUpdate(chunkId)
                .orElseThrow(() -> new NoSuchElementException("Unknown chunk " + chunkId));
    }
}
