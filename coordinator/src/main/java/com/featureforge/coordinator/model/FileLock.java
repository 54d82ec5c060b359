package com.featureforge.coordinator.model;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * An exclusive lock on one file path, held by an actor on behalf of a chunk.
 *
 * The file path is the primary key, so the database itself refuses a second
 * holder for the same path. Rows are inserted only by an all-or-nothing
 * ChunkStore.acquire and deleted only by ChunkStore.release.
 *
 * Implements Persistable so that save() always INSERTs a new lock. With an
 * assigned id Spring Data would otherwise merge, and a merge onto an
 * existing row would not hit the primary key.
 *
 * DB table: file_locks
 */
@Entity
@Table(name = "file_locks")
public class FileLock implements Persistable<String> {

    @Id
    @Column(name = "file_path", nullable = false, updatable = false)
    private String filePath;

    @Column(nullable = false, updatable = false)
    private String actor;

    @Column(name = "chunk_id", nullable = false, updatable = false)
    private String chunkId;

    // Chunk attempt this lock was taken for.
    @Column(nullable = false, updatable = false)
    private int attempt;

    @Column(name = "locked_at", nullable = false, updatable = false)
    private Instant lockedAt = Instant.now();

    @Transient
    private boolean isNew = true;

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    protected FileLock() {}   // required by JPA

    public FileLock(String filePath, String actor, String chunkId, int attempt) {
        this.filePath = filePath;
        this.actor    = actor;
        this.chunkId  = chunkId;
        this.attempt  = attempt;
    }

    @Override
    public String  getId()       { return filePath; }
    @Override
    public boolean isNew()       { return isNew; }

    public String  getFilePath() { return filePath; }
    public String  getActor()    { return actor; }
    public String  getChunkId()  { return chunkId; }
    public int     getAttempt()  { return attempt; }
    public Instant getLockedAt() { return lockedAt; }
}
