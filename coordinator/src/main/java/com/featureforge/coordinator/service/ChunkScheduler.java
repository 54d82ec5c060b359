package com.featureforge.coordinator.service;

import com.featureforge.coordinator.model.Chunk;
import com.featureforge.coordinator.model.ChunkStatus;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pure scheduling decisions over a snapshot of chunks and locks.
 *
 * Nothing here touches the database; callers load the snapshot from
 * ChunkStore and act on the result. A dependency id that does not match any
 * chunk in the snapshot is treated as unmet.
 */
public final class ChunkScheduler {

    private ChunkScheduler() {}

    /**
     * Chunks that may start now: PLANNED, every dependency has produced a
     * result (COMPLETE or MERGED), and none of their files is locked.
     */
    public static List<Chunk> availableChunks(Collection<Chunk> chunks, Set<String> lockedFiles) {
        Map<String, ChunkStatus> statusById = statusById(chunks);
        return chunks.stream()
                .filter(c -> c.getStatus() == ChunkStatus.PLANNED)
                .filter(c -> c.getDependencies().stream()
                        .allMatch(dep -> hasResult(statusById.get(dep))))
                .filter(c -> c.getFiles().stream().noneMatch(lockedFiles::contains))
                .collect(Collectors.toList());
    }

    /**
     * Chunks that may be integrated now: COMPLETE with an integration handle,
     * and every dependency already MERGED.
     */
    public static List<Chunk> mergeEligible(Collection<Chunk> chunks) {
        Map<String, ChunkStatus> statusById = statusById(chunks);
        return chunks.stream()
                .filter(c -> c.getStatus() == ChunkStatus.COMPLETE)
                .filter(c -> c.getIntegrationHandle() != null)
                .filter(c -> c.getDependencies().stream()
                        .allMatch(dep -> statusById.get(dep) == ChunkStatus.MERGED))
                .collect(Collectors.toList());
    }

    /** True when the task has chunks and every one of them is MERGED. */
    public static boolean allMerged(Collection<Chunk> chunks) {
        return !chunks.isEmpty() && chunks.stream().allMatch(c -> c.getStatus() == ChunkStatus.MERGED);
    }

    /** True when no chunk is waiting to run or running. */
    public static boolean nothingPending(Collection<Chunk> chunks) {
        return chunks.stream().noneMatch(c ->
                c.getStatus() == ChunkStatus.PLANNED || c.getStatus() == ChunkStatus.IN_PROGRESS);
    }

    private static boolean hasResult(ChunkStatus status) {
        return status != null && status.hasResult();
    }

    private static Map<String, ChunkStatus> statusById(Collection<Chunk> chunks) {
        return chunks.stream().collect(Collectors.toMap(Chunk::getId, Chunk::getStatus, (a, b) -> b));
    }
}
