package com.featureforge.coordinator.service;

import com.featureforge.coordinator.model.Chunk;
import com.featureforge.coordinator.model.ChunkStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ChunkSchedulerTest {

    // ------------------------------------------------------------------
    // availableChunks()
    // ------------------------------------------------------------------

    @Test
    void available_noDependenciesNoLocks_allPlannedChunks() {
        Chunk a = chunk("a", ChunkStatus.PLANNED, List.of("a.py"));
        Chunk b = chunk("b", ChunkStatus.PLANNED, List.of("b.py"));
        Chunk c = chunk("c", ChunkStatus.IN_PROGRESS, List.of("c.py"));

        assertThat(ChunkScheduler.availableChunks(List.of(a, b, c), Set.of()))
                .extracting(Chunk::getId).containsExactly("a", "b");
    }

    @Test
    void available_dependencyNotDone_isHeldBack() {
        Chunk a = chunk("a", ChunkStatus.IN_PROGRESS, List.of("a.py"));
        Chunk b = chunk("b", ChunkStatus.PLANNED, List.of("b.py"), "a");

        assertThat(ChunkScheduler.availableChunks(List.of(a, b), Set.of())).isEmpty();
    }

    @Test
    void available_dependencyCompleteOrMerged_isReleased() {
        Chunk a = chunk("a", ChunkStatus.COMPLETE, List.of("a.py"));
        Chunk b = chunk("b", ChunkStatus.MERGED, List.of("b.py"));
        Chunk c = chunk("c", ChunkStatus.PLANNED, List.of("c.py"), "a", "b");

        assertThat(ChunkScheduler.availableChunks(List.of(a, b, c), Set.of()))
                .extracting(Chunk::getId).containsExactly("c");
    }

    @Test
    void available_unknownDependency_isTreatedAsUnmet() {
        Chunk b = chunk("b", ChunkStatus.PLANNED, List.of("b.py"), "ghost");

        assertThat(ChunkScheduler.availableChunks(List.of(b), Set.of())).isEmpty();
    }

    @Test
    void available_anyFileLocked_isHeldBack() {
        Chunk a = chunk("a", ChunkStatus.PLANNED, List.of("a.py", "shared.py"));
        Chunk b = chunk("b", ChunkStatus.PLANNED, List.of("b.py"));

        assertThat(ChunkScheduler.availableChunks(List.of(a, b), Set.of("shared.py")))
                .extracting(Chunk::getId).containsExactly("b");
    }

    // ------------------------------------------------------------------
    // mergeEligible()
    // ------------------------------------------------------------------

    @Test
    void mergeEligible_requiresHandleAndMergedDependencies() {
        Chunk a = chunk("a", ChunkStatus.COMPLETE, List.of("a.py"));
        a.setIntegrationHandle("pr-1");
        Chunk b = chunk("b", ChunkStatus.COMPLETE, List.of("b.py"), "a");
        b.setIntegrationHandle("pr-2");
        Chunk c = chunk("c", ChunkStatus.COMPLETE, List.of("c.py"));   // no handle

        assertThat(ChunkScheduler.mergeEligible(List.of(a, b, c)))
                .extracting(Chunk::getId).containsExactly("a");

        a.setStatus(ChunkStatus.MERGED);
        assertThat(ChunkScheduler.mergeEligible(List.of(a, b, c)))
                .extracting(Chunk::getId).containsExactly("b");
    }

    // ------------------------------------------------------------------
    // allMerged() / nothingPending()
    // ------------------------------------------------------------------

    @Test
    void allMerged_emptyList_isFalse() {
        assertThat(ChunkScheduler.allMerged(List.of())).isFalse();
    }

    @Test
    void allMerged_everyChunkMerged_isTrue() {
        assertThat(ChunkScheduler.allMerged(List.of(
                chunk("a", ChunkStatus.MERGED, List.of("a.py")),
                chunk("b", ChunkStatus.MERGED, List.of("b.py"))))).isTrue();
        assertThat(ChunkScheduler.allMerged(List.of(
                chunk("a", ChunkStatus.MERGED, List.of("a.py")),
                chunk("b", ChunkStatus.COMPLETE, List.of("b.py"))))).isFalse();
    }

    @Test
    void nothingPending_completeChunksOnly_isTrue() {
        assertThat(ChunkScheduler.nothingPending(List.of(
                chunk("a", ChunkStatus.COMPLETE, List.of("a.py")),
                chunk("b", ChunkStatus.MERGED, List.of("b.py"))))).isTrue();
        assertThat(ChunkScheduler.nothingPending(List.of(
                chunk("a", ChunkStatus.COMPLETE, List.of("a.py")),
                chunk("b", ChunkStatus.IN_PROGRESS, List.of("b.py"))))).isFalse();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Chunk chunk(String id, ChunkStatus status, List<String> files, String... deps) {
        Chunk chunk = new Chunk(id, "task-1", "chunk " + id, files, List.of(deps));
        chunk.setStatus(status);
        return chunk;
    }
}
