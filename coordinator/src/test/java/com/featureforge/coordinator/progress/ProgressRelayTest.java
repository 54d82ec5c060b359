package com.featureforge.coordinator.progress;

import com.featureforge.coordinator.events.EventBus;
import com.featureforge.coordinator.events.Payloads;
import com.featureforge.coordinator.model.Event;
import com.featureforge.coordinator.model.EventType;
import com.featureforge.coordinator.model.ProgressEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProgressRelayTest {

    @Mock EventBus          bus;
    @Mock ProgressPublisher progress;

    ProgressRelay relay;

    @BeforeEach
    void setUp() {
        relay = new ProgressRelay(bus, progress);
    }

    @Test
    void start_subscribesToWorkerAndMergeEvents() {
        relay.start();

        verify(bus).subscribe(eq(EventType.CHUNK_STARTED), any());
        verify(bus).subscribe(eq(EventType.INTEGRATION_OPENED), any());
        verify(bus).subscribe(eq(EventType.CHUNK_MERGED), any());
        verify(bus).subscribe(eq(EventType.CHUNK_FAILED), any());
        verify(bus, never()).subscribe(eq(EventType.FILE_LOCKED), any());
        verify(bus, times(7)).subscribe(any(), any());
    }

    @Test
    void relay_integrationOpened_becomesPrCreated() {
        Event event = new Event(EventType.INTEGRATION_OPENED, "chunk-worker",
                Payloads.of("task_id", "t1", "chunk_id", "t1_a", "handle", "pr-12"));

        relay.relay(event);

        verify(progress).publish(eq("t1"), eq(ProgressEventType.PR_CREATED),
                argThat(p -> "pr-12".equals(p.get("handle"))), contains("pr-12"));
    }

    @Test
    void relay_chunkFailed_becomesErrorOccurred() {
        Event event = new Event(EventType.CHUNK_FAILED, "chunk-worker",
                Payloads.of("task_id", "t1", "chunk_id", "t1_a", "error", "timeout", "retryable", true));

        relay.relay(event);

        verify(progress).publish(eq("t1"), eq(ProgressEventType.ERROR_OCCURRED), anyMap(),
                eq("Chunk t1_a failed: timeout"));
    }

    @Test
    void relay_withoutTaskId_isSkipped() {
        relay.relay(new Event(EventType.CHUNK_STARTED, "chunk-worker", Payloads.of("chunk_id", "x")));

        verifyNoInteractions(progress);
    }
}
