package com.featureforge.coordinator.progress;

import com.featureforge.coordinator.model.ProgressEvent;
import com.featureforge.coordinator.model.ProgressEventType;
import com.featureforge.coordinator.repository.ChunkRepository;
import com.featureforge.coordinator.repository.ProgressEventRepository;
import com.featureforge.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Stores user-facing progress events and fans them out to live subscribers.
 *
 * Each event is committed first and only then offered to the queues of the
 * task's subscribers and of the global subscribers. Offering never blocks;
 * a slow subscriber loses events instead of slowing the coordinator down.
 */
@Service
public class ProgressPublisher {

    private static final Logger log = LoggerFactory.getLogger(ProgressPublisher.class);

    private static final int DEFAULT_EVENT_LIMIT = 100;

    private final ProgressEventRepository progressRepo;
    private final TaskRepository          taskRepo;
    private final ChunkRepository         chunkRepo;
    private final TransactionTemplate     requiresNew;
    private final int                     queueCapacity;

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<ProgressSubscription>> taskSubscribers =
            new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<ProgressSubscription> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public ProgressPublisher(ProgressEventRepository progressRepo,
                             TaskRepository taskRepo,
                             ChunkRepository chunkRepo,
                             PlatformTransactionManager txManager,
                             @Value("${featureforge.progress.queue-capacity:1000}") int queueCapacity) {
        this.progressRepo  = progressRepo;
        this.taskRepo      = taskRepo;
        this.chunkRepo     = chunkRepo;
        this.queueCapacity = queueCapacity;
        this.requiresNew   = new TransactionTemplate(txManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    // ------------------------------------------------------------------
    // Publish
    // ------------------------------------------------------------------

    public long publish(String taskId, ProgressEventType type, Map<String, Object> payload, String message) {
        return publish(taskId, type.wireName(), payload, message);
    }

    /**
     * Persist a progress event and offer it to live subscribers.
     *
     * @param type    any string; see {@link ProgressEventType} for the usual values
     * @param message optional human-readable text
     * @return the stored event's id
     */
    public long publish(String taskId, String type, Map<String, Object> payload, String message) {
        ProgressEvent saved = requiresNew.execute(status ->
                progressRepo.save(new ProgressEvent(taskId, type, payload, message)));
        log.debug("Progress {} for task {}: {}", type, taskId, message);

        List<ProgressSubscription> forTask = taskSubscribers.get(taskId);
        if (forTask != null) {
            forTask.forEach(sub -> offer(sub, saved));
        }
        globalSubscribers.forEach(sub -> offer(sub, saved));
        return saved.getId();
    }

    private void offer(ProgressSubscription sub, ProgressEvent event) {
        if (!sub.offer(event) && !sub.isClosed()) {
            log.debug("Subscriber queue full, dropped {} for task {} ({} dropped so far)",
                    event.getType(), event.getTaskId(), sub.droppedCount());
        }
    }

    // ------------------------------------------------------------------
    // Subscribe
    // ------------------------------------------------------------------

    /** Live events of one task, from now on. Close the subscription when done. */
    public ProgressSubscription subscribe(String taskId) {
        ProgressSubscription sub = new ProgressSubscription(taskId, queueCapacity, closed ->
                taskSubscribers.computeIfPresent(taskId, (k, subs) -> {
                    subs.remove(closed);
                    return subs.isEmpty() ? null : subs;
                }));
        taskSubscribers.compute(taskId, (k, subs) -> {
            CopyOnWriteArrayList<ProgressSubscription> list = subs == null ? new CopyOnWriteArrayList<>() : subs;
            list.add(sub);
            return list;
        });
        log.debug("Subscribed to progress of task {}", taskId);
        return sub;
    }

    /** Live events of every task, from now on. */
    public ProgressSubscription subscribeAll() {
        ProgressSubscription sub = new ProgressSubscription(null, queueCapacity, globalSubscribers::remove);
        globalSubscribers.add(sub);
        log.debug("Subscribed to progress of all tasks");
        return sub;
    }

    /** Number of open subscriptions following {@code taskId} specifically. */
    public int subscriberCount(String taskId) {
        List<ProgressSubscription> subs = taskSubscribers.get(taskId);
        return subs == null ? 0 : subs.size();
    }

    // ------------------------------------------------------------------
    // History
    // ------------------------------------------------------------------

    /** Stored events of a task, newest first; {@code limit} defaults to 100. */
    @Transactional(readOnly = true)
    public List<ProgressEvent> events(String taskId, Integer limit) {
        int n = limit == null || limit <= 0 ? DEFAULT_EVENT_LIMIT : limit;
        return progressRepo.findByTaskIdOrderByIdDesc(taskId, PageRequest.of(0, n));
    }

    /** Stored events of all tasks, newest first. */
    @Transactional(readOnly = true)
    public List<ProgressEvent> recentEvents(int limit) {
        return progressRepo.findAllByOrderByIdDesc(PageRequest.of(0, Math.max(1, limit)));
    }

    /** Task plus chunk view, or empty when the task does not exist. */
    @Transactional(readOnly = true)
    public Optional<TaskSummary> summarize(String taskId) {
        return taskRepo.findById(taskId)
                .map(task -> TaskSummary.of(task, chunkRepo.findByTaskIdOrderByCreatedAtAscIdAsc(taskId)));
    }
}
