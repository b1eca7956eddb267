package com.verve.trigger.http;

import com.verve.api.dto.StreamEventDTO;
import com.verve.api.dto.StreamSnapshotDTO;
import com.verve.domain.event.adapter.gateway.IDomainEventBroker;
import com.verve.domain.event.model.entity.DomainEventEntity;
import com.verve.trigger.application.command.EpicCommandService;
import com.verve.trigger.application.command.TaskCommandService;
import com.verve.trigger.application.common.EpicViewAssembler;
import com.verve.trigger.application.common.TaskViewAssembler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 实时事件 SSE 流：连接时先推送 init 快照，随后按领域事件增量推送。
 * <p>
 * 每个订阅方一个有界队列，由共享执行器串行排空，保证单订阅方内的事件顺序；
 * 队列满时丢弃并计数。事件携带完整实体状态，重复投递无副作用。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
public class EventStreamController {

    static final String INIT_EVENT = "init";
    static final String HEARTBEAT_EVENT = "heartbeat";
    private static final String SUBSCRIBER_PREFIX = "sse-";

    private final IDomainEventBroker eventBroker;
    private final TaskCommandService taskCommandService;
    private final EpicCommandService epicCommandService;
    private final TaskViewAssembler taskViewAssembler;
    private final EpicViewAssembler epicViewAssembler;
    private final ThreadPoolExecutor deliveryExecutor;
    private final ConcurrentMap<String, Subscriber> subscribers = new ConcurrentHashMap<>();
    private final long emitterTimeoutMillis;
    private final int queueCapacity;
    private final Counter pushAttemptCounter;
    private final Counter pushFailCounter;
    private final Counter dropCounter;

    public EventStreamController(IDomainEventBroker eventBroker,
                                 TaskCommandService taskCommandService,
                                 EpicCommandService epicCommandService,
                                 TaskViewAssembler taskViewAssembler,
                                 EpicViewAssembler epicViewAssembler,
                                 @Qualifier("sseDeliveryExecutor") ThreadPoolExecutor deliveryExecutor,
                                 @Value("${verve.sse.emitter-timeout-ms:1800000}") long emitterTimeoutMillis,
                                 @Value("${verve.sse.queue-capacity:256}") int queueCapacity) {
        this.eventBroker = eventBroker;
        this.taskCommandService = taskCommandService;
        this.epicCommandService = epicCommandService;
        this.taskViewAssembler = taskViewAssembler;
        this.epicViewAssembler = epicViewAssembler;
        this.deliveryExecutor = deliveryExecutor;
        this.emitterTimeoutMillis = emitterTimeoutMillis;
        this.queueCapacity = queueCapacity <= 0 ? 256 : queueCapacity;
        this.pushAttemptCounter = Counter.builder("verve.sse.push.attempt.total").register(Metrics.globalRegistry);
        this.pushFailCounter = Counter.builder("verve.sse.push.fail.total").register(Metrics.globalRegistry);
        this.dropCounter = Counter.builder("verve.sse.drop.total").register(Metrics.globalRegistry);
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@RequestParam(value = "repoId", required = false) String repoId) {
        SseEmitter emitter = new SseEmitter(emitterTimeoutMillis);
        String subscriberId = SUBSCRIBER_PREFIX + UUID.randomUUID();
        Subscriber subscriber = new Subscriber(emitter, StringUtils.trimToNull(repoId), queueCapacity);
        subscribers.put(subscriberId, subscriber);

        emitter.onCompletion(() -> removeSubscriber(subscriberId));
        emitter.onTimeout(() -> removeSubscriber(subscriberId));
        emitter.onError(ex -> removeSubscriber(subscriberId));

        // 先订阅再发快照，期间到达的事件在队列中等待 init 发出后再排空
        eventBroker.subscribe(subscriberId, event -> enqueue(subscriberId, event));
        boolean sent;
        synchronized (subscriber) {
            sent = sendEvent(emitter, INIT_EVENT, buildSnapshot(subscriber.repoId));
        }
        if (!sent) {
            removeSubscriber(subscriberId);
            return emitter;
        }
        subscriber.draining.set(false);
        schedule(subscriberId, subscriber);
        log.info("SSE subscriber connected. subscriberId={}, repoId={}", subscriberId, subscriber.repoId);
        return emitter;
    }

    @Scheduled(fixedDelayString = "${verve.sse.heartbeat-interval-ms:10000}", scheduler = "daemonScheduler")
    public void emitHeartbeat() {
        if (subscribers.isEmpty()) {
            return;
        }
        for (Map.Entry<String, Subscriber> entry : subscribers.entrySet()) {
            Subscriber subscriber = entry.getValue();
            boolean sent;
            synchronized (subscriber) {
                sent = sendEvent(subscriber.emitter, HEARTBEAT_EVENT, Map.of("ts", System.currentTimeMillis()));
            }
            if (!sent) {
                removeSubscriber(entry.getKey());
            }
        }
    }

    public int subscriberCount() {
        return subscribers.size();
    }

    public StreamEventDTO toStreamEvent(DomainEventEntity event) {
        StreamEventDTO dto = new StreamEventDTO();
        dto.setType(event.getEventType().getEventName());
        dto.setRepoId(event.getRepoId());
        dto.setTaskId(event.getTaskId());
        dto.setEpicId(event.getEpicId());
        dto.setTask(event.getTask() == null ? null : taskViewAssembler.toTaskDTO(event.getTask()));
        dto.setEpic(event.getEpic() == null ? null : epicViewAssembler.toEpicDTO(event.getEpic()));
        if (event.getLogs() != null) {
            dto.setAttempt(event.getAttempt());
            dto.setLogs(event.getLogs());
        }
        dto.setOccurredAt(event.getOccurredAt());
        return dto;
    }

    private StreamSnapshotDTO buildSnapshot(String repoId) {
        StreamSnapshotDTO snapshot = new StreamSnapshotDTO();
        if (repoId == null) {
            snapshot.setTasks(taskViewAssembler.toTaskDTOs(taskCommandService.listTasks()));
            snapshot.setEpics(epicViewAssembler.toEpicDTOs(epicCommandService.listEpics()));
        } else {
            snapshot.setTasks(taskViewAssembler.toTaskDTOs(taskCommandService.listTasksByRepo(repoId)));
            snapshot.setEpics(epicViewAssembler.toEpicDTOs(epicCommandService.listEpicsByRepo(repoId)));
        }
        return snapshot;
    }

    private void enqueue(String subscriberId, DomainEventEntity event) {
        Subscriber subscriber = subscribers.get(subscriberId);
        if (subscriber == null || event == null || event.getEventType() == null) {
            return;
        }
        if (subscriber.repoId != null && !subscriber.repoId.equals(event.getRepoId())) {
            return;
        }
        if (!subscriber.queue.offer(event)) {
            dropCounter.increment();
            log.debug("SSE queue full, event dropped. subscriberId={}, type={}", subscriberId,
                    event.getEventType().getEventName());
            return;
        }
        schedule(subscriberId, subscriber);
    }

    private void schedule(String subscriberId, Subscriber subscriber) {
        if (!subscriber.draining.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.execute(() -> drain(subscriberId, subscriber));
        } catch (RejectedExecutionException ex) {
            subscriber.draining.set(false);
            dropCounter.increment();
            log.warn("SSE delivery rejected, executor saturated. subscriberId={}", subscriberId);
        }
    }

    private void drain(String subscriberId, Subscriber subscriber) {
        try {
            DomainEventEntity event;
            while ((event = subscriber.queue.poll()) != null) {
                boolean sent;
                synchronized (subscriber) {
                    sent = sendEvent(subscriber.emitter, event.getEventType().getEventName(), toStreamEvent(event));
                }
                if (!sent) {
                    removeSubscriber(subscriberId);
                    return;
                }
            }
        } finally {
            subscriber.draining.set(false);
        }
        // 排空结束与标志复位之间可能有新事件入队
        if (!subscriber.queue.isEmpty() && subscribers.containsKey(subscriberId)) {
            schedule(subscriberId, subscriber);
        }
    }

    private void removeSubscriber(String subscriberId) {
        Subscriber removed = subscribers.remove(subscriberId);
        eventBroker.unsubscribe(subscriberId);
        if (removed != null) {
            removed.queue.clear();
            log.info("SSE subscriber disconnected. subscriberId={}", subscriberId);
        }
    }

    private boolean sendEvent(SseEmitter emitter, String name, Object data) {
        pushAttemptCounter.increment();
        try {
            emitter.send(SseEmitter.event().name(name).data(data));
            return true;
        } catch (IOException | RuntimeException ex) {
            pushFailCounter.increment();
            log.debug("SSE send failed: {}", ex.getMessage());
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        for (String subscriberId : subscribers.keySet()) {
            Subscriber subscriber = subscribers.get(subscriberId);
            removeSubscriber(subscriberId);
            if (subscriber != null) {
                subscriber.emitter.complete();
            }
        }
    }

    private static final class Subscriber {
        private final SseEmitter emitter;
        private final String repoId;
        private final BlockingQueue<DomainEventEntity> queue;
        private final AtomicBoolean draining = new AtomicBoolean(true);

        private Subscriber(SseEmitter emitter, String repoId, int capacity) {
            this.emitter = emitter;
            this.repoId = repoId;
            this.queue = new ArrayBlockingQueue<>(capacity);
        }
    }
}
