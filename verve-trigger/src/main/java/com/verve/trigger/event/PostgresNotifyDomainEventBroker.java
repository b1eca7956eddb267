package com.verve.trigger.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.verve.domain.epic.adapter.repository.IEpicRepository;
import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.event.model.entity.DomainEventEntity;
import com.verve.domain.task.adapter.repository.ITaskRepository;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.types.enums.DomainEventTypeEnum;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import javax.sql.DataSource;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.Statement;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Pattern;

/**
 * 多实例部署的 broker：进程内分发 + pg_notify 跨实例广播。
 * <p>
 * 监听线程对自身实例发出的通知直接跳过；超过 NOTIFY 上限的事件只发送引用，接收方按 ID 回读当前实体。
 * 不做持久化与重放，断线期间的事件丢失，由订阅方的快照兜底。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "verve.broker.mode", havingValue = "cluster")
public class PostgresNotifyDomainEventBroker extends AbstractDomainEventBroker {

    public static final int MAX_PAYLOAD_BYTES = 7900;
    private static final int LISTEN_TIMEOUT_MILLIS = 3000;
    private static final int RECONNECT_BACKOFF_MILLIS = 1000;
    private static final Pattern CHANNEL_PATTERN = Pattern.compile("^[a-z_][a-z0-9_]*$");

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final ITaskRepository taskRepository;
    private final IEpicRepository epicRepository;
    private final ExecutorService notifyListenExecutor;
    private final String notifyChannel;
    private final String instanceId;
    private volatile boolean running;

    public PostgresNotifyDomainEventBroker(DataSource dataSource,
                                           ObjectMapper objectMapper,
                                           ITaskRepository taskRepository,
                                           IEpicRepository epicRepository,
                                           @Value("${verve.broker.channel:task_events}") String notifyChannel,
                                           @Value("${verve.broker.instance-id:}") String configuredInstanceId) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
        this.taskRepository = taskRepository;
        this.epicRepository = epicRepository;
        this.notifyChannel = (notifyChannel == null || notifyChannel.isBlank()) ? "task_events" : notifyChannel;
        if (!CHANNEL_PATTERN.matcher(this.notifyChannel).matches()) {
            throw new IllegalStateException("Invalid notify channel name: " + this.notifyChannel);
        }
        this.instanceId = resolveInstanceId(configuredInstanceId);
        this.notifyListenExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "domain-event-notify-listener");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void startNotifyListener() {
        running = true;
        notifyListenExecutor.execute(this::listenLoop);
        log.info("Cluster event broker started. channel={}, instanceId={}", notifyChannel, instanceId);
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        notifyListenExecutor.shutdownNow();
    }

    @Override
    public void publish(DomainEventEntity event) {
        if (event == null) {
            return;
        }
        event.setOriginInstanceId(instanceId);
        dispatch(event);
        notifyCrossInstance(event);
    }

    public String getInstanceId() {
        return instanceId;
    }

    /**
     * 序列化为 NOTIFY 载荷；超限时退化为引用，超限的日志事件不桥接（返回 null）。
     */
    public String encodePayload(DomainEventEntity event) throws JsonProcessingException {
        String payload = objectMapper.writeValueAsString(event);
        if (payload.getBytes(StandardCharsets.UTF_8).length <= MAX_PAYLOAD_BYTES) {
            return payload;
        }
        if (event.getEventType() == DomainEventTypeEnum.LOGS_APPENDED) {
            return null;
        }
        return objectMapper.writeValueAsString(event.toReference());
    }

    /**
     * 解析对端载荷，自身实例的事件返回 null，引用事件回读实体。
     */
    public DomainEventEntity decodePayload(String payload) throws JsonProcessingException {
        if (payload == null || payload.isBlank()) {
            return null;
        }
        DomainEventEntity event = objectMapper.readValue(payload, DomainEventEntity.class);
        if (event.getEventType() == null || instanceId.equals(event.getOriginInstanceId())) {
            return null;
        }
        if (event.isReference()) {
            return resolveReference(event);
        }
        return event;
    }

    private DomainEventEntity resolveReference(DomainEventEntity ref) {
        switch (ref.getEventType()) {
            case TASK_CREATED:
            case TASK_UPDATED: {
                TaskEntity task = taskRepository.findById(ref.getTaskId());
                if (task == null) {
                    return null;
                }
                return ref.getEventType() == DomainEventTypeEnum.TASK_CREATED
                        ? DomainEventEntity.taskCreated(task) : DomainEventEntity.taskUpdated(task);
            }
            case EPIC_CREATED:
            case EPIC_UPDATED: {
                EpicEntity epic = epicRepository.findById(ref.getEpicId());
                if (epic == null) {
                    return null;
                }
                return ref.getEventType() == DomainEventTypeEnum.EPIC_CREATED
                        ? DomainEventEntity.epicCreated(epic) : DomainEventEntity.epicUpdated(epic);
            }
            case EPIC_DELETED:
                return DomainEventEntity.epicDeleted(ref.getRepoId(), ref.getEpicId());
            default:
                return null;
        }
    }

    private void notifyCrossInstance(DomainEventEntity event) {
        String payload;
        try {
            payload = encodePayload(event);
        } catch (JsonProcessingException ex) {
            log.warn("Domain event encode failed. eventType={}, error={}", event.getEventType(), ex.getMessage());
            return;
        }
        if (payload == null) {
            log.debug("Oversized logs event not bridged. taskId={}, attempt={}", event.getTaskId(), event.getAttempt());
            return;
        }
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT pg_notify(?, ?)")) {
            statement.setString(1, notifyChannel);
            statement.setString(2, payload);
            statement.execute();
        } catch (Exception ex) {
            log.warn("Domain event notify failed. eventType={}, taskId={}, epicId={}, error={}",
                    event.getEventType(), event.getTaskId(), event.getEpicId(), ex.getMessage());
        }
    }

    private void listenLoop() {
        while (running) {
            try (Connection connection = dataSource.getConnection();
                 Statement statement = connection.createStatement()) {
                statement.execute("LISTEN " + notifyChannel);
                PGConnection pgConnection = connection.unwrap(PGConnection.class);
                while (running && !connection.isClosed()) {
                    PGNotification[] notifications = pgConnection.getNotifications(LISTEN_TIMEOUT_MILLIS);
                    if (notifications == null || notifications.length == 0) {
                        continue;
                    }
                    for (PGNotification notification : notifications) {
                        handleNotification(notification == null ? null : notification.getParameter());
                    }
                }
            } catch (Exception ex) {
                if (!running || Thread.currentThread().isInterrupted()) {
                    return;
                }
                log.warn("Domain event listener failed, reconnecting. channel={}, error={}", notifyChannel, ex.getMessage());
                try {
                    Thread.sleep(RECONNECT_BACKOFF_MILLIS);
                } catch (InterruptedException interruptedException) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private void handleNotification(String payload) {
        try {
            DomainEventEntity event = decodePayload(payload);
            if (event != null) {
                dispatch(event);
            }
        } catch (Exception ex) {
            log.warn("Domain event notification dropped. channel={}, error={}", notifyChannel, ex.getMessage());
        }
    }

    private String resolveInstanceId(String configuredInstanceId) {
        if (configuredInstanceId != null && !configuredInstanceId.isBlank()) {
            return configuredInstanceId;
        }
        try {
            String host = InetAddress.getLocalHost().getHostName();
            String pid = ManagementFactory.getRuntimeMXBean().getName();
            return host + "-" + pid;
        } catch (Exception ex) {
            return "instance-" + System.nanoTime();
        }
    }
}
