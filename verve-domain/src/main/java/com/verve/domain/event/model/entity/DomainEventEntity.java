package com.verve.domain.event.model.entity;

import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.types.enums.DomainEventTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 领域事件：携带实体的完整当前状态（非增量），订阅方可直接应用最新事件。
 * <p>
 * reference=true 表示跨实例传输时省略了实体，接收方需按 ID 回读。
 * </p>
 */
@Data
public class DomainEventEntity {

    private DomainEventTypeEnum eventType;
    private String repoId;
    private String taskId;
    private String epicId;
    private TaskEntity task;
    private EpicEntity epic;
    private int attempt;
    private List<String> logs;
    private boolean reference;
    private String originInstanceId;
    private LocalDateTime occurredAt;

    public static DomainEventEntity taskCreated(TaskEntity task) {
        return ofTask(DomainEventTypeEnum.TASK_CREATED, task);
    }

    public static DomainEventEntity taskUpdated(TaskEntity task) {
        return ofTask(DomainEventTypeEnum.TASK_UPDATED, task);
    }

    public static DomainEventEntity logsAppended(String repoId, String taskId, int attempt, List<String> logs) {
        DomainEventEntity event = new DomainEventEntity();
        event.setEventType(DomainEventTypeEnum.LOGS_APPENDED);
        event.setRepoId(repoId);
        event.setTaskId(taskId);
        event.setAttempt(attempt);
        event.setLogs(logs == null ? new ArrayList<>() : new ArrayList<>(logs));
        event.setOccurredAt(LocalDateTime.now());
        return event;
    }

    public static DomainEventEntity epicCreated(EpicEntity epic) {
        return ofEpic(DomainEventTypeEnum.EPIC_CREATED, epic);
    }

    public static DomainEventEntity epicUpdated(EpicEntity epic) {
        return ofEpic(DomainEventTypeEnum.EPIC_UPDATED, epic);
    }

    public static DomainEventEntity epicDeleted(String repoId, String epicId) {
        DomainEventEntity event = new DomainEventEntity();
        event.setEventType(DomainEventTypeEnum.EPIC_DELETED);
        event.setRepoId(repoId);
        event.setEpicId(epicId);
        event.setOccurredAt(LocalDateTime.now());
        return event;
    }

    /**
     * 去掉实体，只保留类型与 ID。
     */
    public DomainEventEntity toReference() {
        DomainEventEntity ref = new DomainEventEntity();
        ref.setEventType(eventType);
        ref.setRepoId(repoId);
        ref.setTaskId(taskId);
        ref.setEpicId(epicId);
        ref.setAttempt(attempt);
        ref.setReference(true);
        ref.setOriginInstanceId(originInstanceId);
        ref.setOccurredAt(occurredAt);
        return ref;
    }

    private static DomainEventEntity ofTask(DomainEventTypeEnum type, TaskEntity task) {
        DomainEventEntity event = new DomainEventEntity();
        event.setEventType(type);
        event.setRepoId(task.getRepoId());
        event.setTaskId(task.getId());
        event.setTask(task);
        event.setAttempt(task.getAttempt());
        event.setOccurredAt(LocalDateTime.now());
        return event;
    }

    private static DomainEventEntity ofEpic(DomainEventTypeEnum type, EpicEntity epic) {
        DomainEventEntity event = new DomainEventEntity();
        event.setEventType(type);
        event.setRepoId(epic.getRepoId());
        event.setEpicId(epic.getId());
        event.setEpic(epic);
        event.setOccurredAt(LocalDateTime.now());
        return event;
    }
}
