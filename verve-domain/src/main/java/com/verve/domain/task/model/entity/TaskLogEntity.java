package com.verve.domain.task.model.entity;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 任务日志批次（按追加顺序存储，只增不改）。
 */
@Data
public class TaskLogEntity {

    private Long id;
    private String taskId;
    private int attempt;
    private List<String> lines = new ArrayList<>();
    private LocalDateTime createdAt;

    public static TaskLogEntity create(String taskId, int attempt, List<String> lines, LocalDateTime createdAt) {
        TaskLogEntity entity = new TaskLogEntity();
        entity.setTaskId(taskId);
        entity.setAttempt(attempt);
        entity.setLines(lines == null ? new ArrayList<>() : new ArrayList<>(lines));
        entity.setCreatedAt(createdAt);
        return entity;
    }
}
