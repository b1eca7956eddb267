package com.verve.trigger.application.dispatch;

import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.task.model.entity.TaskEntity;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 一次长轮询分配到的工作：epic 规划或 task 执行二选一。
 */
@Getter
@AllArgsConstructor
public class WorkAssignment {

    public static final String TYPE_EPIC = "epic";
    public static final String TYPE_TASK = "task";

    private final String type;
    private final TaskEntity task;
    private final EpicEntity epic;
    private final String repoFullName;
    private final String codeHostToken;
}
