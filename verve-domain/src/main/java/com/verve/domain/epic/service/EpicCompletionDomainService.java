package com.verve.domain.epic.service;

import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.types.enums.EpicStatusEnum;
import com.verve.types.enums.TaskStatusEnum;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Epic 完成判定：active 且所有子任务 merged/closed。
 * 缺失的任务不阻塞完成，failed 与进行中的任务阻塞完成。
 */
@Service
public class EpicCompletionDomainService {

    public boolean isComplete(EpicEntity epic, Map<String, TaskStatusEnum> taskStatuses) {
        if (epic == null || epic.getStatus() != EpicStatusEnum.ACTIVE) {
            return false;
        }
        if (epic.getTaskIds() == null || epic.getTaskIds().isEmpty()) {
            return false;
        }
        for (String taskId : epic.getTaskIds()) {
            TaskStatusEnum status = taskStatuses.get(taskId);
            if (status == null) {
                continue;
            }
            if (!status.isTerminal()) {
                return false;
            }
        }
        return true;
    }
}
