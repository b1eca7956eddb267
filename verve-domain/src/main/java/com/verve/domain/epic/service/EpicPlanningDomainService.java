package com.verve.domain.epic.service;

import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.epic.model.valobj.PlannedTask;
import com.verve.domain.epic.model.valobj.ProposedTask;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.types.common.IdGenerator;
import com.verve.types.enums.TaskStatusEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Epic 规划领域服务：规划器草案转拟定任务，确认时把拟定任务物化为真实任务。
 */
@Service
public class EpicPlanningDomainService {

    static final String TEMP_ID_PREFIX = "task_";

    /**
     * 1 起始下标转为 task_N 临时 ID，越界下标丢弃。
     */
    public List<ProposedTask> toProposedTasks(List<PlannedTask> plannedTasks) {
        List<ProposedTask> proposed = new ArrayList<>();
        if (plannedTasks == null) {
            return proposed;
        }
        int size = plannedTasks.size();
        for (int i = 0; i < size; i++) {
            PlannedTask planned = plannedTasks.get(i);
            List<String> deps = new ArrayList<>();
            if (planned.getDependsOn() != null) {
                for (Integer index : planned.getDependsOn()) {
                    if (index != null && index >= 1 && index <= size) {
                        deps.add(TEMP_ID_PREFIX + index);
                    }
                }
            }
            proposed.add(ProposedTask.builder()
                    .tempId(TEMP_ID_PREFIX + (i + 1))
                    .title(planned.getTitle())
                    .description(planned.getDescription())
                    .dependsOnTempIds(deps)
                    .acceptanceCriteria(planned.getAcceptanceCriteria() == null
                            ? new ArrayList<>() : new ArrayList<>(planned.getAcceptanceCriteria()))
                    .build());
        }
        return proposed;
    }

    /**
     * 按列表顺序生成任务；依赖只能解析到列表中更早的任务，无法解析的临时 ID 被丢弃。
     * createdAt 随列表顺序递增。
     */
    public List<TaskEntity> materialize(EpicEntity epic, boolean notReady, int maxAttempts, LocalDateTime now) {
        Map<String, String> tempToReal = new HashMap<>();
        Set<String> usedIds = new LinkedHashSet<>();
        List<TaskEntity> tasks = new ArrayList<>();
        for (ProposedTask proposed : epic.getProposedTasks()) {
            List<String> realDeps = new ArrayList<>();
            if (proposed.getDependsOnTempIds() != null) {
                for (String tempId : proposed.getDependsOnTempIds()) {
                    String realId = tempToReal.get(tempId);
                    if (realId != null && !realDeps.contains(realId)) {
                        realDeps.add(realId);
                    }
                }
            }
            String taskId = nextTaskId(usedIds);
            TaskEntity task = new TaskEntity();
            task.setId(taskId);
            task.setRepoId(epic.getRepoId());
            task.setEpicId(epic.getId());
            task.setTitle(proposed.getTitle());
            task.setDescription(StringUtils.defaultString(proposed.getDescription()));
            task.setAcceptanceCriteria(proposed.getAcceptanceCriteria() == null
                    ? new ArrayList<>() : new ArrayList<>(proposed.getAcceptanceCriteria()));
            task.setDependsOn(realDeps);
            task.setReady(!notReady);
            task.setStatus(TaskStatusEnum.PENDING);
            task.setAttempt(1);
            task.setMaxAttempts(maxAttempts);
            task.setCostUsd(BigDecimal.ZERO);
            task.setMaxCostUsd(BigDecimal.ZERO);
            task.setModel(epic.getModel());
            // 同批任务按微秒错开，领取顺序与列表顺序一致
            task.setCreatedAt(now.plusNanos(tasks.size() * 1_000L));
            task.setUpdatedAt(now);
            if (StringUtils.isNotBlank(proposed.getTempId())) {
                tempToReal.put(proposed.getTempId(), taskId);
            }
            tasks.add(task);
        }
        return tasks;
    }

    private String nextTaskId(Set<String> usedIds) {
        String id = IdGenerator.newTaskId();
        while (!usedIds.add(id)) {
            id = IdGenerator.newTaskId();
        }
        return id;
    }
}
