package com.verve.trigger.application.common;

import com.verve.api.dto.AgentCompleteRequestDTO;
import com.verve.api.dto.EpicTaskSummaryDTO;
import com.verve.api.dto.TaskCreateRequestDTO;
import com.verve.api.dto.TaskDTO;
import com.verve.api.dto.TaskLogBatchDTO;
import com.verve.api.dto.TaskLogsDTO;
import com.verve.api.dto.TaskStartOverRequestDTO;
import com.verve.api.dto.TaskUpdateRequestDTO;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.task.model.entity.TaskLogEntity;
import com.verve.domain.task.model.valobj.TaskCompletionReport;
import com.verve.domain.task.model.valobj.TaskEditCommand;
import com.verve.domain.task.model.valobj.TaskStartOverCommand;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Task 视图组装器：实体与 DTO、请求与领域命令之间的映射。
 */
@Component
public class TaskViewAssembler {

    public TaskDTO toTaskDTO(TaskEntity task) {
        if (task == null) {
            return null;
        }
        TaskDTO dto = new TaskDTO();
        dto.setId(task.getId());
        dto.setRepoId(task.getRepoId());
        dto.setEpicId(task.getEpicId());
        dto.setTitle(task.getTitle());
        dto.setDescription(task.getDescription());
        dto.setAcceptanceCriteria(copyOrEmpty(task.getAcceptanceCriteria()));
        dto.setStatus(task.getStatus() == null ? null : task.getStatus().getCode());
        dto.setDependsOn(copyOrEmpty(task.getDependsOn()));
        dto.setReady(task.isReady());
        dto.setAttempt(task.getAttempt());
        dto.setMaxAttempts(task.getMaxAttempts());
        dto.setRetryReason(task.getRetryReason());
        dto.setRetryContext(task.getRetryContext());
        dto.setRetryCategory(task.getRetryCategory());
        dto.setAgentStatus(task.getAgentStatus());
        dto.setConsecutiveFailures(task.getConsecutiveFailures());
        dto.setCostUsd(task.getCostUsd());
        dto.setMaxCostUsd(task.getMaxCostUsd());
        dto.setSkipPr(task.isSkipPr());
        dto.setModel(task.getModel());
        dto.setBranchName(task.getBranchName());
        dto.setPullRequestUrl(task.getPullRequestUrl());
        dto.setPrNumber(task.getPrNumber());
        dto.setCloseReason(task.getCloseReason());
        dto.setCreatedAt(task.getCreatedAt());
        dto.setUpdatedAt(task.getUpdatedAt());
        dto.setStartedAt(task.getStartedAt());
        dto.setLastHeartbeatAt(task.getLastHeartbeatAt());
        return dto;
    }

    public List<TaskDTO> toTaskDTOs(List<TaskEntity> tasks) {
        if (tasks == null || tasks.isEmpty()) {
            return Collections.emptyList();
        }
        return tasks.stream().map(this::toTaskDTO).collect(Collectors.toList());
    }

    public EpicTaskSummaryDTO toEpicTaskSummaryDTO(TaskEntity task) {
        EpicTaskSummaryDTO dto = new EpicTaskSummaryDTO();
        dto.setId(task.getId());
        dto.setTitle(task.getTitle());
        dto.setStatus(task.getStatus() == null ? null : task.getStatus().getCode());
        dto.setAttempt(task.getAttempt());
        dto.setDependsOn(copyOrEmpty(task.getDependsOn()));
        dto.setPullRequestUrl(task.getPullRequestUrl());
        dto.setPrNumber(task.getPrNumber());
        dto.setCloseReason(task.getCloseReason());
        return dto;
    }

    public TaskLogsDTO toTaskLogsDTO(String taskId, List<TaskLogEntity> batches) {
        TaskLogsDTO dto = new TaskLogsDTO();
        dto.setTaskId(taskId);
        List<String> lines = new ArrayList<>();
        List<TaskLogBatchDTO> batchDTOs = new ArrayList<>();
        if (batches != null) {
            for (TaskLogEntity batch : batches) {
                List<String> batchLines = copyOrEmpty(batch.getLines());
                lines.addAll(batchLines);
                TaskLogBatchDTO batchDTO = new TaskLogBatchDTO();
                batchDTO.setAttempt(batch.getAttempt());
                batchDTO.setLines(batchLines);
                batchDTO.setCreatedAt(batch.getCreatedAt());
                batchDTOs.add(batchDTO);
            }
        }
        dto.setLines(lines);
        dto.setBatches(batchDTOs);
        return dto;
    }

    public TaskEditCommand toEditCommand(TaskCreateRequestDTO request) {
        return TaskEditCommand.builder()
                .title(request.getTitle())
                .description(request.getDescription())
                .acceptanceCriteria(request.getAcceptanceCriteria())
                .dependsOn(request.getDependsOn())
                .maxAttempts(request.getMaxAttempts())
                .maxCostUsd(request.getMaxCostUsd())
                .skipPr(request.getSkipPr())
                .model(request.getModel())
                .ready(request.getReady())
                .build();
    }

    public TaskEditCommand toEditCommand(TaskUpdateRequestDTO request) {
        return TaskEditCommand.builder()
                .title(request.getTitle())
                .description(request.getDescription())
                .acceptanceCriteria(request.getAcceptanceCriteria())
                .dependsOn(request.getDependsOn())
                .maxAttempts(request.getMaxAttempts())
                .maxCostUsd(request.getMaxCostUsd())
                .skipPr(request.getSkipPr())
                .model(request.getModel())
                .ready(request.getReady())
                .build();
    }

    public TaskStartOverCommand toStartOverCommand(TaskStartOverRequestDTO request) {
        if (request == null) {
            return TaskStartOverCommand.builder().build();
        }
        return TaskStartOverCommand.builder()
                .title(request.getTitle())
                .description(request.getDescription())
                .acceptanceCriteria(request.getAcceptanceCriteria())
                .build();
    }

    public TaskCompletionReport toCompletionReport(AgentCompleteRequestDTO request) {
        return TaskCompletionReport.builder()
                .success(Boolean.TRUE.equals(request.getSuccess()))
                .pullRequestUrl(request.getPullRequestUrl())
                .prNumber(request.getPrNumber() == null ? 0 : request.getPrNumber())
                .branchName(request.getBranchName())
                .error(request.getError())
                .agentStatus(request.getAgentStatus())
                .costUsd(request.getCostUsd())
                .prereqFailed(request.getPrereqFailed())
                .noChanges(Boolean.TRUE.equals(request.getNoChanges()))
                .retryable(Boolean.TRUE.equals(request.getRetryable()))
                .build();
    }

    private static List<String> copyOrEmpty(List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
