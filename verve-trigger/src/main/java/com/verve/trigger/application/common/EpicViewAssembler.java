package com.verve.trigger.application.common;

import com.verve.api.dto.EpicDTO;
import com.verve.api.dto.EpicFeedbackDTO;
import com.verve.api.dto.ProposedTaskDTO;
import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.epic.model.valobj.EpicFeedback;
import com.verve.domain.epic.model.valobj.ProposedTask;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Epic 视图组装器。
 */
@Component
public class EpicViewAssembler {

    static final String FEEDBACK_TIMEOUT = "timeout";

    public EpicDTO toEpicDTO(EpicEntity epic) {
        if (epic == null) {
            return null;
        }
        EpicDTO dto = new EpicDTO();
        dto.setId(epic.getId());
        dto.setRepoId(epic.getRepoId());
        dto.setTitle(epic.getTitle());
        dto.setDescription(epic.getDescription());
        dto.setStatus(epic.getStatus() == null ? null : epic.getStatus().getCode());
        dto.setPlanningPrompt(epic.getPlanningPrompt());
        dto.setModel(epic.getModel());
        dto.setProposedTasks(epic.getProposedTasks() == null ? new ArrayList<>()
                : epic.getProposedTasks().stream().map(this::toProposedTaskDTO).collect(Collectors.toList()));
        dto.setTaskIds(epic.getTaskIds() == null ? new ArrayList<>() : new ArrayList<>(epic.getTaskIds()));
        dto.setSessionLog(epic.getSessionLog() == null ? new ArrayList<>() : new ArrayList<>(epic.getSessionLog()));
        dto.setNotReady(epic.isNotReady());
        dto.setClaimedAt(epic.getClaimedAt());
        dto.setLastHeartbeatAt(epic.getLastHeartbeatAt());
        dto.setFeedback(epic.getFeedback());
        dto.setFeedbackType(epic.getFeedbackType() == null ? null : epic.getFeedbackType().getCode());
        dto.setCreatedAt(epic.getCreatedAt());
        dto.setUpdatedAt(epic.getUpdatedAt());
        return dto;
    }

    public List<EpicDTO> toEpicDTOs(List<EpicEntity> epics) {
        if (epics == null || epics.isEmpty()) {
            return Collections.emptyList();
        }
        return epics.stream().map(this::toEpicDTO).collect(Collectors.toList());
    }

    public ProposedTaskDTO toProposedTaskDTO(ProposedTask proposed) {
        ProposedTaskDTO dto = new ProposedTaskDTO();
        dto.setTempId(proposed.getTempId());
        dto.setTitle(proposed.getTitle());
        dto.setDescription(proposed.getDescription());
        dto.setDependsOnTempIds(proposed.getDependsOnTempIds() == null
                ? new ArrayList<>() : new ArrayList<>(proposed.getDependsOnTempIds()));
        dto.setAcceptanceCriteria(proposed.getAcceptanceCriteria() == null
                ? new ArrayList<>() : new ArrayList<>(proposed.getAcceptanceCriteria()));
        return dto;
    }

    public List<ProposedTask> toProposedTasks(List<ProposedTaskDTO> dtos) {
        List<ProposedTask> result = new ArrayList<>();
        if (dtos == null) {
            return result;
        }
        for (ProposedTaskDTO dto : dtos) {
            if (dto == null) {
                continue;
            }
            result.add(ProposedTask.builder()
                    .tempId(dto.getTempId())
                    .title(dto.getTitle())
                    .description(dto.getDescription())
                    .dependsOnTempIds(dto.getDependsOnTempIds() == null
                            ? new ArrayList<>() : new ArrayList<>(dto.getDependsOnTempIds()))
                    .acceptanceCriteria(dto.getAcceptanceCriteria() == null
                            ? new ArrayList<>() : new ArrayList<>(dto.getAcceptanceCriteria()))
                    .build());
        }
        return result;
    }

    /**
     * 没有反馈时返回 {type: "timeout"}。
     */
    public EpicFeedbackDTO toFeedbackDTO(EpicFeedback feedback) {
        EpicFeedbackDTO dto = new EpicFeedbackDTO();
        if (feedback == null) {
            dto.setType(FEEDBACK_TIMEOUT);
            return dto;
        }
        dto.setType(feedback.getType().getCode());
        dto.setFeedback(feedback.getFeedback());
        return dto;
    }
}
