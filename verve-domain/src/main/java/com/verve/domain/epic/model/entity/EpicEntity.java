package com.verve.domain.epic.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.verve.domain.epic.model.valobj.ProposedTask;
import com.verve.types.common.Constants;
import com.verve.types.enums.EpicFeedbackTypeEnum;
import com.verve.types.enums.EpicStatusEnum;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Epic 领域实体
 *
 * @author verve
 * @since 2025-06-02
 */
@Data
public class EpicEntity {

    /**
     * Epic ID（epc_xxx）
     */
    private String id;

    private String repoId;

    private String title;

    private String description;

    private EpicStatusEnum status;

    /**
     * 附加规划指令
     */
    private String planningPrompt;

    private String model;

    /**
     * 拟定任务（依赖使用临时 ID）
     */
    private List<ProposedTask> proposedTasks = new ArrayList<>();

    /**
     * 确认后生成的真实任务 IDs
     */
    private List<String> taskIds = new ArrayList<>();

    /**
     * 规划会话记录
     */
    private List<String> sessionLog = new ArrayList<>();

    private boolean notReady;

    /**
     * 规划 claim 时间，null 表示未被领取
     */
    private LocalDateTime claimedAt;

    private LocalDateTime lastHeartbeatAt;

    /**
     * 信箱内容
     */
    private String feedback;

    private EpicFeedbackTypeEnum feedbackType;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    @JsonIgnore
    public boolean isClaimed() {
        return claimedAt != null;
    }

    @JsonIgnore
    public boolean isClaimable() {
        return status == EpicStatusEnum.PLANNING && claimedAt == null;
    }

    @JsonIgnore
    public boolean isConfirmable() {
        return status == EpicStatusEnum.DRAFT || status == EpicStatusEnum.READY;
    }

    @JsonIgnore
    public boolean hasFeedback() {
        return feedbackType != null;
    }

    public void validate() {
        if (StringUtils.isBlank(id)) {
            throw new IllegalStateException("Epic ID cannot be empty");
        }
        if (StringUtils.isBlank(repoId)) {
            throw new IllegalStateException("Repo ID cannot be empty");
        }
        if (StringUtils.isBlank(title)) {
            throw new IllegalStateException("Epic title cannot be empty");
        }
        if (title.length() > Constants.EPIC_TITLE_MAX_LENGTH) {
            throw new IllegalStateException("Epic title exceeds " + Constants.EPIC_TITLE_MAX_LENGTH + " characters");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    public EpicEntity copy() {
        EpicEntity copy = new EpicEntity();
        copy.setId(id);
        copy.setRepoId(repoId);
        copy.setTitle(title);
        copy.setDescription(description);
        copy.setStatus(status);
        copy.setPlanningPrompt(planningPrompt);
        copy.setModel(model);
        copy.setProposedTasks(proposedTasks == null ? new ArrayList<>()
                : proposedTasks.stream().map(ProposedTask::copy).collect(Collectors.toList()));
        copy.setTaskIds(taskIds == null ? new ArrayList<>() : new ArrayList<>(taskIds));
        copy.setSessionLog(sessionLog == null ? new ArrayList<>() : new ArrayList<>(sessionLog));
        copy.setNotReady(notReady);
        copy.setClaimedAt(claimedAt);
        copy.setLastHeartbeatAt(lastHeartbeatAt);
        copy.setFeedback(feedback);
        copy.setFeedbackType(feedbackType);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
