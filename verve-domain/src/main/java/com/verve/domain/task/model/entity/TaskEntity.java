package com.verve.domain.task.model.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.verve.types.enums.TaskStatusEnum;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 任务领域实体
 *
 * @author verve
 * @since 2025-06-02
 */
@Data
public class TaskEntity {

    /**
     * 任务 ID（tsk-xxxxx）
     */
    private String id;

    /**
     * 所属仓库 ID
     */
    private String repoId;

    /**
     * 所属 Epic ID，可为空
     */
    private String epicId;

    /**
     * 标题
     */
    private String title;

    /**
     * 描述
     */
    private String description;

    /**
     * 验收标准（有序）
     */
    private List<String> acceptanceCriteria = new ArrayList<>();

    /**
     * 状态
     */
    private TaskStatusEnum status;

    /**
     * 依赖任务 IDs（保持插入顺序，无重复）
     */
    private List<String> dependsOn = new ArrayList<>();

    /**
     * 是否放行领取
     */
    private boolean ready = true;

    /**
     * 当前尝试序号，从 1 开始
     */
    private int attempt = 1;

    /**
     * 最大尝试次数
     */
    private int maxAttempts;

    /**
     * 最近一次重试原因
     */
    private String retryReason;

    /**
     * 最近一次重试上下文（如 CI 失败日志）
     */
    private String retryContext;

    /**
     * 最近一次自动重试的失败类别（熔断判定）
     */
    private String retryCategory;

    /**
     * agent 上报的结构化状态
     */
    private String agentStatus;

    /**
     * 同类失败连续次数
     */
    private int consecutiveFailures;

    /**
     * 累计花费（USD）
     */
    private BigDecimal costUsd = BigDecimal.ZERO;

    /**
     * 花费上限（USD），0 表示不限制
     */
    private BigDecimal maxCostUsd = BigDecimal.ZERO;

    /**
     * 是否跳过 PR 评审
     */
    private boolean skipPr;

    /**
     * 使用的模型
     */
    private String model;

    private String branchName;

    private String pullRequestUrl;

    private int prNumber;

    private String closeReason;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime startedAt;

    private LocalDateTime lastHeartbeatAt;

    @JsonIgnore
    public boolean isClaimable() {
        return status == TaskStatusEnum.PENDING && ready;
    }

    @JsonIgnore
    public boolean hasPullRequest() {
        return StringUtils.isNotBlank(pullRequestUrl) || prNumber > 0;
    }

    @JsonIgnore
    public boolean hasBranch() {
        return StringUtils.isNotBlank(branchName);
    }

    @JsonIgnore
    public boolean hasCostCeiling() {
        return maxCostUsd != null && maxCostUsd.signum() > 0;
    }

    @JsonIgnore
    public boolean isCostBudgetExhausted() {
        return hasCostCeiling() && costUsd != null && costUsd.compareTo(maxCostUsd) >= 0;
    }

    @JsonIgnore
    public boolean isAttemptBudgetExhausted() {
        return maxAttempts > 0 && attempt >= maxAttempts;
    }

    /**
     * 校验新建任务的必填字段
     */
    public void validate() {
        if (StringUtils.isBlank(id)) {
            throw new IllegalStateException("Task ID cannot be empty");
        }
        if (StringUtils.isBlank(repoId)) {
            throw new IllegalStateException("Repo ID cannot be empty");
        }
        if (StringUtils.isBlank(title)) {
            throw new IllegalStateException("Task title cannot be empty");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    /**
     * 深拷贝，内存仓储用于隔离读写。
     */
    public TaskEntity copy() {
        TaskEntity copy = new TaskEntity();
        copy.setId(id);
        copy.setRepoId(repoId);
        copy.setEpicId(epicId);
        copy.setTitle(title);
        copy.setDescription(description);
        copy.setAcceptanceCriteria(acceptanceCriteria == null ? new ArrayList<>() : new ArrayList<>(acceptanceCriteria));
        copy.setStatus(status);
        copy.setDependsOn(dependsOn == null ? new ArrayList<>() : new ArrayList<>(dependsOn));
        copy.setReady(ready);
        copy.setAttempt(attempt);
        copy.setMaxAttempts(maxAttempts);
        copy.setRetryReason(retryReason);
        copy.setRetryContext(retryContext);
        copy.setRetryCategory(retryCategory);
        copy.setAgentStatus(agentStatus);
        copy.setConsecutiveFailures(consecutiveFailures);
        copy.setCostUsd(costUsd);
        copy.setMaxCostUsd(maxCostUsd);
        copy.setSkipPr(skipPr);
        copy.setModel(model);
        copy.setBranchName(branchName);
        copy.setPullRequestUrl(pullRequestUrl);
        copy.setPrNumber(prNumber);
        copy.setCloseReason(closeReason);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        copy.setStartedAt(startedAt);
        copy.setLastHeartbeatAt(lastHeartbeatAt);
        return copy;
    }
}
