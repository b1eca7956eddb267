package com.verve.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 任务 PO
 *
 * @author verve
 * @since 2025-06-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPO {

    private String id;

    private String repoId;

    private String epicId;

    private String title;

    private String description;

    /**
     * 验收标准 (JSONB 数组)
     */
    private String acceptanceCriteria;

    /**
     * 状态编码
     */
    private String status;

    /**
     * 依赖任务 IDs (JSONB 数组)
     */
    private String dependsOn;

    private Boolean ready;

    private Integer attempt;

    private Integer maxAttempts;

    private String retryReason;

    private String retryContext;

    private String retryCategory;

    private String agentStatus;

    private Integer consecutiveFailures;

    private BigDecimal costUsd;

    private BigDecimal maxCostUsd;

    private Boolean skipPr;

    private String model;

    private String branchName;

    private String pullRequestUrl;

    private Integer prNumber;

    private String closeReason;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    private LocalDateTime startedAt;

    private LocalDateTime lastHeartbeatAt;
}
