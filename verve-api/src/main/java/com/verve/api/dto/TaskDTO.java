package com.verve.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 任务视图 DTO，字段与任务实体一一对应（不含日志）。
 */
@Data
public class TaskDTO {

    private String id;
    private String repoId;
    private String epicId;
    private String title;
    private String description;
    private List<String> acceptanceCriteria;
    private String status;
    private List<String> dependsOn;
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
