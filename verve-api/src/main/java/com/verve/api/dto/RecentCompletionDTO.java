package com.verve.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 最近进入终态的任务
 */
@Data
public class RecentCompletionDTO {

    private String taskId;
    private String taskTitle;
    private String repoId;
    private String status;
    private Long durationMs;
    private BigDecimal costUsd;
    private Integer attempt;
    private LocalDateTime finishedAt;
}
