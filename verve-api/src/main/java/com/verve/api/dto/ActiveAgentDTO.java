package com.verve.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 运行中的 agent 会话（任务执行或 Epic 规划）
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActiveAgentDTO {

    private String taskId;
    private String taskTitle;
    private String repoId;
    private LocalDateTime startedAt;
    private Long runningForMs;
    private Integer attempt;
    private BigDecimal costUsd;
    private String model;
    private String epicId;
    private Boolean planning;
    private String epicTitle;
}
