package com.verve.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * 修改 pending 任务请求 DTO，空字段保持原值。
 */
@Data
public class TaskUpdateRequestDTO {

    private String title;
    private String description;
    private List<String> acceptanceCriteria;
    private List<String> dependsOn;
    private Integer maxAttempts;
    private BigDecimal maxCostUsd;
    private Boolean skipPr;
    private String model;
    private Boolean ready;
}
