package com.verve.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * 创建任务请求 DTO
 */
@Data
public class TaskCreateRequestDTO {

    private String title;
    private String description;
    private List<String> acceptanceCriteria;
    private List<String> dependsOn;

    /**
     * 为空时使用默认重试上限
     */
    private Integer maxAttempts;

    /**
     * 0 或空表示不设成本上限
     */
    private BigDecimal maxCostUsd;
    private Boolean skipPr;
    private String model;

    /**
     * 为空时视为 true
     */
    private Boolean ready;
}
