package com.verve.domain.task.model.valobj;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * pending 任务可编辑字段，null 表示保持不变。
 */
@Getter
@Builder
public class TaskEditCommand {

    private final String title;
    private final String description;
    private final List<String> acceptanceCriteria;
    private final List<String> dependsOn;
    private final Integer maxAttempts;
    private final BigDecimal maxCostUsd;
    private final Boolean skipPr;
    private final String model;
    private final Boolean ready;
}
