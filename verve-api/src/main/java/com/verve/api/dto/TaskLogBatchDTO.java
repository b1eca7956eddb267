package com.verve.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 单次追加的日志批次
 */
@Data
public class TaskLogBatchDTO {

    private Integer attempt;
    private List<String> lines;
    private LocalDateTime createdAt;
}
