package com.verve.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 任务日志批次 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskLogPO {

    private Long id;
    private String taskId;
    private Integer attempt;
    /**
     * 日志行 (JSONB 数组)
     */
    private String lines;
    private LocalDateTime createdAt;
}
