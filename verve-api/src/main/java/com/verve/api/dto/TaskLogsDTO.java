package com.verve.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 任务日志 DTO，lines 为全部批次按追加顺序拼接。
 */
@Data
public class TaskLogsDTO {

    private String taskId;
    private List<String> lines;
    private List<TaskLogBatchDTO> batches;
}
