package com.verve.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Worker 视图 DTO
 */
@Data
public class WorkerDTO {

    private String workerId;
    private Integer maxConcurrentTasks;
    private Integer activeTasks;
    private LocalDateTime connectedAt;
    private LocalDateTime lastPollAt;
    private Long uptimeMs;
    private Boolean polling;
}
