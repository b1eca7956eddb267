package com.verve.api.dto;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Epic 视图 DTO
 */
@Data
public class EpicDTO {

    private String id;
    private String repoId;
    private String title;
    private String description;
    private String status;
    private String planningPrompt;
    private String model;
    private List<ProposedTaskDTO> proposedTasks;
    private List<String> taskIds;
    private List<String> sessionLog;
    private Boolean notReady;
    private LocalDateTime claimedAt;
    private LocalDateTime lastHeartbeatAt;
    private String feedback;
    private String feedbackType;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
