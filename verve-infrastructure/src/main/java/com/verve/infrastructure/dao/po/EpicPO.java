package com.verve.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Epic PO
 *
 * @author verve
 * @since 2025-06-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EpicPO {

    private String id;

    private String repoId;

    private String title;

    private String description;

    private String status;

    private String planningPrompt;

    private String model;

    /**
     * 拟定任务 (JSONB)
     */
    private String proposedTasks;

    /**
     * 任务 IDs (JSONB 数组)
     */
    private String taskIds;

    /**
     * 会话记录 (JSONB 数组)
     */
    private String sessionLog;

    private Boolean notReady;

    private LocalDateTime claimedAt;

    private LocalDateTime lastHeartbeatAt;

    private String feedback;

    private String feedbackType;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
