package com.verve.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * Agent 活动快照
 */
@Data
public class AgentMetricsDTO {

    private Integer runningAgents;
    private Integer pendingTasks;
    private Integer reviewTasks;
    private Integer totalTasks;
    private Integer completedTasks;
    private Integer failedTasks;
    private BigDecimal totalCostUsd;
    private List<ActiveAgentDTO> activeAgents;
    private List<RecentCompletionDTO> recentCompletions;
    private List<WorkerDTO> workers;
}
