package com.verve.api.dto;

import lombok.Data;

import java.math.BigDecimal;

/**
 * Worker 完成上报请求 DTO
 */
@Data
public class AgentCompleteRequestDTO {

    private Boolean success;
    private String pullRequestUrl;
    private Integer prNumber;
    private String branchName;
    private String error;
    private String agentStatus;
    private BigDecimal costUsd;
    private String prereqFailed;
    private Boolean noChanges;
    private Boolean retryable;
}
