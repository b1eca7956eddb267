package com.verve.domain.task.model.valobj;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * worker 上报的任务执行结果。
 */
@Getter
@Builder
public class TaskCompletionReport {

    private final boolean success;
    private final String pullRequestUrl;
    private final int prNumber;
    private final String branchName;
    private final String error;
    private final String agentStatus;
    private final BigDecimal costUsd;
    /** 前置条件失败说明，非空时记录为关闭原因且不自动重试 */
    private final String prereqFailed;
    private final boolean noChanges;
    /** 是否为可重试错误（如限流） */
    private final boolean retryable;
}
