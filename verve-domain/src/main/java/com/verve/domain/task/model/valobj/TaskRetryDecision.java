package com.verve.domain.task.model.valobj;

import lombok.Getter;

/**
 * 重试预算判定结果。
 */
@Getter
public class TaskRetryDecision {

    public enum Outcome {
        RETRY,
        FAIL
    }

    private final Outcome outcome;
    private final int consecutiveFailures;
    private final String failReason;

    private TaskRetryDecision(Outcome outcome, int consecutiveFailures, String failReason) {
        this.outcome = outcome;
        this.consecutiveFailures = consecutiveFailures;
        this.failReason = failReason;
    }

    public static TaskRetryDecision retry(int consecutiveFailures) {
        return new TaskRetryDecision(Outcome.RETRY, consecutiveFailures, null);
    }

    public static TaskRetryDecision fail(String failReason, int consecutiveFailures) {
        return new TaskRetryDecision(Outcome.FAIL, consecutiveFailures, failReason);
    }

    public boolean isRetry() {
        return outcome == Outcome.RETRY;
    }
}
