package com.verve.domain.task.service;

import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.task.model.valobj.TaskRetryDecision;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

/**
 * Task 重试预算领域服务：花费上限、尝试次数上限与同类失败熔断。
 */
@Service
public class TaskRetryPolicyDomainService {

    public static final String COST_BUDGET_EXHAUSTED = "cost budget exhausted";
    public static final String RETRY_BUDGET_EXHAUSTED = "retry budget exhausted";
    public static final String CIRCUIT_BREAKER_OPEN = "repeated failure: ";

    /** review 自动重试：同类失败连续 2 次即失败 */
    public static final int REVIEW_BREAKER_THRESHOLD = 2;

    /** running 计划重试：同一原因连续 3 次即失败 */
    public static final int RUNNING_BREAKER_THRESHOLD = 3;

    public TaskRetryDecision decideReviewRetry(TaskEntity task, String category) {
        TaskRetryDecision budget = checkBudget(task);
        if (budget != null) {
            return budget;
        }
        int consecutive = 1;
        if (StringUtils.isNotBlank(category) && category.equals(task.getRetryCategory())) {
            consecutive = task.getConsecutiveFailures() + 1;
        }
        if (consecutive >= REVIEW_BREAKER_THRESHOLD) {
            return TaskRetryDecision.fail(CIRCUIT_BREAKER_OPEN + category, consecutive);
        }
        return TaskRetryDecision.retry(consecutive);
    }

    public TaskRetryDecision decideScheduledRetry(TaskEntity task, String reason) {
        TaskRetryDecision budget = checkBudget(task);
        if (budget != null) {
            return budget;
        }
        int consecutive = 1;
        if (reason != null && reason.equals(task.getRetryReason())) {
            consecutive = task.getConsecutiveFailures() + 1;
        }
        if (consecutive >= RUNNING_BREAKER_THRESHOLD) {
            return TaskRetryDecision.fail(CIRCUIT_BREAKER_OPEN + reason, consecutive);
        }
        return TaskRetryDecision.retry(consecutive);
    }

    /**
     * 用户反馈驱动的重试只受花费上限约束。
     */
    public TaskRetryDecision decideFeedbackRetry(TaskEntity task) {
        if (task.isCostBudgetExhausted()) {
            return TaskRetryDecision.fail(COST_BUDGET_EXHAUSTED, task.getConsecutiveFailures());
        }
        return TaskRetryDecision.retry(0);
    }

    private TaskRetryDecision checkBudget(TaskEntity task) {
        if (task.isCostBudgetExhausted()) {
            return TaskRetryDecision.fail(COST_BUDGET_EXHAUSTED, task.getConsecutiveFailures());
        }
        if (task.isAttemptBudgetExhausted()) {
            return TaskRetryDecision.fail(RETRY_BUDGET_EXHAUSTED, task.getConsecutiveFailures());
        }
        return null;
    }
}
