package com.verve.test.domain;

import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.task.model.valobj.TaskRetryDecision;
import com.verve.domain.task.service.TaskRetryPolicyDomainService;
import com.verve.types.enums.TaskStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

public class TaskRetryPolicyDomainServiceTest {

    private final TaskRetryPolicyDomainService service = new TaskRetryPolicyDomainService();

    @Test
    public void shouldRetryFirstReviewFailure() {
        TaskEntity task = newTask(1, 5);

        TaskRetryDecision decision = service.decideReviewRetry(task, "ci_failure:lint");

        Assertions.assertTrue(decision.isRetry());
        Assertions.assertEquals(1, decision.getConsecutiveFailures());
    }

    @Test
    public void shouldOpenBreakerOnRepeatedReviewCategory() {
        TaskEntity task = newTask(2, 5);
        task.setRetryCategory("ci_failure:lint");
        task.setConsecutiveFailures(1);

        TaskRetryDecision decision = service.decideReviewRetry(task, "ci_failure:lint");

        Assertions.assertFalse(decision.isRetry());
        Assertions.assertEquals("repeated failure: ci_failure:lint", decision.getFailReason());
    }

    @Test
    public void shouldResetStreakWhenCategoryChanges() {
        TaskEntity task = newTask(2, 5);
        task.setRetryCategory("ci_failure:lint");
        task.setConsecutiveFailures(1);

        TaskRetryDecision decision = service.decideReviewRetry(task, "merge_conflict");

        Assertions.assertTrue(decision.isRetry());
        Assertions.assertEquals(1, decision.getConsecutiveFailures());
    }

    @Test
    public void shouldFailWhenAttemptBudgetExhausted() {
        TaskEntity task = newTask(5, 5);

        TaskRetryDecision decision = service.decideReviewRetry(task, "merge_conflict");

        Assertions.assertFalse(decision.isRetry());
        Assertions.assertEquals(TaskRetryPolicyDomainService.RETRY_BUDGET_EXHAUSTED, decision.getFailReason());
    }

    @Test
    public void shouldCheckCostBeforeAttempts() {
        TaskEntity task = newTask(5, 5);
        task.setMaxCostUsd(new BigDecimal("1.00"));
        task.setCostUsd(new BigDecimal("1.00"));

        TaskRetryDecision decision = service.decideScheduledRetry(task, "rate_limit: 429");

        Assertions.assertEquals(TaskRetryPolicyDomainService.COST_BUDGET_EXHAUSTED, decision.getFailReason());
    }

    @Test
    public void shouldIgnoreCostWhenNoCeiling() {
        TaskEntity task = newTask(1, 5);
        task.setCostUsd(new BigDecimal("99.00"));

        Assertions.assertTrue(service.decideScheduledRetry(task, "rate_limit: 429").isRetry());
    }

    @Test
    public void shouldAllowTwoScheduledRepeatsBeforeBreaker() {
        TaskEntity task = newTask(2, 10);
        task.setRetryReason("rate_limit: 429");
        task.setConsecutiveFailures(1);
        Assertions.assertTrue(service.decideScheduledRetry(task, "rate_limit: 429").isRetry());

        task.setConsecutiveFailures(2);
        TaskRetryDecision decision = service.decideScheduledRetry(task, "rate_limit: 429");
        Assertions.assertFalse(decision.isRetry());
        Assertions.assertEquals(3, decision.getConsecutiveFailures());
    }

    @Test
    public void shouldLetFeedbackRetryIgnoreAttemptBudget() {
        TaskEntity task = newTask(5, 5);

        Assertions.assertTrue(service.decideFeedbackRetry(task).isRetry());

        task.setMaxCostUsd(new BigDecimal("0.50"));
        task.setCostUsd(new BigDecimal("0.75"));
        Assertions.assertFalse(service.decideFeedbackRetry(task).isRetry());
    }

    private TaskEntity newTask(int attempt, int maxAttempts) {
        TaskEntity task = new TaskEntity();
        task.setId("tsk-abcde");
        task.setStatus(TaskStatusEnum.REVIEW);
        task.setAttempt(attempt);
        task.setMaxAttempts(maxAttempts);
        return task;
    }
}
