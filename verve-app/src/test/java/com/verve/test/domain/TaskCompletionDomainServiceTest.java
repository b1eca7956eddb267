package com.verve.test.domain;

import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.task.model.valobj.TaskCompletionReport;
import com.verve.domain.task.service.TaskCompletionDomainService;
import com.verve.domain.task.service.TaskCompletionDomainService.CompletionDecision;
import com.verve.types.enums.TaskStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TaskCompletionDomainServiceTest {

    private final TaskCompletionDomainService service = new TaskCompletionDomainService();

    @Test
    public void shouldScheduleRetryForRetryableFailure() {
        TaskCompletionReport report = TaskCompletionReport.builder().success(false).retryable(true).error("429").build();

        Assertions.assertEquals(CompletionDecision.SCHEDULE_RETRY, service.decide(runningTask(), report));
        Assertions.assertEquals("rate_limit: 429", service.retryReason(report));
    }

    @Test
    public void shouldFailOnPrerequisiteEvenIfRetryable() {
        TaskCompletionReport report = TaskCompletionReport.builder()
                .success(false).retryable(true).prereqFailed("no lockfile").build();
        TaskEntity task = runningTask();
        task.setBranchName("verve/a");

        Assertions.assertEquals(CompletionDecision.FAIL, service.decide(task, report));
        Assertions.assertEquals("no lockfile", service.closeReason(report, CompletionDecision.FAIL));
    }

    @Test
    public void shouldKeepExistingReviewWorkOnFailure() {
        TaskEntity task = runningTask();
        task.setPrNumber(4);
        task.setPullRequestUrl("https://github.com/acme/widgets/pull/4");

        CompletionDecision decision = service.decide(task,
                TaskCompletionReport.builder().success(false).error("tests failed").build());

        Assertions.assertEquals(CompletionDecision.REVIEW, decision);
    }

    @Test
    public void shouldFailWithoutExistingWork() {
        Assertions.assertEquals(CompletionDecision.FAIL, service.decide(runningTask(),
                TaskCompletionReport.builder().success(false).error("tests failed").build()));
    }

    @Test
    public void shouldPreferPullRequestOverBranch() {
        TaskCompletionReport report = TaskCompletionReport.builder()
                .success(true)
                .pullRequestUrl("https://github.com/acme/widgets/pull/9")
                .prNumber(9)
                .branchName("verve/a")
                .build();

        Assertions.assertEquals(CompletionDecision.SET_PULL_REQUEST, service.decide(runningTask(), report));
    }

    @Test
    public void shouldSetBranchWhenOnlyBranchReported() {
        TaskCompletionReport report = TaskCompletionReport.builder().success(true).branchName("verve/a").build();

        Assertions.assertEquals(CompletionDecision.SET_BRANCH, service.decide(runningTask(), report));
    }

    @Test
    public void shouldCloseWithNoChangesOnlyOnClosePath() {
        TaskCompletionReport report = TaskCompletionReport.builder().success(true).noChanges(true).build();

        Assertions.assertEquals(CompletionDecision.CLOSE, service.decide(runningTask(), report));
        Assertions.assertEquals(TaskCompletionDomainService.NO_CHANGES_REASON,
                service.closeReason(report, CompletionDecision.CLOSE));
        Assertions.assertNull(service.closeReason(report, CompletionDecision.REVIEW));
    }

    private TaskEntity runningTask() {
        TaskEntity task = new TaskEntity();
        task.setId("tsk-abcde");
        task.setStatus(TaskStatusEnum.RUNNING);
        return task;
    }
}
