package com.verve.test;

import com.verve.domain.event.model.entity.DomainEventEntity;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.task.model.valobj.TaskCompletionReport;
import com.verve.domain.task.model.valobj.TaskEditCommand;
import com.verve.domain.task.model.valobj.TaskStartOverCommand;
import com.verve.domain.task.service.TaskCompletionDomainService;
import com.verve.domain.task.service.TaskRetryPolicyDomainService;
import com.verve.test.support.VerveTestFixture;
import com.verve.types.common.Constants;
import com.verve.types.enums.DomainEventTypeEnum;
import com.verve.types.enums.ResponseCode;
import com.verve.types.enums.TaskStatusEnum;
import com.verve.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class TaskCommandServiceTest {

    private VerveTestFixture fixture;
    private String repoId;

    @BeforeEach
    public void setUp() {
        fixture = new VerveTestFixture();
        repoId = fixture.newRepo().getId();
    }

    @Test
    public void shouldCreatePendingTaskWithDefaults() {
        TaskEntity task = fixture.newTask(repoId, "Add login page");

        Assertions.assertEquals(TaskStatusEnum.PENDING, task.getStatus());
        Assertions.assertEquals(1, task.getAttempt());
        Assertions.assertEquals(Constants.DEFAULT_MAX_ATTEMPTS, task.getMaxAttempts());
        Assertions.assertEquals(Constants.FALLBACK_MODEL, task.getModel());
        Assertions.assertTrue(task.isReady());
        Assertions.assertTrue(task.getId().startsWith("tsk-"));
        Assertions.assertEquals(DomainEventTypeEnum.TASK_CREATED, fixture.events.get(0).getEventType());
    }

    @Test
    public void shouldUseDefaultModelSetting() {
        fixture.settingCommandService.putSetting(Constants.SETTING_DEFAULT_MODEL, "opus");

        TaskEntity task = fixture.newTask(repoId, "Add login page");

        Assertions.assertEquals("opus", task.getModel());
    }

    @Test
    public void shouldRejectUnknownDependency() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.newTask(repoId, "Add login page", "tsk-zzzzz"));

        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
        Assertions.assertTrue(fixture.taskRepository.findAll().isEmpty());
    }

    @Test
    public void shouldRejectMalformedDependency() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.newTask(repoId, "Add login page", "not-a-task"));

        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldRejectTaskForUnknownRepo() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.newTask("repo_00000000000000000000000000", "Add login page"));

        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldRemoveDependencyIdempotently() {
        TaskEntity a = fixture.newTask(repoId, "A");
        TaskEntity b = fixture.newTask(repoId, "B");
        TaskEntity c = fixture.newTask(repoId, "C", a.getId(), b.getId());

        TaskEntity afterRemove = fixture.taskCommandService.removeDependency(c.getId(), a.getId());
        Assertions.assertEquals(Collections.singletonList(b.getId()), afterRemove.getDependsOn());

        TaskEntity afterSecondRemove = fixture.taskCommandService.removeDependency(c.getId(), a.getId());
        Assertions.assertEquals(Collections.singletonList(b.getId()), afterSecondRemove.getDependsOn());
    }

    @Test
    public void shouldRejectSelfDependencyOnEdit() {
        TaskEntity task = fixture.newTask(repoId, "A");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.taskCommandService.updatePendingTask(task.getId(), TaskEditCommand.builder()
                        .dependsOn(Collections.singletonList(task.getId()))
                        .build()));

        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldEditOnlyPendingTask() {
        TaskEntity task = fixture.newTask(repoId, "A");
        TaskEntity edited = fixture.taskCommandService.updatePendingTask(task.getId(), TaskEditCommand.builder()
                .title("A renamed")
                .maxCostUsd(new BigDecimal("2.50"))
                .build());
        Assertions.assertEquals("A renamed", edited.getTitle());
        Assertions.assertEquals(0, new BigDecimal("2.50").compareTo(edited.getMaxCostUsd()));

        fixture.taskCommandService.claimPendingTask(null);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.taskCommandService.updatePendingTask(task.getId(), TaskEditCommand.builder()
                        .title("too late")
                        .build()));
        Assertions.assertTrue(ex.is(ResponseCode.PRECONDITION_FAILED));
    }

    @Test
    public void shouldNotClaimTaskThatIsNotReady() {
        TaskEntity task = fixture.newTask(repoId, "A");
        fixture.taskCommandService.setReady(task.getId(), false);

        Assertions.assertNull(fixture.taskCommandService.claimPendingTask(null));

        fixture.taskCommandService.setReady(task.getId(), true);
        TaskEntity claimed = fixture.taskCommandService.claimPendingTask(null);
        Assertions.assertNotNull(claimed);
        Assertions.assertEquals(TaskStatusEnum.RUNNING, claimed.getStatus());
        Assertions.assertNotNull(claimed.getStartedAt());
        Assertions.assertNotNull(claimed.getLastHeartbeatAt());
        Assertions.assertEquals(1, claimed.getAttempt());
    }

    @Test
    public void shouldClaimOldestTaskFirstAndFilterByRepo() {
        String otherRepoId = fixture.newRepo().getId();
        TaskEntity first = fixture.newTask(repoId, "first");
        fixture.newTask(repoId, "second");
        TaskEntity other = fixture.newTask(otherRepoId, "other");

        TaskEntity claimed = fixture.taskCommandService.claimPendingTask(null);
        Assertions.assertEquals(first.getId(), claimed.getId());

        TaskEntity claimedOther = fixture.taskCommandService.claimPendingTask(Collections.singletonList(otherRepoId));
        Assertions.assertEquals(other.getId(), claimedOther.getId());
    }

    @Test
    public void shouldBreakCreatedAtTiesById() {
        LocalDateTime createdAt = LocalDateTime.now().minusMinutes(1);
        fixture.taskRepository.save(pendingTask("tsk-bbbbb", createdAt));
        fixture.taskRepository.save(pendingTask("tsk-aaaaa", createdAt));

        List<TaskEntity> candidates = fixture.taskRepository.findClaimCandidates(null);
        Assertions.assertEquals(Arrays.asList("tsk-aaaaa", "tsk-bbbbb"),
                Arrays.asList(candidates.get(0).getId(), candidates.get(1).getId()));
        List<TaskEntity> newestFirst = fixture.taskRepository.findByRepoId(repoId);
        Assertions.assertEquals("tsk-bbbbb", newestFirst.get(0).getId());
        Assertions.assertEquals("tsk-aaaaa", fixture.taskCommandService.claimPendingTask(null).getId());
    }

    @Test
    public void shouldClaimEachTaskExactlyOnceUnderConcurrency() throws Exception {
        for (int i = 0; i < 20; i++) {
            fixture.newTask(repoId, "task-" + i);
        }
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<String>>> futures = new ArrayList<>();
            for (int worker = 0; worker < 4; worker++) {
                Callable<List<String>> claimer = () -> {
                    start.await(2, TimeUnit.SECONDS);
                    List<String> ids = new ArrayList<>();
                    TaskEntity claimed;
                    while ((claimed = fixture.taskCommandService.claimPendingTask(null)) != null) {
                        ids.add(claimed.getId());
                    }
                    return ids;
                };
                futures.add(pool.submit(claimer));
            }
            start.countDown();

            Set<String> unique = new HashSet<>();
            int total = 0;
            for (Future<List<String>> future : futures) {
                List<String> ids = future.get(5, TimeUnit.SECONDS);
                total += ids.size();
                unique.addAll(ids);
            }
            Assertions.assertEquals(20, total, "每个任务只能被领取一次");
            Assertions.assertEquals(20, unique.size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void shouldRejectHeartbeatForTaskNotRunning() {
        TaskEntity task = fixture.newTask(repoId, "A");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.taskCommandService.heartbeat(task.getId()));

        Assertions.assertTrue(ex.is(ResponseCode.PRECONDITION_FAILED));
    }

    @Test
    public void shouldReportNotFoundForMissingTask() {
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.taskCommandService.closeTask("tsk-zzzzz", null));

        Assertions.assertTrue(ex.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldKeepFirstBranchNameAcrossReports() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");

        fixture.taskCommandService.setBranch(task.getId(), "verve/first");
        TaskEntity second = fixture.taskCommandService.setBranch(task.getId(), "verve/second");

        Assertions.assertEquals("verve/first", second.getBranchName());
        Assertions.assertEquals(TaskStatusEnum.REVIEW, second.getStatus());
    }

    @Test
    public void shouldMoveToReviewWhenPullRequestReported() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");

        TaskEntity completed = fixture.taskCommandService.completeTask(task.getId(), TaskCompletionReport.builder()
                .success(true)
                .pullRequestUrl("https://github.com/acme/widgets/pull/7")
                .prNumber(7)
                .costUsd(new BigDecimal("0.40"))
                .agentStatus("done")
                .build());

        Assertions.assertEquals(TaskStatusEnum.REVIEW, completed.getStatus());
        Assertions.assertEquals(7, completed.getPrNumber());
        Assertions.assertEquals("done", completed.getAgentStatus());
        Assertions.assertEquals(0, new BigDecimal("0.40").compareTo(completed.getCostUsd()));
    }

    @Test
    public void shouldCloseWithNoChangesReason() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");

        TaskEntity completed = fixture.taskCommandService.completeTask(task.getId(), TaskCompletionReport.builder()
                .success(true)
                .noChanges(true)
                .build());

        Assertions.assertEquals(TaskStatusEnum.CLOSED, completed.getStatus());
        Assertions.assertEquals(TaskCompletionDomainService.NO_CHANGES_REASON, completed.getCloseReason());
    }

    @Test
    public void shouldFailWithPrerequisiteReason() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");

        TaskEntity completed = fixture.taskCommandService.completeTask(task.getId(), TaskCompletionReport.builder()
                .success(false)
                .error("exit 1")
                .prereqFailed("missing package.json")
                .retryable(true)
                .build());

        Assertions.assertEquals(TaskStatusEnum.FAILED, completed.getStatus());
        Assertions.assertEquals("missing package.json", completed.getCloseReason());
    }

    @Test
    public void shouldScheduleRetryOnRateLimitUntilBreakerOpens() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");
        TaskCompletionReport rateLimited = TaskCompletionReport.builder()
                .success(false)
                .error("429")
                .retryable(true)
                .build();

        TaskEntity first = fixture.taskCommandService.completeTask(task.getId(), rateLimited);
        Assertions.assertEquals(TaskStatusEnum.PENDING, first.getStatus());
        Assertions.assertEquals(2, first.getAttempt());
        Assertions.assertEquals("rate_limit: 429", first.getRetryReason());
        Assertions.assertNull(first.getLastHeartbeatAt());

        fixture.taskCommandService.claimPendingTask(null);
        TaskEntity second = fixture.taskCommandService.completeTask(task.getId(), rateLimited);
        Assertions.assertEquals(TaskStatusEnum.PENDING, second.getStatus());
        Assertions.assertEquals(3, second.getAttempt());

        fixture.taskCommandService.claimPendingTask(null);
        TaskEntity third = fixture.taskCommandService.completeTask(task.getId(), rateLimited);
        Assertions.assertEquals(TaskStatusEnum.FAILED, third.getStatus());
        Assertions.assertEquals(TaskRetryPolicyDomainService.CIRCUIT_BREAKER_OPEN + "rate_limit: 429",
                third.getCloseReason());
    }

    @Test
    public void shouldRejectCompletionOfTaskNotRunning() {
        TaskEntity task = fixture.newTask(repoId, "A");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.taskCommandService.completeTask(task.getId(),
                        TaskCompletionReport.builder().success(true).build()));

        Assertions.assertTrue(ex.is(ResponseCode.PRECONDITION_FAILED));
    }

    @Test
    public void shouldManuallyRetryReviewTaskWithInstructions() {
        TaskEntity task = fixture.newReviewTask(repoId, "A", 3);

        TaskEntity retried = fixture.taskCommandService.manualRetryTask(task.getId(), "use the new API");

        Assertions.assertEquals(TaskStatusEnum.PENDING, retried.getStatus());
        Assertions.assertEquals(2, retried.getAttempt());
        Assertions.assertEquals("use the new API", retried.getRetryReason());
        Assertions.assertEquals(3, retried.getPrNumber());
    }

    @Test
    public void shouldResetAttemptOnFeedbackRetry() {
        TaskEntity task = fixture.newReviewTask(repoId, "A", 3);
        fixture.taskCommandService.manualRetryTask(task.getId(), null);
        fixture.taskCommandService.claimPendingTask(null);
        fixture.taskCommandService.setPullRequest(task.getId(), "https://github.com/acme/widgets/pull/3", 3);

        TaskEntity retried = fixture.taskCommandService.feedbackRetryTask(task.getId(), "rename the button");

        Assertions.assertEquals(TaskStatusEnum.PENDING, retried.getStatus());
        Assertions.assertEquals(1, retried.getAttempt());
        Assertions.assertEquals("rename the button", retried.getRetryReason());
    }

    @Test
    public void shouldRejectBlankFeedback() {
        TaskEntity task = fixture.newReviewTask(repoId, "A", 3);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.taskCommandService.feedbackRetryTask(task.getId(), "  "));

        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldStartOverAndDropLogs() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");
        fixture.taskCommandService.appendLogs(task.getId(), 1, Arrays.asList("cloning", "editing"));
        fixture.taskCommandService.setBranch(task.getId(), "verve/a");

        TaskEntity before = fixture.taskCommandService.startOverTask(task.getId(), TaskStartOverCommand.builder()
                .title("A again")
                .build());

        Assertions.assertEquals(TaskStatusEnum.REVIEW, before.getStatus());
        Assertions.assertEquals("verve/a", before.getBranchName());
        TaskEntity after = fixture.taskCommandService.getTask(task.getId());
        Assertions.assertEquals(TaskStatusEnum.PENDING, after.getStatus());
        Assertions.assertEquals("A again", after.getTitle());
        Assertions.assertEquals(1, after.getAttempt());
        Assertions.assertNull(after.getBranchName());
        Assertions.assertTrue(fixture.taskCommandService.readLogs(task.getId()).isEmpty());
    }

    @Test
    public void shouldRejectStartOverFromPending() {
        TaskEntity task = fixture.newTask(repoId, "A");

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.taskCommandService.startOverTask(task.getId(), TaskStartOverCommand.builder().build()));

        Assertions.assertTrue(ex.is(ResponseCode.PRECONDITION_FAILED));
    }

    @Test
    public void shouldCloseNonTerminalTaskOnlyOnce() {
        TaskEntity task = fixture.newTask(repoId, "A");

        TaskEntity closed = fixture.taskCommandService.closeTask(task.getId(), "not needed");
        Assertions.assertEquals(TaskStatusEnum.CLOSED, closed.getStatus());
        Assertions.assertEquals("not needed", closed.getCloseReason());

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.taskCommandService.closeTask(task.getId(), "again"));
        Assertions.assertTrue(ex.is(ResponseCode.PRECONDITION_FAILED));
    }

    @Test
    public void shouldAppendLogsPerAttemptAndPublishLogEvent() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");
        fixture.events.clear();

        fixture.taskCommandService.appendLogs(task.getId(), 1, Arrays.asList("one", "two"));
        fixture.taskCommandService.appendLogs(task.getId(), 2, Collections.singletonList("three"));

        Assertions.assertEquals(Arrays.asList("one", "two", "three"), fixture.taskCommandService.readLogs(task.getId()));
        Assertions.assertEquals(2, fixture.taskCommandService.readLogBatches(task.getId()).size());
        DomainEventEntity event = fixture.events.get(0);
        Assertions.assertEquals(DomainEventTypeEnum.LOGS_APPENDED, event.getEventType());
        Assertions.assertEquals(Arrays.asList("one", "two"), event.getLogs());
    }

    @Test
    public void shouldPublishFullTaskStateOnEveryTransition() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");

        fixture.taskCommandService.closeTask(task.getId(), null);

        DomainEventEntity last = fixture.events.get(fixture.events.size() - 1);
        Assertions.assertEquals(DomainEventTypeEnum.TASK_UPDATED, last.getEventType());
        Assertions.assertEquals(TaskStatusEnum.CLOSED, last.getTask().getStatus());
        Assertions.assertEquals(repoId, last.getRepoId());
    }

    private TaskEntity pendingTask(String id, LocalDateTime createdAt) {
        TaskEntity task = new TaskEntity();
        task.setId(id);
        task.setRepoId(repoId);
        task.setTitle(id);
        task.setStatus(TaskStatusEnum.PENDING);
        task.setReady(true);
        task.setAttempt(1);
        task.setMaxAttempts(3);
        task.setCostUsd(BigDecimal.ZERO);
        task.setMaxCostUsd(BigDecimal.ZERO);
        task.setCreatedAt(createdAt);
        task.setUpdatedAt(createdAt);
        return task;
    }
}
