package com.verve.test;

import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.test.support.VerveTestFixture;
import com.verve.trigger.application.command.TaskCommandService;
import com.verve.trigger.job.StaleWorkRecoveryDaemon;
import com.verve.types.enums.TaskStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

public class StaleWorkRecoveryDaemonTest {

    private VerveTestFixture fixture;
    private StaleWorkRecoveryDaemon daemon;
    private String repoId;

    @BeforeEach
    public void setUp() {
        fixture = new VerveTestFixture();
        daemon = new StaleWorkRecoveryDaemon(fixture.taskCommandService, fixture.epicCommandService, 300000L, 300000L);
        repoId = fixture.newRepo().getId();
    }

    @Test
    public void shouldRequeueTaskWhoseHeartbeatExpired() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");

        int requeued = daemon.requeueStaleTasks(LocalDateTime.now().plusMinutes(1));

        Assertions.assertEquals(1, requeued);
        TaskEntity after = fixture.taskCommandService.getTask(task.getId());
        Assertions.assertEquals(TaskStatusEnum.PENDING, after.getStatus());
        Assertions.assertEquals(2, after.getAttempt());
        Assertions.assertEquals(TaskCommandService.STALE_REASON, after.getRetryReason());
        Assertions.assertNull(after.getLastHeartbeatAt());
    }

    @Test
    public void shouldKeepTaskWithFreshHeartbeat() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");

        int requeued = daemon.requeueStaleTasks(LocalDateTime.now().minusMinutes(5));

        Assertions.assertEquals(0, requeued);
        Assertions.assertEquals(TaskStatusEnum.RUNNING, fixture.taskCommandService.getTask(task.getId()).getStatus());
    }

    @Test
    public void shouldIgnoreTasksOutsideRunning() {
        // review 先建：fixture 领取的是最早的 pending 任务
        TaskEntity review = fixture.newReviewTask(repoId, "review", 5);
        TaskEntity pending = fixture.newTask(repoId, "pending");

        int requeued = daemon.requeueStaleTasks(LocalDateTime.now().plusMinutes(1));

        Assertions.assertEquals(0, requeued);
        Assertions.assertEquals(1, fixture.taskCommandService.getTask(pending.getId()).getAttempt());
        Assertions.assertEquals(TaskStatusEnum.PENDING, fixture.taskCommandService.getTask(pending.getId()).getStatus());
        Assertions.assertEquals(1, fixture.taskCommandService.getTask(review.getId()).getAttempt());
        Assertions.assertEquals(TaskStatusEnum.REVIEW, fixture.taskCommandService.getTask(review.getId()).getStatus());
    }

    @Test
    public void shouldRequeueStaleTaskOnlyOnce() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");
        LocalDateTime cutoff = LocalDateTime.now().plusMinutes(1);
        Assertions.assertEquals(1, fixture.taskCommandService.findStaleRunning(cutoff).size());

        // 第二次重排时任务已是 pending，条件更新不生效
        Assertions.assertTrue(fixture.taskCommandService.requeueStaleTask(task.getId(), cutoff));
        Assertions.assertFalse(fixture.taskCommandService.requeueStaleTask(task.getId(), cutoff));
        Assertions.assertEquals(2, fixture.taskCommandService.getTask(task.getId()).getAttempt());
    }

    @Test
    public void shouldLeaveFreshEpicClaimsDuringFullSweep() {
        EpicEntity epic = fixture.epicCommandService.createEpic(repoId, "Checkout revamp", null, null, null);
        fixture.epicCommandService.claimPendingEpic();
        TaskEntity task = fixture.newRunningTask(repoId, "A");

        daemon.recover();

        Assertions.assertNotNull(fixture.epicCommandService.getEpic(epic.getId()).getClaimedAt());
        Assertions.assertEquals(TaskStatusEnum.RUNNING, fixture.taskCommandService.getTask(task.getId()).getStatus());
    }
}
