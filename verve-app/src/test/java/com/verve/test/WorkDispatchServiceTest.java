package com.verve.test;

import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.epic.model.valobj.EpicFeedback;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.worker.model.valobj.WorkerInfo;
import com.verve.test.support.VerveTestFixture;
import com.verve.trigger.application.dispatch.PendingWorkSignal;
import com.verve.trigger.application.dispatch.WorkAssignment;
import com.verve.trigger.application.dispatch.WorkDispatchService;
import com.verve.types.enums.EpicFeedbackTypeEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

public class WorkDispatchServiceTest {

    private VerveTestFixture fixture;
    private PendingWorkSignal signal;
    private WorkDispatchService dispatchService;
    private ExecutorService pool;
    private String repoId;

    @BeforeEach
    public void setUp() {
        fixture = new VerveTestFixture();
        signal = new PendingWorkSignal(fixture.eventBroker);
        signal.subscribe();
        dispatchService = new WorkDispatchService(fixture.taskCommandService, fixture.epicCommandService,
                fixture.repoCommandService, fixture.codeHostTokenService, fixture.workerRegistry, signal,
                2000L, 60000L, 2000L);
        pool = Executors.newFixedThreadPool(2);
        repoId = fixture.newRepo().getId();
    }

    @AfterEach
    public void tearDown() {
        signal.unsubscribe();
        pool.shutdownNow();
    }

    @Test
    public void shouldReturnImmediatelyWhenTaskIsClaimable() throws Exception {
        TaskEntity task = fixture.newTask(repoId, "A");

        WorkAssignment assignment = dispatchService.awaitWork("worker-1", 2, 0, null);

        Assertions.assertNotNull(assignment);
        Assertions.assertEquals(WorkAssignment.TYPE_TASK, assignment.getType());
        Assertions.assertEquals(task.getId(), assignment.getTask().getId());
        Assertions.assertTrue(assignment.getRepoFullName().startsWith("acme/widgets-"));
        Assertions.assertNull(assignment.getCodeHostToken());
    }

    @Test
    public void shouldPreferPlanningEpicOverTask() throws Exception {
        fixture.newTask(repoId, "A");
        EpicEntity epic = fixture.epicCommandService.createEpic(repoId, "Checkout revamp", null, null, null);

        WorkAssignment assignment = dispatchService.tryDispatch(null);

        Assertions.assertEquals(WorkAssignment.TYPE_EPIC, assignment.getType());
        Assertions.assertEquals(epic.getId(), assignment.getEpic().getId());
    }

    @Test
    public void shouldWakeWaitingPollWhenTaskCreated() throws Exception {
        Future<WorkAssignment> poll = pool.submit(() -> dispatchService.awaitWork("worker-1", 1, 0, null));
        Thread.sleep(100L);
        TaskEntity task = fixture.newTask(repoId, "A");

        WorkAssignment assignment = poll.get(1500, TimeUnit.MILLISECONDS);

        Assertions.assertNotNull(assignment);
        Assertions.assertEquals(task.getId(), assignment.getTask().getId());
    }

    @Test
    public void shouldReturnNullWhenPollTimesOut() throws Exception {
        WorkDispatchService shortPoll = new WorkDispatchService(fixture.taskCommandService, fixture.epicCommandService,
                fixture.repoCommandService, fixture.codeHostTokenService, fixture.workerRegistry, signal,
                50L, 60000L, 50L);

        long start = System.currentTimeMillis();
        WorkAssignment assignment = shortPoll.awaitWork("worker-1", 1, 0, null);

        Assertions.assertNull(assignment);
        Assertions.assertTrue(System.currentTimeMillis() - start >= 40L);
    }

    @Test
    public void shouldCapPollTimeoutAtMaxHold() {
        WorkDispatchService capped = new WorkDispatchService(fixture.taskCommandService, fixture.epicCommandService,
                fixture.repoCommandService, fixture.codeHostTokenService, fixture.workerRegistry, signal,
                120000L, 45000L, 0L);

        Assertions.assertEquals(45000L, capped.getPollTimeoutMillis());
        Assertions.assertEquals(30000L, capped.getFeedbackTimeoutMillis());
    }

    @Test
    public void shouldRecordWorkerDuringPoll() throws Exception {
        WorkDispatchService shortPoll = new WorkDispatchService(fixture.taskCommandService, fixture.epicCommandService,
                fixture.repoCommandService, fixture.codeHostTokenService, fixture.workerRegistry, signal,
                50L, 60000L, 50L);

        shortPoll.awaitWork("worker-7", 3, 1, Collections.singletonList(repoId));

        List<WorkerInfo> workers = fixture.workerRegistry.listWorkers(Duration.ofMinutes(1));
        Assertions.assertEquals(1, workers.size());
        Assertions.assertEquals("worker-7", workers.get(0).getWorkerId());
        Assertions.assertEquals(3, workers.get(0).getMaxConcurrentTasks());
        Assertions.assertEquals(1, workers.get(0).getActiveTasks());
        Assertions.assertFalse(workers.get(0).isPolling());
    }

    @Test
    public void shouldDeliverEpicFeedbackToWaitingPlanner() throws Exception {
        EpicEntity epic = fixture.newDraftEpic(repoId, VerveTestFixture.proposal("task_1", "Schema"));
        Future<EpicFeedback> waiting = pool.submit(() -> dispatchService.awaitEpicFeedback(epic.getId()));
        Thread.sleep(100L);

        fixture.epicCommandService.sendSessionMessage(epic.getId(), "split the API task");

        EpicFeedback feedback = waiting.get(1500, TimeUnit.MILLISECONDS);
        Assertions.assertNotNull(feedback);
        Assertions.assertEquals(EpicFeedbackTypeEnum.MESSAGE, feedback.getType());
        Assertions.assertEquals("split the API task", feedback.getFeedback());
    }

    @Test
    public void shouldIgnoreLogEventsForWakeUps() {
        TaskEntity task = fixture.newRunningTask(repoId, "A");
        long before = signal.generation();

        fixture.taskCommandService.appendLogs(task.getId(), 1, Collections.singletonList("line"));

        Assertions.assertEquals(before, signal.generation());
    }
}
