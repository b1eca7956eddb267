package com.verve.test;

import com.verve.domain.epic.adapter.gateway.ITaskPlanner;
import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.epic.model.valobj.EpicFeedback;
import com.verve.domain.epic.model.valobj.PlannedTask;
import com.verve.domain.epic.service.EpicCompletionDomainService;
import com.verve.domain.epic.service.EpicPlanningDomainService;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.infrastructure.repository.memory.InMemoryEpicRepository;
import com.verve.test.support.VerveTestFixture;
import com.verve.trigger.application.command.EpicCommandService;
import com.verve.types.common.Constants;
import com.verve.types.enums.EpicFeedbackTypeEnum;
import com.verve.types.enums.EpicStatusEnum;
import com.verve.types.enums.ResponseCode;
import com.verve.types.enums.TaskStatusEnum;
import com.verve.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.verve.test.support.VerveTestFixture.proposal;

public class EpicCommandServiceTest {

    private VerveTestFixture fixture;
    private String repoId;

    @BeforeEach
    public void setUp() {
        fixture = new VerveTestFixture();
        repoId = fixture.newRepo().getId();
    }

    @Test
    public void shouldCreateEpicInPlanning() {
        EpicEntity epic = fixture.epicCommandService.createEpic(repoId, "  Checkout revamp ", null, "split it up", null);

        Assertions.assertEquals(EpicStatusEnum.PLANNING, epic.getStatus());
        Assertions.assertEquals("Checkout revamp", epic.getTitle());
        Assertions.assertEquals("split it up", epic.getPlanningPrompt());
        Assertions.assertEquals(Constants.FALLBACK_MODEL, epic.getModel());
        Assertions.assertTrue(epic.getId().startsWith("epc_"));
    }

    @Test
    public void shouldRejectOverlongTitle() {
        StringBuilder title = new StringBuilder();
        for (int i = 0; i <= Constants.EPIC_TITLE_MAX_LENGTH; i++) {
            title.append('x');
        }

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.epicCommandService.createEpic(repoId, title.toString(), null, null, null));

        Assertions.assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
    }

    @Test
    public void shouldAllowOnlyOnePlanningClaim() throws Exception {
        EpicEntity epic = fixture.epicCommandService.createEpic(repoId, "Checkout revamp", null, null, null);
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> f1 = pool.submit(() -> {
                start.await(2, TimeUnit.SECONDS);
                return fixture.epicCommandService.claimEpic(epic.getId());
            });
            Future<Boolean> f2 = pool.submit(() -> {
                start.await(2, TimeUnit.SECONDS);
                return fixture.epicCommandService.claimEpic(epic.getId());
            });
            start.countDown();

            boolean first = f1.get(5, TimeUnit.SECONDS);
            boolean second = f2.get(5, TimeUnit.SECONDS);
            Assertions.assertTrue(first ^ second, "规划领取只能成功一次");
        } finally {
            pool.shutdownNow();
        }
        Assertions.assertNull(fixture.epicCommandService.claimPendingEpic());
    }

    @Test
    public void shouldReleaseStaleClaimAndLogTimeout() {
        EpicEntity epic = fixture.epicCommandService.createEpic(repoId, "Checkout revamp", null, null, null);
        Assertions.assertNotNull(fixture.epicCommandService.claimPendingEpic());

        Assertions.assertEquals(0, fixture.epicCommandService.timeoutStaleEpics(Duration.ofMinutes(5)));
        // 负超时把截止时间推到未来，当前领取视为已失联
        int released = fixture.epicCommandService.timeoutStaleEpics(Duration.ofMinutes(-1));

        Assertions.assertEquals(1, released);
        EpicEntity after = fixture.epicCommandService.getEpic(epic.getId());
        Assertions.assertNull(after.getClaimedAt());
        Assertions.assertEquals(EpicStatusEnum.PLANNING, after.getStatus());
        Assertions.assertEquals(Collections.singletonList(Constants.EPIC_TIMEOUT_LOG_LINE), after.getSessionLog());
        Assertions.assertNotNull(fixture.epicCommandService.claimPendingEpic());
    }

    @Test
    public void shouldKeepEpicConfirmedDuringStaleSweep() {
        EpicEntity epic = fixture.epicCommandService.createEpic(repoId, "Checkout revamp", null, null, null);
        Assertions.assertNotNull(fixture.epicCommandService.claimPendingEpic());
        fixture.epicCommandService.updateProposedTasks(epic.getId(),
                new ArrayList<>(Collections.singletonList(proposal("task_1", "Schema"))));

        // 列出超时领取之后、释放之前，用户完成确认
        InMemoryEpicRepository confirmingRepository = new InMemoryEpicRepository(fixture.store) {
            @Override
            public List<EpicEntity> findStaleClaimed(LocalDateTime cutoff) {
                List<EpicEntity> stale = super.findStaleClaimed(cutoff);
                fixture.epicCommandService.confirmEpic(epic.getId(), false);
                return stale;
            }
        };
        EpicCommandService sweeper = new EpicCommandService(confirmingRepository, fixture.taskRepository,
                fixture.repoRepository, fixture.transactionScope, fixture.eventBroker, new EpicPlanningDomainService(),
                new EpicCompletionDomainService(), fixture.settingCommandService,
                VerveTestFixture.provider(ITaskPlanner.class, null), fixture.retrier);

        int released = sweeper.timeoutStaleEpics(Duration.ofMinutes(-1));

        Assertions.assertEquals(0, released);
        EpicEntity after = fixture.epicCommandService.getEpic(epic.getId());
        Assertions.assertEquals(EpicStatusEnum.ACTIVE, after.getStatus());
        Assertions.assertEquals(1, after.getTaskIds().size());
        Assertions.assertFalse(after.getSessionLog().contains(Constants.EPIC_TIMEOUT_LOG_LINE));
        Assertions.assertNull(fixture.epicCommandService.claimPendingEpic());
        Assertions.assertEquals(1, fixture.taskRepository.findAll().size());
    }

    @Test
    public void shouldReleaseOnlyClaimsThatAreStillStale() {
        EpicEntity epic = fixture.epicCommandService.createEpic(repoId, "Checkout revamp", null, null, null);
        Assertions.assertNotNull(fixture.epicCommandService.claimPendingEpic());
        LocalDateTime now = LocalDateTime.now();

        Assertions.assertFalse(fixture.epicRepository.releaseStaleClaim(epic.getId(), now.minusMinutes(5), now));
        Assertions.assertNotNull(fixture.epicCommandService.getEpic(epic.getId()).getClaimedAt());

        Assertions.assertTrue(fixture.epicRepository.releaseStaleClaim(epic.getId(), now.plusMinutes(1), now));
        Assertions.assertFalse(fixture.epicRepository.releaseStaleClaim(epic.getId(), now.plusMinutes(1), now));
    }

    @Test
    public void shouldDeliverSessionMessageThroughMailboxOnce() {
        EpicEntity epic = fixture.newDraftEpic(repoId, proposal("task_1", "Schema"));

        EpicEntity afterMessage = fixture.epicCommandService.sendSessionMessage(epic.getId(), "add an index too");
        Assertions.assertEquals(EpicStatusEnum.PLANNING, afterMessage.getStatus());
        Assertions.assertEquals(Collections.singletonList("user: add an index too"), afterMessage.getSessionLog());

        EpicFeedback feedback = fixture.epicCommandService.pollFeedback(epic.getId());
        Assertions.assertNotNull(feedback);
        Assertions.assertEquals(EpicFeedbackTypeEnum.MESSAGE, feedback.getType());
        Assertions.assertEquals("add an index too", feedback.getFeedback());
        Assertions.assertNull(fixture.epicCommandService.pollFeedback(epic.getId()));
    }

    @Test
    public void shouldConfirmAndResolveTemporaryDependencies() {
        EpicEntity epic = fixture.newDraftEpic(repoId,
                proposal("task_1", "Schema"),
                proposal("task_2", "API", "task_1", "task_9"),
                proposal("task_3", "UI", "task_2", "task_1"));

        EpicEntity confirmed = fixture.epicCommandService.confirmEpic(epic.getId(), false);

        Assertions.assertEquals(EpicStatusEnum.ACTIVE, confirmed.getStatus());
        Assertions.assertEquals(3, confirmed.getTaskIds().size());
        List<TaskEntity> tasks = fixture.epicCommandService.listEpicTasks(epic.getId());
        Assertions.assertEquals(Arrays.asList("Schema", "API", "UI"),
                Arrays.asList(tasks.get(0).getTitle(), tasks.get(1).getTitle(), tasks.get(2).getTitle()));
        Assertions.assertTrue(tasks.get(0).getDependsOn().isEmpty());
        Assertions.assertEquals(Collections.singletonList(tasks.get(0).getId()), tasks.get(1).getDependsOn());
        Assertions.assertEquals(Arrays.asList(tasks.get(1).getId(), tasks.get(0).getId()), tasks.get(2).getDependsOn());
        for (TaskEntity task : tasks) {
            Assertions.assertEquals(epic.getId(), task.getEpicId());
            Assertions.assertTrue(task.isReady());
            Assertions.assertEquals(TaskStatusEnum.PENDING, task.getStatus());
        }

        EpicFeedback feedback = fixture.epicCommandService.pollFeedback(epic.getId());
        Assertions.assertEquals(EpicFeedbackTypeEnum.CONFIRMED, feedback.getType());
    }

    @Test
    public void shouldCreateTasksNotReadyWhenRequested() {
        EpicEntity epic = fixture.newDraftEpic(repoId, proposal("task_1", "Schema"));

        EpicEntity confirmed = fixture.epicCommandService.confirmEpic(epic.getId(), true);

        Assertions.assertEquals(EpicStatusEnum.READY, confirmed.getStatus());
        Assertions.assertTrue(confirmed.isNotReady());
        TaskEntity task = fixture.epicCommandService.listEpicTasks(epic.getId()).get(0);
        Assertions.assertFalse(task.isReady());
        Assertions.assertNull(fixture.taskCommandService.claimPendingTask(null));
    }

    @Test
    public void shouldRejectConfirmWithoutProposals() {
        EpicEntity epic = fixture.newDraftEpic(repoId);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.epicCommandService.confirmEpic(epic.getId(), false));

        Assertions.assertTrue(ex.is(ResponseCode.PRECONDITION_FAILED));
        Assertions.assertTrue(fixture.taskRepository.findAll().isEmpty());
    }

    @Test
    public void shouldRejectSecondConfirm() {
        EpicEntity epic = fixture.newDraftEpic(repoId, proposal("task_1", "Schema"));
        fixture.epicCommandService.confirmEpic(epic.getId(), false);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.epicCommandService.confirmEpic(epic.getId(), false));

        Assertions.assertTrue(ex.is(ResponseCode.PRECONDITION_FAILED));
        Assertions.assertEquals(1, fixture.taskRepository.findAll().size());
    }

    @Test
    public void shouldCompleteEpicWhenAllTasksTerminal() {
        EpicEntity epic = fixture.newDraftEpic(repoId, proposal("task_1", "Schema"), proposal("task_2", "API"));
        fixture.epicCommandService.confirmEpic(epic.getId(), false);
        List<TaskEntity> tasks = fixture.epicCommandService.listEpicTasks(epic.getId());

        fixture.taskCommandService.closeTask(tasks.get(0).getId(), null);
        Assertions.assertEquals(0, fixture.epicCommandService.checkActiveEpicsCompletion());

        fixture.taskCommandService.closeTask(tasks.get(1).getId(), null);
        Assertions.assertEquals(1, fixture.epicCommandService.checkActiveEpicsCompletion());
        Assertions.assertEquals(EpicStatusEnum.COMPLETED, fixture.epicCommandService.getEpic(epic.getId()).getStatus());
    }

    @Test
    public void shouldDeleteOnlyDraftEpic() {
        EpicEntity planning = fixture.epicCommandService.createEpic(repoId, "Checkout revamp", null, null, null);
        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.epicCommandService.deleteEpic(planning.getId()));
        Assertions.assertTrue(ex.is(ResponseCode.PRECONDITION_FAILED));

        EpicEntity draft = fixture.newDraftEpic(repoId, proposal("task_1", "Schema"));
        fixture.epicCommandService.deleteEpic(draft.getId());

        AppException missing = Assertions.assertThrows(AppException.class,
                () -> fixture.epicCommandService.getEpic(draft.getId()));
        Assertions.assertTrue(missing.is(ResponseCode.NOT_FOUND));
    }

    @Test
    public void shouldCloseEpicAndSignalPlanner() {
        EpicEntity epic = fixture.epicCommandService.createEpic(repoId, "Checkout revamp", null, null, null);

        EpicEntity closed = fixture.epicCommandService.closeEpic(epic.getId());

        Assertions.assertEquals(EpicStatusEnum.CLOSED, closed.getStatus());
        Assertions.assertEquals(EpicFeedbackTypeEnum.CLOSED, fixture.epicCommandService.pollFeedback(epic.getId()).getType());
    }

    @Test
    public void shouldGenerateProposalsFromPlanner() {
        ITaskPlanner planner = (title, description, extraInstructions) -> Arrays.asList(
                PlannedTask.builder().title("Schema").dependsOn(Collections.emptyList()).build(),
                PlannedTask.builder().title("API").dependsOn(Arrays.asList(1, 7)).build());
        VerveTestFixture withPlanner = new VerveTestFixture(planner, null);
        String plannerRepoId = withPlanner.newRepo().getId();
        EpicEntity epic = withPlanner.epicCommandService.createEpic(plannerRepoId, "Checkout revamp", null, null, null);

        EpicEntity drafted = withPlanner.epicCommandService.generateProposals(epic.getId(), null);

        Assertions.assertEquals(EpicStatusEnum.DRAFT, drafted.getStatus());
        Assertions.assertEquals(2, drafted.getProposedTasks().size());
        Assertions.assertEquals("task_2", drafted.getProposedTasks().get(1).getTempId());
        Assertions.assertEquals(Collections.singletonList("task_1"), drafted.getProposedTasks().get(1).getDependsOnTempIds());
    }

    @Test
    public void shouldReportUpstreamUnavailableWithoutPlanner() {
        EpicEntity epic = fixture.epicCommandService.createEpic(repoId, "Checkout revamp", null, null, null);

        AppException ex = Assertions.assertThrows(AppException.class,
                () -> fixture.epicCommandService.generateProposals(epic.getId(), null));

        Assertions.assertTrue(ex.is(ResponseCode.UPSTREAM_UNAVAILABLE));
    }
}
