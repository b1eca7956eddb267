package com.verve.test.domain;

import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.epic.model.valobj.PlannedTask;
import com.verve.domain.epic.model.valobj.ProposedTask;
import com.verve.domain.epic.service.EpicCompletionDomainService;
import com.verve.domain.epic.service.EpicPlanningDomainService;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.types.enums.EpicStatusEnum;
import com.verve.types.enums.TaskStatusEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class EpicDomainServiceTest {

    private final EpicPlanningDomainService planningService = new EpicPlanningDomainService();
    private final EpicCompletionDomainService completionService = new EpicCompletionDomainService();

    @Test
    public void shouldConvertPlannerIndicesToTemporaryIds() {
        List<PlannedTask> planned = Arrays.asList(
                PlannedTask.builder().title("Schema").build(),
                PlannedTask.builder().title("API").dependsOn(Arrays.asList(1, 0, 3, null)).build(),
                PlannedTask.builder().title("UI").dependsOn(Arrays.asList(2, 1)).build());

        List<ProposedTask> proposed = planningService.toProposedTasks(planned);

        Assertions.assertEquals(3, proposed.size());
        Assertions.assertEquals("task_1", proposed.get(0).getTempId());
        Assertions.assertEquals(Arrays.asList("task_1", "task_3"), proposed.get(1).getDependsOnTempIds());
        Assertions.assertEquals(Arrays.asList("task_2", "task_1"), proposed.get(2).getDependsOnTempIds());
    }

    @Test
    public void shouldDropForwardAndUnknownReferencesOnMaterialize() {
        EpicEntity epic = newEpic(
                proposed("task_1", "Schema", "task_2"),
                proposed("task_2", "API", "task_1", "task_1", "ghost"));

        List<TaskEntity> tasks = planningService.materialize(epic, true, 5, LocalDateTime.now());

        Assertions.assertEquals(2, tasks.size());
        Assertions.assertTrue(tasks.get(0).getDependsOn().isEmpty());
        Assertions.assertEquals(Collections.singletonList(tasks.get(0).getId()), tasks.get(1).getDependsOn());
        Assertions.assertNotEquals(tasks.get(0).getId(), tasks.get(1).getId());
        Assertions.assertTrue(tasks.get(0).getCreatedAt().isBefore(tasks.get(1).getCreatedAt()));
        for (TaskEntity task : tasks) {
            Assertions.assertFalse(task.isReady());
            Assertions.assertEquals(TaskStatusEnum.PENDING, task.getStatus());
            Assertions.assertEquals(epic.getId(), task.getEpicId());
            Assertions.assertEquals("opus", task.getModel());
            Assertions.assertEquals(5, task.getMaxAttempts());
        }
    }

    @Test
    public void shouldCompleteOnlyActiveEpicWithTerminalTasks() {
        EpicEntity epic = newEpic();
        epic.setStatus(EpicStatusEnum.ACTIVE);
        epic.setTaskIds(Arrays.asList("tsk-aaaaa", "tsk-bbbbb", "tsk-ccccc"));
        Map<String, TaskStatusEnum> statuses = new HashMap<>();
        statuses.put("tsk-aaaaa", TaskStatusEnum.MERGED);
        statuses.put("tsk-bbbbb", TaskStatusEnum.FAILED);

        Assertions.assertFalse(completionService.isComplete(epic, statuses));

        statuses.put("tsk-bbbbb", TaskStatusEnum.CLOSED);
        Assertions.assertTrue(completionService.isComplete(epic, statuses), "缺失的任务不阻塞完成");

        epic.setStatus(EpicStatusEnum.READY);
        Assertions.assertFalse(completionService.isComplete(epic, statuses));
    }

    @Test
    public void shouldNotCompleteEpicWithoutTasks() {
        EpicEntity epic = newEpic();
        epic.setStatus(EpicStatusEnum.ACTIVE);

        Assertions.assertFalse(completionService.isComplete(epic, new HashMap<>()));
    }

    private EpicEntity newEpic(ProposedTask... proposals) {
        EpicEntity epic = new EpicEntity();
        epic.setId("epc_01hzx3m4q8t2v6b9c0d1e2f3g4");
        epic.setRepoId("repo_01hzx3m4q8t2v6b9c0d1e2f3g4");
        epic.setTitle("Checkout revamp");
        epic.setStatus(EpicStatusEnum.DRAFT);
        epic.setModel("opus");
        epic.setProposedTasks(new ArrayList<>(Arrays.asList(proposals)));
        return epic;
    }

    private ProposedTask proposed(String tempId, String title, String... deps) {
        return ProposedTask.builder()
                .tempId(tempId)
                .title(title)
                .dependsOnTempIds(Arrays.asList(deps))
                .build();
    }
}
