package com.verve.test;

import com.verve.api.dto.StreamEventDTO;
import com.verve.domain.event.model.entity.DomainEventEntity;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.test.support.VerveTestFixture;
import com.verve.trigger.application.common.EpicViewAssembler;
import com.verve.trigger.application.common.TaskViewAssembler;
import com.verve.trigger.http.EventStreamController;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

public class EventStreamControllerTest {

    private VerveTestFixture fixture;
    private ThreadPoolExecutor deliveryExecutor;
    private EventStreamController controller;
    private String repoId;

    @BeforeEach
    public void setUp() {
        fixture = new VerveTestFixture();
        deliveryExecutor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(16));
        controller = new EventStreamController(fixture.eventBroker, fixture.taskCommandService,
                fixture.epicCommandService, new TaskViewAssembler(), new EpicViewAssembler(), deliveryExecutor,
                60000L, 8);
        repoId = fixture.newRepo().getId();
    }

    @AfterEach
    public void tearDown() {
        controller.shutdown();
        deliveryExecutor.shutdownNow();
    }

    @Test
    public void shouldRegisterAndReleaseSubscribers() {
        controller.stream(null);
        controller.stream(repoId);

        Assertions.assertEquals(2, controller.subscriberCount());

        controller.shutdown();
        Assertions.assertEquals(0, controller.subscriberCount());
    }

    @Test
    public void shouldMapTaskEventWithFullState() {
        TaskEntity task = fixture.newTask(repoId, "A");

        StreamEventDTO dto = controller.toStreamEvent(DomainEventEntity.taskUpdated(task));

        Assertions.assertEquals("task_updated", dto.getType());
        Assertions.assertEquals(repoId, dto.getRepoId());
        Assertions.assertEquals(task.getId(), dto.getTaskId());
        Assertions.assertEquals("pending", dto.getTask().getStatus());
        Assertions.assertNull(dto.getLogs());
    }

    @Test
    public void shouldMapLogEventWithAttempt() {
        StreamEventDTO dto = controller.toStreamEvent(
                DomainEventEntity.logsAppended(repoId, "tsk-abcde", 2, Arrays.asList("a", "b")));

        Assertions.assertEquals("logs_appended", dto.getType());
        Assertions.assertEquals(2, dto.getAttempt());
        Assertions.assertEquals(Arrays.asList("a", "b"), dto.getLogs());
        Assertions.assertNull(dto.getTask());
    }

    @Test
    public void shouldMapEpicDeletionWithoutEntity() {
        StreamEventDTO dto = controller.toStreamEvent(DomainEventEntity.epicDeleted(repoId, "epic_01h455vb4pex5vsknk084sn02q"));

        Assertions.assertEquals("epic_deleted", dto.getType());
        Assertions.assertEquals("epic_01h455vb4pex5vsknk084sn02q", dto.getEpicId());
        Assertions.assertNull(dto.getEpic());
    }
}
