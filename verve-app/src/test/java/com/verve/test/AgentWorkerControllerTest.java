package com.verve.test;

import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.test.support.VerveTestFixture;
import com.verve.trigger.application.common.EpicViewAssembler;
import com.verve.trigger.application.common.TaskViewAssembler;
import com.verve.trigger.application.dispatch.PendingWorkSignal;
import com.verve.trigger.application.dispatch.WorkDispatchService;
import com.verve.trigger.http.AgentWorkerController;
import com.verve.trigger.http.GlobalApiExceptionHandler;
import com.verve.types.enums.ResponseCode;
import com.verve.types.enums.TaskStatusEnum;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class AgentWorkerControllerTest {

    private VerveTestFixture fixture;
    private PendingWorkSignal signal;
    private ThreadPoolExecutor pollExecutor;
    private MockMvc mockMvc;
    private String repoId;

    @BeforeEach
    public void setUp() {
        fixture = new VerveTestFixture();
        signal = new PendingWorkSignal(fixture.eventBroker);
        signal.subscribe();
        WorkDispatchService dispatchService = new WorkDispatchService(fixture.taskCommandService,
                fixture.epicCommandService, fixture.repoCommandService, fixture.codeHostTokenService,
                fixture.workerRegistry, signal, 200L, 60000L, 200L);
        pollExecutor = new ThreadPoolExecutor(2, 2, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(4));
        AgentWorkerController controller = new AgentWorkerController(dispatchService, fixture.taskCommandService,
                fixture.epicCommandService, new TaskViewAssembler(), new EpicViewAssembler(), pollExecutor);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalApiExceptionHandler())
                .build();
        repoId = fixture.newRepo().getId();
    }

    @AfterEach
    public void tearDown() {
        signal.unsubscribe();
        pollExecutor.shutdownNow();
    }

    @Test
    public void shouldParseRepoIdFilter() {
        Assertions.assertEquals(Arrays.asList("r1", "r2"), AgentWorkerController.parseRepoIds(" r1, ,r2,r1 "));
        Assertions.assertEquals(Collections.emptyList(), AgentWorkerController.parseRepoIds(null));
        Assertions.assertEquals(Collections.emptyList(), AgentWorkerController.parseRepoIds("  "));
    }

    @Test
    public void shouldHandOutClaimableTaskOnPoll() throws Exception {
        TaskEntity task = fixture.newTask(repoId, "A");

        MvcResult pending = mockMvc.perform(get("/api/v1/agent/poll").param("workerId", "worker-1"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.type").value("task"))
                .andExpect(jsonPath("$.data.task.id").value(task.getId()))
                .andExpect(jsonPath("$.data.task.status").value("running"));
    }

    @Test
    public void shouldAnswerNoContentWhenNothingToDo() throws Exception {
        MvcResult pending = mockMvc.perform(get("/api/v1/agent/poll").param("workerId", "worker-1"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(pending))
                .andExpect(status().isNoContent());
    }

    @Test
    public void shouldRejectHeartbeatForTaskNotRunning() throws Exception {
        TaskEntity task = fixture.newTask(repoId, "A");

        mockMvc.perform(post("/api/v1/agent/tasks/" + task.getId() + "/heartbeat"))
                .andExpect(status().isPreconditionFailed())
                .andExpect(jsonPath("$.code").value(ResponseCode.PRECONDITION_FAILED.getCode()));
    }

    @Test
    public void shouldCompleteTaskWithPullRequest() throws Exception {
        TaskEntity task = fixture.newRunningTask(repoId, "A");

        mockMvc.perform(post("/api/v1/agent/tasks/" + task.getId() + "/heartbeat"))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/v1/agent/tasks/" + task.getId() + "/complete")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"success\":true,\"pullRequestUrl\":\"https://github.com/acme/widgets/pull/9\","
                                + "\"prNumber\":9,\"costUsd\":1.25}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("review"))
                .andExpect(jsonPath("$.data.prNumber").value(9));

        Assertions.assertEquals(TaskStatusEnum.REVIEW, fixture.taskCommandService.getTask(task.getId()).getStatus());
    }

    @Test
    public void shouldAppendLogsForAttempt() throws Exception {
        TaskEntity task = fixture.newRunningTask(repoId, "A");

        mockMvc.perform(post("/api/v1/agent/tasks/" + task.getId() + "/logs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"attempt\":1,\"lines\":[\"cloning\",\"running tests\"]}"))
                .andExpect(status().isOk());

        Assertions.assertEquals(1, fixture.taskCommandService.readLogBatches(task.getId()).size());
    }
}
