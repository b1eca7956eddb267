package com.verve.trigger.http;

import com.verve.api.dto.AgentCompleteRequestDTO;
import com.verve.api.dto.AgentLogsRequestDTO;
import com.verve.api.dto.EpicDTO;
import com.verve.api.dto.EpicFeedbackDTO;
import com.verve.api.dto.EpicProposedTasksRequestDTO;
import com.verve.api.dto.TaskDTO;
import com.verve.api.dto.WorkPollResponseDTO;
import com.verve.api.response.Response;
import com.verve.domain.epic.model.valobj.EpicFeedback;
import com.verve.trigger.application.command.EpicCommandService;
import com.verve.trigger.application.command.TaskCommandService;
import com.verve.trigger.application.common.EpicViewAssembler;
import com.verve.trigger.application.common.TaskViewAssembler;
import com.verve.trigger.application.dispatch.WorkAssignment;
import com.verve.trigger.application.dispatch.WorkDispatchService;
import com.verve.types.common.IdGenerator;
import com.verve.types.enums.ResponseCode;
import com.verve.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.stream.Collectors;

/**
 * Worker agent 协议：长轮询领取工作、回报日志/心跳/结果、规划会话反馈。
 * <p>
 * 长轮询在 {@code workPollExecutor} 上阻塞等待，不占用 servlet 线程；
 * 客户端断开或超时会取消 Future 并中断等待。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/agent")
public class AgentWorkerController {

    private static final long DEFERRED_TIMEOUT_SLACK_MS = 5000L;

    private final WorkDispatchService workDispatchService;
    private final TaskCommandService taskCommandService;
    private final EpicCommandService epicCommandService;
    private final TaskViewAssembler taskViewAssembler;
    private final EpicViewAssembler epicViewAssembler;
    private final ThreadPoolExecutor workPollExecutor;
    private final Counter pollRejectedCounter;

    public AgentWorkerController(WorkDispatchService workDispatchService,
                                 TaskCommandService taskCommandService,
                                 EpicCommandService epicCommandService,
                                 TaskViewAssembler taskViewAssembler,
                                 EpicViewAssembler epicViewAssembler,
                                 @Qualifier("workPollExecutor") ThreadPoolExecutor workPollExecutor) {
        this.workDispatchService = workDispatchService;
        this.taskCommandService = taskCommandService;
        this.epicCommandService = epicCommandService;
        this.taskViewAssembler = taskViewAssembler;
        this.epicViewAssembler = epicViewAssembler;
        this.workPollExecutor = workPollExecutor;
        this.pollRejectedCounter = Counter.builder("verve.dispatch.poll.rejected.total")
                .register(Metrics.globalRegistry);
    }

    @GetMapping("/poll")
    public DeferredResult<ResponseEntity<Response<WorkPollResponseDTO>>> poll(
            @RequestParam("workerId") String workerId,
            @RequestParam(value = "maxConcurrent", defaultValue = "1") int maxConcurrent,
            @RequestParam(value = "activeTasks", defaultValue = "0") int activeTasks,
            @RequestParam(value = "repoIds", required = false) String repoIds) {
        if (StringUtils.isBlank(workerId)) {
            throw AppException.illegalParameter("workerId is required");
        }
        List<String> repoFilter = parseRepoIds(repoIds);
        DeferredResult<ResponseEntity<Response<WorkPollResponseDTO>>> result =
                new DeferredResult<>(workDispatchService.getPollTimeoutMillis() + DEFERRED_TIMEOUT_SLACK_MS);
        Future<?> future = submit(() -> {
            try {
                WorkAssignment assignment = workDispatchService.awaitWork(workerId, maxConcurrent, activeTasks,
                        repoFilter);
                result.setResult(assignment == null
                        ? ResponseEntity.noContent().build()
                        : ResponseEntity.ok(success(toPollResponse(assignment))));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                result.setResult(ResponseEntity.noContent().build());
            } catch (RuntimeException ex) {
                result.setErrorResult(ex);
            }
        });
        result.onTimeout(() -> {
            future.cancel(true);
            result.setResult(ResponseEntity.noContent().build());
        });
        result.onCompletion(() -> future.cancel(true));
        return result;
    }

    @PostMapping("/tasks/{id}/logs")
    public Response<Void> appendTaskLogs(@PathVariable("id") String id, @RequestBody AgentLogsRequestDTO request) {
        int attempt = request.getAttempt() == null ? 0 : request.getAttempt();
        taskCommandService.appendLogs(requireTaskId(id), attempt, request.getLines());
        return success(null);
    }

    @PostMapping("/tasks/{id}/heartbeat")
    public Response<Void> heartbeatTask(@PathVariable("id") String id) {
        taskCommandService.heartbeat(requireTaskId(id));
        return success(null);
    }

    @PostMapping("/tasks/{id}/complete")
    public Response<TaskDTO> completeTask(@PathVariable("id") String id, @RequestBody AgentCompleteRequestDTO request) {
        return success(taskViewAssembler.toTaskDTO(
                taskCommandService.completeTask(requireTaskId(id), taskViewAssembler.toCompletionReport(request))));
    }

    @PostMapping("/epics/{id}/propose")
    public Response<EpicDTO> proposeTasks(@PathVariable("id") String id,
                                          @RequestBody EpicProposedTasksRequestDTO request) {
        return success(epicViewAssembler.toEpicDTO(epicCommandService.updateProposedTasks(requireEpicId(id),
                epicViewAssembler.toProposedTasks(request.getTasks()))));
    }

    @PostMapping("/epics/{id}/heartbeat")
    public Response<Void> heartbeatEpic(@PathVariable("id") String id) {
        epicCommandService.heartbeat(requireEpicId(id));
        return success(null);
    }

    @PostMapping("/epics/{id}/logs")
    public Response<Void> appendEpicLogs(@PathVariable("id") String id, @RequestBody AgentLogsRequestDTO request) {
        epicCommandService.appendSessionLog(requireEpicId(id), request.getLines());
        return success(null);
    }

    @PostMapping("/epics/{id}/release")
    public Response<EpicDTO> releaseEpic(@PathVariable("id") String id) {
        return success(epicViewAssembler.toEpicDTO(epicCommandService.releaseEpicClaim(requireEpicId(id))));
    }

    @GetMapping("/epics/{id}/poll-feedback")
    public DeferredResult<Response<EpicFeedbackDTO>> pollFeedback(@PathVariable("id") String id) {
        String epicId = requireEpicId(id);
        DeferredResult<Response<EpicFeedbackDTO>> result =
                new DeferredResult<>(workDispatchService.getFeedbackTimeoutMillis() + DEFERRED_TIMEOUT_SLACK_MS);
        Future<?> future = submit(() -> {
            try {
                EpicFeedback feedback = workDispatchService.awaitEpicFeedback(epicId);
                result.setResult(success(epicViewAssembler.toFeedbackDTO(feedback)));
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                result.setResult(success(epicViewAssembler.toFeedbackDTO(null)));
            } catch (RuntimeException ex) {
                result.setErrorResult(ex);
            }
        });
        result.onTimeout(() -> {
            future.cancel(true);
            result.setResult(success(epicViewAssembler.toFeedbackDTO(null)));
        });
        result.onCompletion(() -> future.cancel(true));
        return result;
    }

    public static List<String> parseRepoIds(String repoIds) {
        if (StringUtils.isBlank(repoIds)) {
            return Collections.emptyList();
        }
        return Arrays.stream(repoIds.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .distinct()
                .collect(Collectors.toList());
    }

    private Future<?> submit(Runnable waiter) {
        try {
            return workPollExecutor.submit(waiter);
        } catch (RejectedExecutionException ex) {
            pollRejectedCounter.increment();
            log.warn("Long-poll rejected, executor saturated. active={}, queued={}",
                    workPollExecutor.getActiveCount(), workPollExecutor.getQueue().size());
            throw AppException.upstreamUnavailable("Too many concurrent long-polls, retry later", ex);
        }
    }

    private WorkPollResponseDTO toPollResponse(WorkAssignment assignment) {
        WorkPollResponseDTO dto = new WorkPollResponseDTO();
        dto.setType(assignment.getType());
        dto.setTask(assignment.getTask() == null ? null : taskViewAssembler.toTaskDTO(assignment.getTask()));
        dto.setEpic(assignment.getEpic() == null ? null : epicViewAssembler.toEpicDTO(assignment.getEpic()));
        dto.setRepoFullName(assignment.getRepoFullName());
        dto.setCodeHostToken(assignment.getCodeHostToken());
        return dto;
    }

    private String requireTaskId(String id) {
        if (!IdGenerator.isTaskId(id)) {
            throw AppException.illegalParameter("Invalid task id: " + id);
        }
        return id;
    }

    private String requireEpicId(String id) {
        if (!IdGenerator.isEpicId(id)) {
            throw AppException.illegalParameter("Invalid epic id: " + id);
        }
        return id;
    }

    private <T> Response<T> success(T data) {
        return Response.<T>builder()
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .data(data)
                .build();
    }
}
