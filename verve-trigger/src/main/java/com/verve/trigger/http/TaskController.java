package com.verve.trigger.http;

import com.verve.api.dto.TaskCloseRequestDTO;
import com.verve.api.dto.TaskCreateRequestDTO;
import com.verve.api.dto.TaskDTO;
import com.verve.api.dto.TaskFeedbackRequestDTO;
import com.verve.api.dto.TaskLogsDTO;
import com.verve.api.dto.TaskReadyRequestDTO;
import com.verve.api.dto.TaskRetryRequestDTO;
import com.verve.api.dto.TaskStartOverRequestDTO;
import com.verve.api.dto.TaskUpdateRequestDTO;
import com.verve.api.response.Response;
import com.verve.trigger.application.command.TaskCommandService;
import com.verve.trigger.application.common.TaskViewAssembler;
import com.verve.types.common.IdGenerator;
import com.verve.types.enums.ResponseCode;
import com.verve.types.exception.AppException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 任务管理 API（面向用户）。
 */
@RestController
@RequestMapping("/api/v1")
public class TaskController {

    private final TaskCommandService taskCommandService;
    private final TaskViewAssembler taskViewAssembler;

    public TaskController(TaskCommandService taskCommandService, TaskViewAssembler taskViewAssembler) {
        this.taskCommandService = taskCommandService;
        this.taskViewAssembler = taskViewAssembler;
    }

    @GetMapping("/repos/{repoId}/tasks")
    public Response<List<TaskDTO>> listTasks(@PathVariable("repoId") String repoId) {
        return success(taskViewAssembler.toTaskDTOs(taskCommandService.listTasksByRepo(repoId)));
    }

    @PostMapping("/repos/{repoId}/tasks")
    public Response<TaskDTO> createTask(@PathVariable("repoId") String repoId,
                                        @RequestBody TaskCreateRequestDTO request) {
        return success(taskViewAssembler.toTaskDTO(
                taskCommandService.createTask(repoId, taskViewAssembler.toEditCommand(request))));
    }

    @GetMapping("/tasks/{id}")
    public Response<TaskDTO> getTask(@PathVariable("id") String id) {
        return success(taskViewAssembler.toTaskDTO(taskCommandService.getTask(requireTaskId(id))));
    }

    @GetMapping("/tasks/{id}/logs")
    public Response<TaskLogsDTO> getLogs(@PathVariable("id") String id) {
        return success(taskViewAssembler.toTaskLogsDTO(id, taskCommandService.readLogBatches(requireTaskId(id))));
    }

    @PutMapping("/tasks/{id}")
    public Response<TaskDTO> updateTask(@PathVariable("id") String id, @RequestBody TaskUpdateRequestDTO request) {
        return success(taskViewAssembler.toTaskDTO(
                taskCommandService.updatePendingTask(requireTaskId(id), taskViewAssembler.toEditCommand(request))));
    }

    @PutMapping("/tasks/{id}/ready")
    public Response<TaskDTO> setReady(@PathVariable("id") String id, @RequestBody TaskReadyRequestDTO request) {
        if (request.getReady() == null) {
            throw AppException.illegalParameter("ready is required");
        }
        return success(taskViewAssembler.toTaskDTO(taskCommandService.setReady(requireTaskId(id), request.getReady())));
    }

    @PostMapping("/tasks/{id}/close")
    public Response<TaskDTO> closeTask(@PathVariable("id") String id,
                                       @RequestBody(required = false) TaskCloseRequestDTO request) {
        String reason = request == null ? null : request.getReason();
        return success(taskViewAssembler.toTaskDTO(taskCommandService.closeTask(requireTaskId(id), reason)));
    }

    @PostMapping("/tasks/{id}/retry")
    public Response<TaskDTO> retryTask(@PathVariable("id") String id,
                                       @RequestBody(required = false) TaskRetryRequestDTO request) {
        String instructions = request == null ? null : request.getInstructions();
        return success(taskViewAssembler.toTaskDTO(taskCommandService.manualRetryTask(requireTaskId(id), instructions)));
    }

    @PostMapping("/tasks/{id}/feedback")
    public Response<TaskDTO> feedbackTask(@PathVariable("id") String id, @RequestBody TaskFeedbackRequestDTO request) {
        return success(taskViewAssembler.toTaskDTO(
                taskCommandService.feedbackRetryTask(requireTaskId(id), request.getFeedback())));
    }

    /**
     * 返回重置前的任务，调用方据此清理旧分支或 PR。
     */
    @PostMapping("/tasks/{id}/start-over")
    public Response<TaskDTO> startOver(@PathVariable("id") String id,
                                       @RequestBody(required = false) TaskStartOverRequestDTO request) {
        return success(taskViewAssembler.toTaskDTO(
                taskCommandService.startOverTask(requireTaskId(id), taskViewAssembler.toStartOverCommand(request))));
    }

    @DeleteMapping("/tasks/{id}/dependencies/{depId}")
    public Response<TaskDTO> removeDependency(@PathVariable("id") String id, @PathVariable("depId") String depId) {
        return success(taskViewAssembler.toTaskDTO(taskCommandService.removeDependency(requireTaskId(id), depId)));
    }

    private String requireTaskId(String id) {
        if (!IdGenerator.isTaskId(id)) {
            throw AppException.illegalParameter("Invalid task id: " + id);
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
