package com.verve.trigger.http;

import com.verve.api.dto.EpicConfirmRequestDTO;
import com.verve.api.dto.EpicCreateRequestDTO;
import com.verve.api.dto.EpicDTO;
import com.verve.api.dto.EpicGenerateRequestDTO;
import com.verve.api.dto.EpicPlanRequestDTO;
import com.verve.api.dto.EpicProposedTasksRequestDTO;
import com.verve.api.dto.EpicSessionMessageRequestDTO;
import com.verve.api.dto.EpicTaskSummaryDTO;
import com.verve.api.response.Response;
import com.verve.trigger.application.command.EpicCommandService;
import com.verve.trigger.application.common.EpicViewAssembler;
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
import java.util.stream.Collectors;

/**
 * Epic 规划与确认 API（面向用户）。
 */
@RestController
@RequestMapping("/api/v1")
public class EpicController {

    private final EpicCommandService epicCommandService;
    private final EpicViewAssembler epicViewAssembler;
    private final TaskViewAssembler taskViewAssembler;

    public EpicController(EpicCommandService epicCommandService,
                          EpicViewAssembler epicViewAssembler,
                          TaskViewAssembler taskViewAssembler) {
        this.epicCommandService = epicCommandService;
        this.epicViewAssembler = epicViewAssembler;
        this.taskViewAssembler = taskViewAssembler;
    }

    @GetMapping("/repos/{repoId}/epics")
    public Response<List<EpicDTO>> listEpics(@PathVariable("repoId") String repoId) {
        return success(epicViewAssembler.toEpicDTOs(epicCommandService.listEpicsByRepo(repoId)));
    }

    @PostMapping("/repos/{repoId}/epics")
    public Response<EpicDTO> createEpic(@PathVariable("repoId") String repoId, @RequestBody EpicCreateRequestDTO request) {
        return success(epicViewAssembler.toEpicDTO(epicCommandService.createEpic(repoId, request.getTitle(),
                request.getDescription(), request.getPlanningPrompt(), request.getModel())));
    }

    @GetMapping("/epics/{id}")
    public Response<EpicDTO> getEpic(@PathVariable("id") String id) {
        return success(epicViewAssembler.toEpicDTO(epicCommandService.getEpic(requireEpicId(id))));
    }

    @DeleteMapping("/epics/{id}")
    public Response<Void> deleteEpic(@PathVariable("id") String id) {
        epicCommandService.deleteEpic(requireEpicId(id));
        return success(null);
    }

    @GetMapping("/epics/{id}/tasks")
    public Response<List<EpicTaskSummaryDTO>> listEpicTasks(@PathVariable("id") String id) {
        return success(epicCommandService.listEpicTasks(requireEpicId(id)).stream()
                .map(taskViewAssembler::toEpicTaskSummaryDTO)
                .collect(Collectors.toList()));
    }

    @PostMapping("/epics/{id}/plan")
    public Response<EpicDTO> startPlanning(@PathVariable("id") String id,
                                           @RequestBody(required = false) EpicPlanRequestDTO request) {
        String prompt = request == null ? null : request.getPrompt();
        return success(epicViewAssembler.toEpicDTO(epicCommandService.startPlanning(requireEpicId(id), prompt)));
    }

    @PostMapping("/epics/{id}/generate")
    public Response<EpicDTO> generateProposals(@PathVariable("id") String id,
                                               @RequestBody(required = false) EpicGenerateRequestDTO request) {
        String instructions = request == null ? null : request.getInstructions();
        return success(epicViewAssembler.toEpicDTO(epicCommandService.generateProposals(requireEpicId(id), instructions)));
    }

    @PostMapping("/epics/{id}/session-message")
    public Response<EpicDTO> sendSessionMessage(@PathVariable("id") String id,
                                                @RequestBody EpicSessionMessageRequestDTO request) {
        return success(epicViewAssembler.toEpicDTO(
                epicCommandService.sendSessionMessage(requireEpicId(id), request.getMessage())));
    }

    @PutMapping("/epics/{id}/proposed-tasks")
    public Response<EpicDTO> updateProposedTasks(@PathVariable("id") String id,
                                                 @RequestBody EpicProposedTasksRequestDTO request) {
        return success(epicViewAssembler.toEpicDTO(epicCommandService.updateProposedTasks(requireEpicId(id),
                epicViewAssembler.toProposedTasks(request.getTasks()))));
    }

    @PostMapping("/epics/{id}/confirm")
    public Response<EpicDTO> confirmEpic(@PathVariable("id") String id,
                                         @RequestBody(required = false) EpicConfirmRequestDTO request) {
        boolean notReady = request != null && Boolean.TRUE.equals(request.getNotReady());
        return success(epicViewAssembler.toEpicDTO(epicCommandService.confirmEpic(requireEpicId(id), notReady)));
    }

    @PostMapping("/epics/{id}/close")
    public Response<EpicDTO> closeEpic(@PathVariable("id") String id) {
        return success(epicViewAssembler.toEpicDTO(epicCommandService.closeEpic(requireEpicId(id))));
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
