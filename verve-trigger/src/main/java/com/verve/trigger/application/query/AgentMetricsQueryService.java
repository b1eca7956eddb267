package com.verve.trigger.application.query;

import com.verve.api.dto.ActiveAgentDTO;
import com.verve.api.dto.AgentMetricsDTO;
import com.verve.api.dto.RecentCompletionDTO;
import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.worker.service.WorkerRegistry;
import com.verve.trigger.application.command.EpicCommandService;
import com.verve.trigger.application.command.TaskCommandService;
import com.verve.trigger.application.common.CatalogViewAssembler;
import com.verve.types.enums.EpicStatusEnum;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Agent 活动快照读用例：任务计数、花费、正在运行的 agent 与最近完成记录。
 */
@Service
public class AgentMetricsQueryService {

    static final int RECENT_COMPLETION_LIMIT = 10;

    private final TaskCommandService taskCommandService;
    private final EpicCommandService epicCommandService;
    private final WorkerRegistry workerRegistry;
    private final CatalogViewAssembler catalogViewAssembler;
    private final Duration workerStaleness;

    public AgentMetricsQueryService(TaskCommandService taskCommandService,
                                    EpicCommandService epicCommandService,
                                    WorkerRegistry workerRegistry,
                                    CatalogViewAssembler catalogViewAssembler,
                                    @Value("${verve.workers.staleness-ms:120000}") long workerStalenessMillis) {
        this.taskCommandService = taskCommandService;
        this.epicCommandService = epicCommandService;
        this.workerRegistry = workerRegistry;
        this.catalogViewAssembler = catalogViewAssembler;
        this.workerStaleness = Duration.ofMillis(workerStalenessMillis <= 0 ? 120000L : workerStalenessMillis);
    }

    public Duration getWorkerStaleness() {
        return workerStaleness;
    }

    public AgentMetricsDTO getAgentMetrics() {
        LocalDateTime now = LocalDateTime.now();
        int running = 0;
        int pending = 0;
        int review = 0;
        int completed = 0;
        int failed = 0;
        BigDecimal totalCost = BigDecimal.ZERO;
        List<ActiveAgentDTO> activeAgents = new ArrayList<>();
        List<TaskEntity> terminal = new ArrayList<>();

        List<TaskEntity> tasks = taskCommandService.listTasks();
        for (TaskEntity task : tasks) {
            if (task.getCostUsd() != null) {
                totalCost = totalCost.add(task.getCostUsd());
            }
            switch (task.getStatus()) {
                case PENDING:
                    pending++;
                    break;
                case RUNNING:
                    running++;
                    activeAgents.add(toActiveAgent(task, now));
                    break;
                case REVIEW:
                    review++;
                    break;
                case MERGED:
                case CLOSED:
                    completed++;
                    terminal.add(task);
                    break;
                case FAILED:
                    failed++;
                    terminal.add(task);
                    break;
                default:
                    break;
            }
        }

        for (EpicEntity epic : epicCommandService.listEpicsByStatus(EpicStatusEnum.PLANNING)) {
            if (!epic.isClaimed()) {
                continue;
            }
            running++;
            activeAgents.add(toPlanningAgent(epic, now));
        }

        AgentMetricsDTO dto = new AgentMetricsDTO();
        dto.setRunningAgents(running);
        dto.setPendingTasks(pending);
        dto.setReviewTasks(review);
        dto.setTotalTasks(tasks.size());
        dto.setCompletedTasks(completed);
        dto.setFailedTasks(failed);
        dto.setTotalCostUsd(totalCost);
        dto.setActiveAgents(activeAgents);
        dto.setRecentCompletions(terminal.stream()
                .sorted(Comparator.comparing(TaskEntity::getUpdatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(RECENT_COMPLETION_LIMIT)
                .map(this::toRecentCompletion)
                .collect(Collectors.toList()));
        dto.setWorkers(workerRegistry.listWorkers(workerStaleness).stream()
                .map(catalogViewAssembler::toWorkerDTO)
                .collect(Collectors.toList()));
        return dto;
    }

    private ActiveAgentDTO toActiveAgent(TaskEntity task, LocalDateTime now) {
        ActiveAgentDTO agent = new ActiveAgentDTO();
        agent.setTaskId(task.getId());
        agent.setTaskTitle(task.getTitle());
        agent.setRepoId(task.getRepoId());
        agent.setAttempt(task.getAttempt());
        agent.setCostUsd(task.getCostUsd());
        agent.setModel(task.getModel());
        agent.setEpicId(task.getEpicId());
        if (task.getStartedAt() != null) {
            agent.setStartedAt(task.getStartedAt());
            agent.setRunningForMs(Duration.between(task.getStartedAt(), now).toMillis());
        }
        return agent;
    }

    private ActiveAgentDTO toPlanningAgent(EpicEntity epic, LocalDateTime now) {
        ActiveAgentDTO agent = new ActiveAgentDTO();
        agent.setTaskId(epic.getId());
        agent.setTaskTitle(epic.getTitle());
        agent.setRepoId(epic.getRepoId());
        agent.setModel(epic.getModel());
        agent.setEpicId(epic.getId());
        agent.setPlanning(true);
        agent.setEpicTitle(epic.getTitle());
        agent.setStartedAt(epic.getClaimedAt());
        agent.setRunningForMs(Duration.between(epic.getClaimedAt(), now).toMillis());
        return agent;
    }

    private RecentCompletionDTO toRecentCompletion(TaskEntity task) {
        RecentCompletionDTO completion = new RecentCompletionDTO();
        completion.setTaskId(task.getId());
        completion.setTaskTitle(task.getTitle());
        completion.setRepoId(task.getRepoId());
        completion.setStatus(task.getStatus().getCode());
        if (task.getStartedAt() != null && task.getUpdatedAt() != null) {
            completion.setDurationMs(Duration.between(task.getStartedAt(), task.getUpdatedAt()).toMillis());
        }
        completion.setCostUsd(task.getCostUsd());
        completion.setAttempt(task.getAttempt());
        completion.setFinishedAt(task.getUpdatedAt());
        return completion;
    }
}
