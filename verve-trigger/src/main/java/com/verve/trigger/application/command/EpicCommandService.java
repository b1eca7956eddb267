package com.verve.trigger.application.command;

import com.verve.domain.common.adapter.ITransactionScope;
import com.verve.domain.epic.adapter.gateway.ITaskPlanner;
import com.verve.domain.epic.adapter.repository.IEpicRepository;
import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.epic.model.valobj.EpicFeedback;
import com.verve.domain.epic.model.valobj.PlannedTask;
import com.verve.domain.epic.model.valobj.ProposedTask;
import com.verve.domain.epic.service.EpicCompletionDomainService;
import com.verve.domain.epic.service.EpicPlanningDomainService;
import com.verve.domain.event.adapter.gateway.IDomainEventBroker;
import com.verve.domain.event.model.entity.DomainEventEntity;
import com.verve.domain.repo.adapter.repository.IRepoRepository;
import com.verve.domain.task.adapter.repository.ITaskRepository;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.trigger.application.common.StoreTimeoutRetrier;
import com.verve.types.common.Constants;
import com.verve.types.common.IdGenerator;
import com.verve.types.enums.EpicFeedbackTypeEnum;
import com.verve.types.enums.EpicStatusEnum;
import com.verve.types.enums.TaskStatusEnum;
import com.verve.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Epic 规划会话与确认用例。
 * <p>
 * 规划 worker 通过领取 + 心跳独占一个 planning 状态的 epic，用户消息、确认、关闭通过反馈信箱投递给它。
 * 确认时拟定任务在同一事务内物化为真实任务。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@Service
public class EpicCommandService {

    private static final String USER_MESSAGE_PREFIX = "user: ";
    private static final int POLL_FEEDBACK_ATTEMPTS = 3;

    private final IEpicRepository epicRepository;
    private final ITaskRepository taskRepository;
    private final IRepoRepository repoRepository;
    private final ITransactionScope transactionScope;
    private final IDomainEventBroker eventBroker;
    private final EpicPlanningDomainService planningDomainService;
    private final EpicCompletionDomainService completionDomainService;
    private final SettingCommandService settingCommandService;
    private final ObjectProvider<ITaskPlanner> taskPlannerProvider;
    private final StoreTimeoutRetrier retrier;

    public EpicCommandService(IEpicRepository epicRepository,
                              ITaskRepository taskRepository,
                              IRepoRepository repoRepository,
                              ITransactionScope transactionScope,
                              IDomainEventBroker eventBroker,
                              EpicPlanningDomainService planningDomainService,
                              EpicCompletionDomainService completionDomainService,
                              SettingCommandService settingCommandService,
                              ObjectProvider<ITaskPlanner> taskPlannerProvider,
                              StoreTimeoutRetrier retrier) {
        this.epicRepository = epicRepository;
        this.taskRepository = taskRepository;
        this.repoRepository = repoRepository;
        this.transactionScope = transactionScope;
        this.eventBroker = eventBroker;
        this.planningDomainService = planningDomainService;
        this.completionDomainService = completionDomainService;
        this.settingCommandService = settingCommandService;
        this.taskPlannerProvider = taskPlannerProvider;
        this.retrier = retrier;
    }

    // ---------------------------------------------------------------- create / query

    public EpicEntity createEpic(String repoId, String title, String description, String planningPrompt, String model) {
        if (retrier.call("read repo", () -> repoRepository.findById(repoId)) == null) {
            throw AppException.notFound("Repo not found: " + repoId);
        }
        if (StringUtils.isBlank(title)) {
            throw AppException.illegalParameter("Epic title is required");
        }
        String trimmedTitle = title.trim();
        if (trimmedTitle.length() > Constants.EPIC_TITLE_MAX_LENGTH) {
            throw AppException.illegalParameter("Epic title exceeds " + Constants.EPIC_TITLE_MAX_LENGTH + " characters");
        }
        LocalDateTime now = LocalDateTime.now();
        EpicEntity epic = new EpicEntity();
        epic.setId(IdGenerator.newEpicId());
        epic.setRepoId(repoId);
        epic.setTitle(trimmedTitle);
        epic.setDescription(StringUtils.defaultString(description));
        epic.setStatus(EpicStatusEnum.PLANNING);
        epic.setPlanningPrompt(StringUtils.trimToNull(planningPrompt));
        epic.setModel(StringUtils.isNotBlank(model) ? model.trim() : settingCommandService.defaultModel());
        epic.setCreatedAt(now);
        epic.setUpdatedAt(now);
        epic.validate();

        EpicEntity saved = retrier.call("create epic", () -> epicRepository.save(epic));
        log.info("Epic created. epicId={}, repoId={}", saved.getId(), repoId);
        eventBroker.publish(DomainEventEntity.epicCreated(saved));
        return saved;
    }

    public EpicEntity getEpic(String id) {
        EpicEntity epic = retrier.call("read epic", () -> epicRepository.findById(id));
        if (epic == null) {
            throw AppException.notFound("Epic not found: " + id);
        }
        return epic;
    }

    public List<EpicEntity> listEpics() {
        return retrier.call("list epics", epicRepository::findAll);
    }

    public List<EpicEntity> listEpicsByRepo(String repoId) {
        return retrier.call("list epics", () -> epicRepository.findByRepoId(repoId));
    }

    public List<EpicEntity> listEpicsByStatus(EpicStatusEnum status) {
        return retrier.call("list epics", () -> epicRepository.findByStatus(status));
    }

    /**
     * 按 taskIds 顺序返回已存在的子任务，已删除的任务跳过。
     */
    public List<TaskEntity> listEpicTasks(String id) {
        EpicEntity epic = getEpic(id);
        if (epic.getTaskIds() == null || epic.getTaskIds().isEmpty()) {
            return Collections.emptyList();
        }
        Map<String, TaskEntity> byId = new HashMap<>();
        for (TaskEntity task : retrier.call("list tasks", () -> taskRepository.findByIds(epic.getTaskIds()))) {
            byId.put(task.getId(), task);
        }
        List<TaskEntity> result = new ArrayList<>();
        for (String taskId : epic.getTaskIds()) {
            TaskEntity task = byId.get(taskId);
            if (task != null) {
                result.add(task);
            }
        }
        return result;
    }

    // ---------------------------------------------------------------- planning claim

    public EpicEntity claimPendingEpic() {
        EpicEntity claimed = retrier.call("claim epic", () -> transactionScope.execute(() -> {
            LocalDateTime now = LocalDateTime.now();
            for (EpicEntity candidate : epicRepository.findClaimCandidates()) {
                if (epicRepository.claim(candidate.getId(), now)) {
                    return epicRepository.findById(candidate.getId());
                }
            }
            return null;
        }));
        if (claimed != null) {
            log.info("Epic claimed for planning. epicId={}, repoId={}", claimed.getId(), claimed.getRepoId());
            eventBroker.publish(DomainEventEntity.epicUpdated(claimed));
        }
        return claimed;
    }

    /**
     * 单个 epic 的条件领取，供并发领取场景直接调用。
     */
    public boolean claimEpic(String id) {
        boolean applied = retrier.call("claim epic", () -> epicRepository.claim(id, LocalDateTime.now()));
        if (applied) {
            publishUpdated(id);
        }
        return applied;
    }

    public void heartbeat(String id) {
        boolean applied = retrier.call("heartbeat epic", () -> epicRepository.heartbeat(id, LocalDateTime.now()));
        requireApplied(applied, id, "heartbeat");
    }

    public EpicEntity releaseEpicClaim(String id) {
        boolean applied = retrier.call("release epic", () -> epicRepository.releaseClaim(id, LocalDateTime.now()));
        requireApplied(applied, id, "release");
        log.info("Epic claim released. epicId={}", id);
        return publishUpdated(id);
    }

    // ---------------------------------------------------------------- feedback mailbox

    public EpicEntity setFeedback(String id, String feedback, EpicFeedbackTypeEnum type) {
        if (type == null) {
            throw AppException.illegalParameter("Feedback type is required");
        }
        EpicStatusEnum forcedStatus = type == EpicFeedbackTypeEnum.MESSAGE ? EpicStatusEnum.PLANNING : null;
        boolean applied = retrier.call("set feedback",
                () -> epicRepository.setFeedback(id, feedback, type, forcedStatus, LocalDateTime.now()));
        requireApplied(applied, id, "send feedback to");
        return publishUpdated(id);
    }

    /**
     * 读取并清空信箱；信箱为空返回 null。
     * 清空以读到的内容为条件，读取与清空之间若有新反馈写入则重读。
     */
    public EpicFeedback pollFeedback(String id) {
        for (int i = 0; i < POLL_FEEDBACK_ATTEMPTS; i++) {
            EpicEntity epic = getEpic(id);
            if (!epic.hasFeedback()) {
                return null;
            }
            boolean cleared = retrier.call("clear feedback", () -> epicRepository.clearFeedback(id,
                    epic.getFeedback(), epic.getFeedbackType(), LocalDateTime.now()));
            if (cleared) {
                return new EpicFeedback(epic.getFeedbackType(), epic.getFeedback());
            }
            log.debug("Epic feedback changed while polling, re-reading. epicId={}", id);
        }
        return null;
    }

    public EpicEntity sendSessionMessage(String id, String message) {
        if (StringUtils.isBlank(message)) {
            throw AppException.illegalParameter("Message is required");
        }
        appendSessionLog(id, Collections.singletonList(USER_MESSAGE_PREFIX + message));
        return setFeedback(id, message, EpicFeedbackTypeEnum.MESSAGE);
    }

    public EpicEntity appendSessionLog(String id, List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return getEpic(id);
        }
        boolean applied = retrier.call("append session log",
                () -> epicRepository.appendSessionLog(id, lines, LocalDateTime.now()));
        requireApplied(applied, id, "append session log to");
        return publishUpdated(id);
    }

    // ---------------------------------------------------------------- proposals

    public EpicEntity updateProposedTasks(String id, List<ProposedTask> proposedTasks) {
        List<ProposedTask> normalized = normalizeProposals(proposedTasks);
        boolean applied = retrier.call("update proposed tasks",
                () -> epicRepository.updateProposedTasks(id, normalized, LocalDateTime.now()));
        requireApplied(applied, id, "update proposed tasks of");
        log.info("Epic proposals updated. epicId={}, proposedTasks={}", id, normalized.size());
        return publishUpdated(id);
    }

    public EpicEntity startPlanning(String id, String planningPrompt) {
        boolean applied = retrier.call("start planning",
                () -> epicRepository.startPlanning(id, StringUtils.trimToNull(planningPrompt), LocalDateTime.now()));
        requireApplied(applied, id, "start planning");
        return publishUpdated(id);
    }

    /**
     * 同步调用规划器生成拟定任务。
     */
    public EpicEntity generateProposals(String id, String extraInstructions) {
        EpicEntity epic = getEpic(id);
        ITaskPlanner planner = taskPlannerProvider.getIfAvailable();
        if (planner == null) {
            throw AppException.upstreamUnavailable("Task planner is not configured", null);
        }
        List<PlannedTask> planned = planner.proposeTasks(epic.getTitle(), epic.getDescription(),
                StringUtils.trimToNull(extraInstructions));
        log.info("Planner returned tasks. epicId={}, count={}", id, planned == null ? 0 : planned.size());
        return updateProposedTasks(id, planningDomainService.toProposedTasks(planned));
    }

    /**
     * 确认拟定任务：按列表顺序创建任务并写回 taskIds，状态进入 active（notReady 时为 ready）。
     */
    public EpicEntity confirmEpic(String id, boolean notReady) {
        List<TaskEntity> created = retrier.call("confirm epic", () -> transactionScope.execute(() -> {
            EpicEntity epic = epicRepository.findById(id);
            if (epic == null) {
                throw AppException.notFound("Epic not found: " + id);
            }
            if (!epic.isConfirmable()) {
                throw preconditionFailed(epic, "confirm");
            }
            if (epic.getProposedTasks() == null || epic.getProposedTasks().isEmpty()) {
                throw AppException.preconditionFailed("Epic " + id + " has no proposed tasks");
            }
            LocalDateTime now = LocalDateTime.now();
            List<TaskEntity> tasks = planningDomainService.materialize(epic, notReady, Constants.DEFAULT_MAX_ATTEMPTS, now);
            List<String> taskIds = new ArrayList<>();
            for (TaskEntity task : tasks) {
                taskRepository.save(task);
                taskIds.add(task.getId());
            }
            if (!epicRepository.confirm(id, taskIds, notReady, now)) {
                throw preconditionFailed(epicRepository.findById(id), "confirm");
            }
            return tasks;
        }));
        for (TaskEntity task : created) {
            eventBroker.publish(DomainEventEntity.taskCreated(task));
        }
        log.info("Epic confirmed. epicId={}, tasks={}, notReady={}", id, created.size(), notReady);
        return publishUpdated(id);
    }

    public EpicEntity closeEpic(String id) {
        boolean applied = retrier.call("close epic", () -> epicRepository.close(id, LocalDateTime.now()));
        requireApplied(applied, id, "close");
        log.info("Epic closed. epicId={}", id);
        return publishUpdated(id);
    }

    public void deleteEpic(String id) {
        EpicEntity epic = getEpic(id);
        boolean applied = retrier.call("delete epic", () -> epicRepository.deleteDraft(id));
        requireApplied(applied, id, "delete");
        log.info("Epic deleted. epicId={}", id);
        eventBroker.publish(DomainEventEntity.epicDeleted(epic.getRepoId(), id));
    }

    // ---------------------------------------------------------------- background sweeps

    /**
     * 释放心跳超时的规划领取，返回释放数量。
     */
    public int timeoutStaleEpics(Duration timeout) {
        LocalDateTime cutoff = LocalDateTime.now().minus(timeout);
        List<EpicEntity> stale = retrier.call("list stale epics", () -> epicRepository.findStaleClaimed(cutoff));
        int released = 0;
        for (EpicEntity epic : stale) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            boolean applied = retrier.call("release stale epic", () -> transactionScope.execute(() -> {
                LocalDateTime now = LocalDateTime.now();
                if (!epicRepository.releaseStaleClaim(epic.getId(), cutoff, now)) {
                    return false;
                }
                epicRepository.appendSessionLog(epic.getId(),
                        Collections.singletonList(Constants.EPIC_TIMEOUT_LOG_LINE), now);
                return true;
            }));
            if (applied) {
                released++;
                log.info("Stale epic claim released. epicId={}, lastHeartbeatAt={}", epic.getId(), epic.getLastHeartbeatAt());
                publishUpdated(epic.getId());
            }
        }
        return released;
    }

    /**
     * active epic 的子任务全部 merged/closed 时标记完成，返回完成数量。
     */
    public int checkActiveEpicsCompletion() {
        int completed = 0;
        for (EpicEntity epic : listEpicsByStatus(EpicStatusEnum.ACTIVE)) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            Map<String, TaskStatusEnum> statuses = new HashMap<>();
            if (epic.getTaskIds() != null && !epic.getTaskIds().isEmpty()) {
                for (TaskEntity task : retrier.call("list tasks", () -> taskRepository.findByIds(epic.getTaskIds()))) {
                    statuses.put(task.getId(), task.getStatus());
                }
            }
            if (!completionDomainService.isComplete(epic, statuses)) {
                continue;
            }
            if (retrier.call("complete epic", () -> epicRepository.complete(epic.getId(), LocalDateTime.now()))) {
                completed++;
                log.info("Epic completed. epicId={}, tasks={}", epic.getId(), epic.getTaskIds().size());
                publishUpdated(epic.getId());
            }
        }
        return completed;
    }

    // ---------------------------------------------------------------- helpers

    private List<ProposedTask> normalizeProposals(List<ProposedTask> proposedTasks) {
        List<ProposedTask> normalized = new ArrayList<>();
        if (proposedTasks == null) {
            return normalized;
        }
        int index = 1;
        for (ProposedTask proposed : proposedTasks) {
            if (proposed == null || StringUtils.isBlank(proposed.getTitle())) {
                throw AppException.illegalParameter("Proposed task title is required");
            }
            ProposedTask copy = proposed.copy();
            copy.setTitle(proposed.getTitle().trim());
            if (StringUtils.isBlank(copy.getTempId())) {
                copy.setTempId("task_" + index);
            }
            normalized.add(copy);
            index++;
        }
        return normalized;
    }

    private void requireApplied(boolean applied, String id, String action) {
        if (applied) {
            return;
        }
        EpicEntity current = retrier.call("read epic", () -> epicRepository.findById(id));
        if (current == null) {
            throw AppException.notFound("Epic not found: " + id);
        }
        throw preconditionFailed(current, action);
    }

    private AppException preconditionFailed(EpicEntity current, String action) {
        if (current == null) {
            return AppException.preconditionFailed("Cannot " + action + " epic: it no longer exists");
        }
        return AppException.preconditionFailed("Cannot " + action + " epic " + current.getId()
                + ": status is " + current.getStatus().getCode()
                + (current.isClaimed() ? " (claimed)" : " (unclaimed)"));
    }

    private EpicEntity publishUpdated(String id) {
        EpicEntity epic = retrier.call("read epic", () -> epicRepository.findById(id));
        if (epic != null) {
            eventBroker.publish(DomainEventEntity.epicUpdated(epic));
        }
        return epic;
    }
}
