package com.verve.trigger.application.command;

import com.verve.domain.common.adapter.ITransactionScope;
import com.verve.domain.event.adapter.gateway.IDomainEventBroker;
import com.verve.domain.event.model.entity.DomainEventEntity;
import com.verve.domain.repo.adapter.repository.IRepoRepository;
import com.verve.domain.task.adapter.repository.ITaskRepository;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.task.model.entity.TaskLogEntity;
import com.verve.domain.task.model.valobj.TaskCompletionReport;
import com.verve.domain.task.model.valobj.TaskEditCommand;
import com.verve.domain.task.model.valobj.TaskRetryDecision;
import com.verve.domain.task.model.valobj.TaskStartOverCommand;
import com.verve.domain.task.service.TaskCompletionDomainService;
import com.verve.domain.task.service.TaskCompletionDomainService.CompletionDecision;
import com.verve.domain.task.service.TaskRetryPolicyDomainService;
import com.verve.trigger.application.common.StoreTimeoutRetrier;
import com.verve.types.common.Constants;
import com.verve.types.common.IdGenerator;
import com.verve.types.enums.TaskStatusEnum;
import com.verve.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 任务状态机写用例。
 * <p>
 * 每个迁移落到仓储的一条条件更新上，更新未生效时按当前行状态抛出：
 * <ul>
 *   <li>行不存在：NOT_FOUND</li>
 *   <li>行存在但前置状态已变：PRECONDITION_FAILED（后台调用方视为竞争失败）</li>
 * </ul>
 * 每次成功变更后发布携带完整任务状态的事件。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@Service
public class TaskCommandService {

    public static final String STALE_REASON = "stale: worker heartbeat expired";

    private final ITaskRepository taskRepository;
    private final IRepoRepository repoRepository;
    private final ITransactionScope transactionScope;
    private final IDomainEventBroker eventBroker;
    private final TaskRetryPolicyDomainService retryPolicy;
    private final TaskCompletionDomainService completionPolicy;
    private final SettingCommandService settingCommandService;
    private final StoreTimeoutRetrier retrier;
    private final Counter claimCounter;

    public TaskCommandService(ITaskRepository taskRepository,
                              IRepoRepository repoRepository,
                              ITransactionScope transactionScope,
                              IDomainEventBroker eventBroker,
                              TaskRetryPolicyDomainService retryPolicy,
                              TaskCompletionDomainService completionPolicy,
                              SettingCommandService settingCommandService,
                              StoreTimeoutRetrier retrier) {
        this.taskRepository = taskRepository;
        this.repoRepository = repoRepository;
        this.transactionScope = transactionScope;
        this.eventBroker = eventBroker;
        this.retryPolicy = retryPolicy;
        this.completionPolicy = completionPolicy;
        this.settingCommandService = settingCommandService;
        this.retrier = retrier;
        this.claimCounter = Counter.builder("verve.task.claim.total").register(Metrics.globalRegistry);
    }

    // ---------------------------------------------------------------- create / query

    public TaskEntity createTask(String repoId, TaskEditCommand command) {
        if (retrier.call("read repo", () -> repoRepository.findById(repoId)) == null) {
            throw AppException.notFound("Repo not found: " + repoId);
        }
        if (StringUtils.isBlank(command.getTitle())) {
            throw AppException.illegalParameter("Task title is required");
        }
        List<String> dependsOn = validateDependencies(null, command.getDependsOn());
        LocalDateTime now = LocalDateTime.now();

        TaskEntity task = new TaskEntity();
        task.setId(IdGenerator.newTaskId());
        task.setRepoId(repoId);
        task.setTitle(command.getTitle().trim());
        task.setDescription(StringUtils.defaultString(command.getDescription()));
        task.setAcceptanceCriteria(command.getAcceptanceCriteria() == null
                ? new ArrayList<>() : new ArrayList<>(command.getAcceptanceCriteria()));
        task.setStatus(TaskStatusEnum.PENDING);
        task.setDependsOn(dependsOn);
        task.setReady(command.getReady() == null || command.getReady());
        task.setAttempt(1);
        task.setMaxAttempts(normalizeMaxAttempts(command.getMaxAttempts()));
        task.setMaxCostUsd(normalizeMaxCost(command.getMaxCostUsd()));
        task.setCostUsd(BigDecimal.ZERO);
        task.setSkipPr(Boolean.TRUE.equals(command.getSkipPr()));
        task.setModel(StringUtils.isNotBlank(command.getModel()) ? command.getModel() : settingCommandService.defaultModel());
        task.setCreatedAt(now);
        task.setUpdatedAt(now);

        TaskEntity saved = retrier.call("create task", () -> taskRepository.save(task));
        log.info("Task created. taskId={}, repoId={}, dependsOn={}", saved.getId(), repoId, dependsOn);
        eventBroker.publish(DomainEventEntity.taskCreated(saved));
        return saved;
    }

    public TaskEntity getTask(String id) {
        TaskEntity task = retrier.call("read task", () -> taskRepository.findById(id));
        if (task == null) {
            throw AppException.notFound("Task not found: " + id);
        }
        return task;
    }

    public List<TaskEntity> listTasks() {
        return retrier.call("list tasks", taskRepository::findAll);
    }

    public List<TaskEntity> listTasksByRepo(String repoId) {
        return retrier.call("list tasks", () -> taskRepository.findByRepoId(repoId));
    }

    public List<TaskEntity> findTasks(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return new ArrayList<>();
        }
        return retrier.call("list tasks", () -> taskRepository.findByIds(ids));
    }

    public List<TaskEntity> listTasksByStatus(TaskStatusEnum status) {
        return retrier.call("list tasks", () -> taskRepository.findByStatus(status));
    }

    public List<TaskEntity> listReviewTasksWithoutPullRequest() {
        return retrier.call("list tasks", taskRepository::findInReviewWithoutPullRequest);
    }

    public List<String> readLogs(String id) {
        getTask(id);
        return retrier.call("read logs", () -> taskRepository.findLogs(id));
    }

    public List<TaskLogEntity> readLogBatches(String id) {
        getTask(id);
        return retrier.call("read logs", () -> taskRepository.findLogBatches(id));
    }

    // ---------------------------------------------------------------- worker protocol

    /**
     * 按创建时间顺序尝试领取候选任务，先到先得；没有可领取任务返回 null。
     */
    public TaskEntity claimPendingTask(List<String> repoIds) {
        TaskEntity claimed = retrier.call("claim task", () -> transactionScope.execute(() -> {
            LocalDateTime now = LocalDateTime.now();
            for (TaskEntity candidate : taskRepository.findClaimCandidates(repoIds)) {
                if (taskRepository.claim(candidate.getId(), now)) {
                    return taskRepository.findById(candidate.getId());
                }
            }
            return null;
        }));
        if (claimed != null) {
            claimCounter.increment();
            log.info("Task claimed. taskId={}, repoId={}, attempt={}", claimed.getId(), claimed.getRepoId(),
                    claimed.getAttempt());
            eventBroker.publish(DomainEventEntity.taskUpdated(claimed));
        }
        return claimed;
    }

    public void heartbeat(String id) {
        boolean applied = retrier.call("heartbeat task", () -> taskRepository.heartbeat(id, LocalDateTime.now()));
        requireApplied(applied, id, "heartbeat");
    }

    public void appendLogs(String id, int attempt, List<String> lines) {
        TaskEntity task = getTask(id);
        if (lines == null || lines.isEmpty()) {
            return;
        }
        int effectiveAttempt = attempt <= 0 ? 1 : attempt;
        retrier.run("append logs", () -> taskRepository.appendLogs(id, effectiveAttempt, lines, LocalDateTime.now()));
        eventBroker.publish(DomainEventEntity.logsAppended(task.getRepoId(), id, effectiveAttempt, lines));
    }

    public TaskEntity setPullRequest(String id, String pullRequestUrl, int prNumber) {
        boolean applied = retrier.call("set pull request",
                () -> taskRepository.setPullRequest(id, pullRequestUrl, prNumber, LocalDateTime.now()));
        requireApplied(applied, id, "set pull request on");
        return publishUpdated(id);
    }

    public TaskEntity setBranch(String id, String branchName) {
        boolean applied = retrier.call("set branch", () -> taskRepository.setBranch(id, branchName, LocalDateTime.now()));
        requireApplied(applied, id, "set branch on");
        return publishUpdated(id);
    }

    /**
     * running 任务的计划重试，先过预算与同因熔断检查。
     */
    public TaskEntity scheduleRetry(String id, String reason) {
        TaskEntity task = getTask(id);
        TaskRetryDecision decision = retryPolicy.decideScheduledRetry(task, reason);
        LocalDateTime now = LocalDateTime.now();
        boolean applied;
        if (decision.isRetry()) {
            applied = retrier.call("schedule retry",
                    () -> taskRepository.retryFromRunning(id, reason, decision.getConsecutiveFailures(), now));
        } else {
            applied = retrier.call("fail task",
                    () -> taskRepository.fail(id, TaskStatusEnum.RUNNING, decision.getFailReason(), now));
            log.info("Scheduled retry refused, task failed. taskId={}, reason={}", id, decision.getFailReason());
        }
        requireApplied(applied, id, "schedule retry for");
        return publishUpdated(id);
    }

    /**
     * Worker 上报执行结果。
     */
    public TaskEntity completeTask(String id, TaskCompletionReport report) {
        TaskEntity current = getTask(id);
        if (current.getStatus() != TaskStatusEnum.RUNNING) {
            throw preconditionFailed(current, "complete");
        }
        LocalDateTime now = LocalDateTime.now();
        if (StringUtils.isNotBlank(report.getAgentStatus())) {
            retrier.call("set agent status", () -> taskRepository.setAgentStatus(id, report.getAgentStatus(), now));
        }
        if (report.getCostUsd() != null && report.getCostUsd().signum() > 0) {
            retrier.call("add cost", () -> taskRepository.addCost(id, report.getCostUsd(), now));
        }
        TaskEntity task = getTask(id);
        CompletionDecision decision = completionPolicy.decide(task, report);
        String closeReason = completionPolicy.closeReason(report, decision);
        log.info("Task completion reported. taskId={}, success={}, decision={}", id, report.isSuccess(), decision);

        switch (decision) {
            case SCHEDULE_RETRY:
                return scheduleRetry(id, completionPolicy.retryReason(report));
            case FAIL:
                String failReason = closeReason != null ? closeReason : StringUtils.trimToNull(report.getError());
                requireApplied(retrier.call("fail task",
                        () -> taskRepository.fail(id, TaskStatusEnum.RUNNING, failReason, now)), id, "fail");
                return publishUpdated(id);
            case REVIEW:
                requireApplied(retrier.call("move to review",
                        () -> taskRepository.transition(id, TaskStatusEnum.RUNNING, TaskStatusEnum.REVIEW, now)),
                        id, "move to review");
                break;
            case SET_PULL_REQUEST:
                requireApplied(retrier.call("set pull request",
                        () -> taskRepository.setPullRequest(id, report.getPullRequestUrl(), report.getPrNumber(), now)),
                        id, "set pull request on");
                break;
            case SET_BRANCH:
                requireApplied(retrier.call("set branch",
                        () -> taskRepository.setBranch(id, report.getBranchName(), now)), id, "set branch on");
                break;
            case CLOSE:
            default:
                requireApplied(retrier.call("close task", () -> taskRepository.close(id, closeReason, now)), id, "close");
                return publishUpdated(id);
        }
        if (closeReason != null) {
            retrier.call("set close reason", () -> taskRepository.setCloseReason(id, closeReason, now));
        }
        return publishUpdated(id);
    }

    // ---------------------------------------------------------------- review outcomes

    public TaskEntity markMerged(String id) {
        boolean applied = retrier.call("mark merged",
                () -> taskRepository.transition(id, TaskStatusEnum.REVIEW, TaskStatusEnum.MERGED, LocalDateTime.now()));
        requireApplied(applied, id, "mark merged");
        log.info("Task merged. taskId={}", id);
        return publishUpdated(id);
    }

    /**
     * review 任务的自动重试。retryContext 非空时随重试一起写入。
     */
    public TaskEntity retryTask(String id, String category, String reason, String retryContext) {
        TaskEntity task = getTask(id);
        TaskRetryDecision decision = retryPolicy.decideReviewRetry(task, category);
        boolean applied = retrier.call("retry task", () -> transactionScope.execute(() -> {
            LocalDateTime now = LocalDateTime.now();
            if (!decision.isRetry()) {
                return taskRepository.fail(id, TaskStatusEnum.REVIEW, decision.getFailReason(), now);
            }
            boolean retried = taskRepository.retryFromReview(id, reason, category, decision.getConsecutiveFailures(), now);
            if (retried && retryContext != null) {
                taskRepository.setRetryContext(id, retryContext, now);
            }
            return retried;
        }));
        requireApplied(applied, id, "retry");
        if (decision.isRetry()) {
            log.info("Task requeued for retry. taskId={}, category={}, attempt={}", id, category, task.getAttempt() + 1);
        } else {
            log.info("Automatic retry refused, task failed. taskId={}, reason={}", id, decision.getFailReason());
        }
        return publishUpdated(id);
    }

    public TaskEntity manualRetryTask(String id, String instructions) {
        boolean applied = retrier.call("retry task",
                () -> taskRepository.manualRetry(id, StringUtils.trimToNull(instructions), LocalDateTime.now()));
        requireApplied(applied, id, "retry");
        return publishUpdated(id);
    }

    public TaskEntity feedbackRetryTask(String id, String feedback) {
        if (StringUtils.isBlank(feedback)) {
            throw AppException.illegalParameter("Feedback is required");
        }
        TaskEntity task = getTask(id);
        TaskRetryDecision decision = retryPolicy.decideFeedbackRetry(task);
        LocalDateTime now = LocalDateTime.now();
        boolean applied = decision.isRetry()
                ? retrier.call("feedback retry", () -> taskRepository.feedbackRetry(id, feedback, now))
                : retrier.call("fail task", () -> taskRepository.fail(id, TaskStatusEnum.REVIEW, decision.getFailReason(), now));
        requireApplied(applied, id, "retry");
        return publishUpdated(id);
    }

    /**
     * 从头开始：重置全部执行状态并删除日志，返回重置前的任务（调用方据此清理分支或 PR）。
     */
    public TaskEntity startOverTask(String id, TaskStartOverCommand command) {
        TaskEntity before = getTask(id);
        boolean applied = retrier.call("start over", () -> transactionScope.execute(() -> {
            if (!taskRepository.startOver(id, command, LocalDateTime.now())) {
                return false;
            }
            taskRepository.deleteLogs(id);
            return true;
        }));
        requireApplied(applied, id, "start over");
        log.info("Task started over. taskId={}, previousStatus={}", id, before.getStatus().getCode());
        publishUpdated(id);
        return before;
    }

    public TaskEntity closeTask(String id, String reason) {
        boolean applied = retrier.call("close task",
                () -> taskRepository.close(id, StringUtils.trimToNull(reason), LocalDateTime.now()));
        requireApplied(applied, id, "close");
        return publishUpdated(id);
    }

    // ---------------------------------------------------------------- editing

    public TaskEntity updatePendingTask(String id, TaskEditCommand command) {
        if (command.getTitle() != null && StringUtils.isBlank(command.getTitle())) {
            throw AppException.illegalParameter("Task title cannot be blank");
        }
        List<String> dependsOn = command.getDependsOn() == null ? null : validateDependencies(id, command.getDependsOn());
        TaskEditCommand normalized = TaskEditCommand.builder()
                .title(command.getTitle())
                .description(command.getDescription())
                .acceptanceCriteria(command.getAcceptanceCriteria())
                .dependsOn(dependsOn)
                .maxAttempts(command.getMaxAttempts() == null ? null : normalizeMaxAttempts(command.getMaxAttempts()))
                .maxCostUsd(command.getMaxCostUsd() == null ? null : normalizeMaxCost(command.getMaxCostUsd()))
                .skipPr(command.getSkipPr())
                .model(StringUtils.trimToNull(command.getModel()))
                .ready(command.getReady())
                .build();
        boolean applied = retrier.call("update task",
                () -> taskRepository.updatePending(id, normalized, LocalDateTime.now()));
        requireApplied(applied, id, "edit");
        return publishUpdated(id);
    }

    public TaskEntity setReady(String id, boolean ready) {
        boolean applied = retrier.call("set ready", () -> taskRepository.setReady(id, ready, LocalDateTime.now()));
        requireApplied(applied, id, "set ready on");
        return publishUpdated(id);
    }

    /**
     * 幂等：依赖不存在于列表时不报错。
     */
    public TaskEntity removeDependency(String id, String dependencyId) {
        if (!IdGenerator.isTaskId(dependencyId)) {
            throw AppException.illegalParameter("Invalid dependency id: " + dependencyId);
        }
        boolean exists = retrier.call("remove dependency",
                () -> taskRepository.removeDependency(id, dependencyId, LocalDateTime.now()));
        if (!exists) {
            throw AppException.notFound("Task not found: " + id);
        }
        return publishUpdated(id);
    }

    // ---------------------------------------------------------------- recovery

    /**
     * 心跳超时的 running 任务重新排队，不检查重试预算；返回是否生效。
     */
    public boolean requeueStaleTask(String id, LocalDateTime cutoff) {
        boolean applied = retrier.call("requeue task",
                () -> taskRepository.requeueStale(id, STALE_REASON, cutoff, LocalDateTime.now()));
        if (applied) {
            publishUpdated(id);
        }
        return applied;
    }

    public List<TaskEntity> findStaleRunning(LocalDateTime cutoff) {
        return retrier.call("list stale tasks", () -> taskRepository.findStaleRunning(cutoff));
    }

    // ---------------------------------------------------------------- helpers

    private List<String> validateDependencies(String selfId, List<String> dependsOn) {
        List<String> result = new ArrayList<>();
        if (dependsOn == null) {
            return result;
        }
        for (String depId : new LinkedHashSet<>(dependsOn)) {
            if (!IdGenerator.isTaskId(depId)) {
                throw AppException.illegalParameter("Invalid dependency id: " + depId);
            }
            if (depId.equals(selfId)) {
                throw AppException.illegalParameter("Task cannot depend on itself: " + depId);
            }
            if (!retrier.call("read task", () -> taskRepository.existsById(depId))) {
                throw AppException.notFound("Dependency task not found: " + depId);
            }
            result.add(depId);
        }
        return result;
    }

    private int normalizeMaxAttempts(Integer maxAttempts) {
        return maxAttempts == null || maxAttempts <= 0 ? Constants.DEFAULT_MAX_ATTEMPTS : maxAttempts;
    }

    private BigDecimal normalizeMaxCost(BigDecimal maxCostUsd) {
        if (maxCostUsd == null) {
            return BigDecimal.ZERO;
        }
        if (maxCostUsd.signum() < 0) {
            throw AppException.illegalParameter("maxCostUsd cannot be negative");
        }
        return maxCostUsd;
    }

    private void requireApplied(boolean applied, String id, String action) {
        if (applied) {
            return;
        }
        TaskEntity current = retrier.call("read task", () -> taskRepository.findById(id));
        if (current == null) {
            throw AppException.notFound("Task not found: " + id);
        }
        throw preconditionFailed(current, action);
    }

    private AppException preconditionFailed(TaskEntity current, String action) {
        return AppException.preconditionFailed("Cannot " + action + " task " + current.getId()
                + ": status is " + current.getStatus().getCode() + " (already resolved by someone else)");
    }

    private TaskEntity publishUpdated(String id) {
        TaskEntity task = retrier.call("read task", () -> taskRepository.findById(id));
        if (task != null) {
            eventBroker.publish(DomainEventEntity.taskUpdated(task));
        }
        return task;
    }
}
