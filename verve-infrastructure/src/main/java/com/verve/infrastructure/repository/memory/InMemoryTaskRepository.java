package com.verve.infrastructure.repository.memory;

import com.verve.domain.task.adapter.repository.ITaskRepository;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.task.model.entity.TaskLogEntity;
import com.verve.domain.task.model.valobj.TaskEditCommand;
import com.verve.domain.task.model.valobj.TaskStartOverCommand;
import com.verve.types.enums.TaskStatusEnum;
import com.verve.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * 任务仓储内存实现，条件更新语义与 SQL 版本一致。
 *
 * @author verve
 * @since 2025-06-02
 */
@Repository
@ConditionalOnProperty(name = "verve.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryTaskRepository implements ITaskRepository {

    private final InMemoryDataStore store;

    public InMemoryTaskRepository(InMemoryDataStore store) {
        this.store = store;
    }

    @Override
    public TaskEntity save(TaskEntity entity) {
        entity.validate();
        return store.locked(() -> {
            if (store.tasks.containsKey(entity.getId())) {
                throw AppException.conflict("Task already exists: " + entity.getId());
            }
            store.tasks.put(entity.getId(), entity.copy());
            return entity.copy();
        });
    }

    @Override
    public TaskEntity findById(String id) {
        return store.locked(() -> {
            TaskEntity task = store.tasks.get(id);
            return task == null ? null : task.copy();
        });
    }

    @Override
    public boolean existsById(String id) {
        return store.locked(() -> store.tasks.containsKey(id));
    }

    @Override
    public List<TaskEntity> findByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return new ArrayList<>();
        }
        return select(task -> ids.contains(task.getId()), false);
    }

    @Override
    public List<TaskEntity> findAll() {
        return select(task -> true, true);
    }

    @Override
    public List<TaskEntity> findByRepoId(String repoId) {
        return select(task -> repoId.equals(task.getRepoId()), true);
    }

    @Override
    public List<TaskEntity> findByStatus(TaskStatusEnum status) {
        return select(task -> task.getStatus() == status, false);
    }

    @Override
    public List<TaskEntity> findClaimCandidates(List<String> repoIds) {
        boolean anyRepo = repoIds == null || repoIds.isEmpty();
        return select(task -> task.isClaimable() && (anyRepo || repoIds.contains(task.getRepoId())), false);
    }

    @Override
    public List<TaskEntity> findInReviewWithoutPullRequest() {
        return select(task -> task.getStatus() == TaskStatusEnum.REVIEW
                && StringUtils.isNotEmpty(task.getBranchName())
                && task.getPrNumber() == 0, false);
    }

    @Override
    public List<TaskEntity> findStaleRunning(LocalDateTime cutoff) {
        return store.locked(() -> InMemoryDataStore.sorted(store.tasks.values().stream()
                        .filter(task -> isStale(task, cutoff))
                        .map(TaskEntity::copy)
                        .collect(Collectors.toList()), TaskEntity::getLastHeartbeatAt, TaskEntity::getId, false));
    }

    @Override
    public boolean hasTasksForRepo(String repoId) {
        return store.locked(() -> store.tasks.values().stream().anyMatch(task -> repoId.equals(task.getRepoId())));
    }

    @Override
    public boolean claim(String id, LocalDateTime now) {
        return update(id, TaskEntity::isClaimable, task -> {
            task.setStatus(TaskStatusEnum.RUNNING);
            task.setStartedAt(now);
            task.setLastHeartbeatAt(now);
        }, now);
    }

    @Override
    public boolean heartbeat(String id, LocalDateTime now) {
        return update(id, inStatus(TaskStatusEnum.RUNNING), task -> task.setLastHeartbeatAt(now), now);
    }

    @Override
    public boolean transition(String id, TaskStatusEnum from, TaskStatusEnum to, LocalDateTime now) {
        return update(id, inStatus(from), task -> task.setStatus(to), now);
    }

    @Override
    public boolean fail(String id, TaskStatusEnum from, String reason, LocalDateTime now) {
        return update(id, inStatus(from), task -> {
            task.setStatus(TaskStatusEnum.FAILED);
            task.setCloseReason(reason);
        }, now);
    }

    @Override
    public boolean retryFromReview(String id, String reason, String category, int consecutiveFailures, LocalDateTime now) {
        return update(id, inStatus(TaskStatusEnum.REVIEW), task -> {
            requeue(task, reason);
            task.setRetryCategory(category);
            task.setConsecutiveFailures(consecutiveFailures);
        }, now);
    }

    @Override
    public boolean retryFromRunning(String id, String reason, int consecutiveFailures, LocalDateTime now) {
        return update(id, inStatus(TaskStatusEnum.RUNNING), task -> {
            requeue(task, reason);
            task.setConsecutiveFailures(consecutiveFailures);
        }, now);
    }

    @Override
    public boolean requeueStale(String id, String reason, LocalDateTime cutoff, LocalDateTime now) {
        return update(id, task -> isStale(task, cutoff), task -> requeue(task, reason), now);
    }

    @Override
    public boolean manualRetry(String id, String instructions, LocalDateTime now) {
        return update(id, inStatus(TaskStatusEnum.REVIEW), task -> {
            requeue(task, instructions);
            resetFailureState(task);
        }, now);
    }

    @Override
    public boolean feedbackRetry(String id, String feedback, LocalDateTime now) {
        return update(id, inStatus(TaskStatusEnum.REVIEW), task -> {
            requeue(task, feedback);
            task.setAttempt(1);
            resetFailureState(task);
        }, now);
    }

    @Override
    public boolean startOver(String id, TaskStartOverCommand command, LocalDateTime now) {
        return update(id, inStatus(TaskStatusEnum.REVIEW).or(inStatus(TaskStatusEnum.FAILED)), task -> {
            task.setStatus(TaskStatusEnum.PENDING);
            task.setAttempt(1);
            if (command.getTitle() != null) {
                task.setTitle(command.getTitle());
            }
            if (command.getDescription() != null) {
                task.setDescription(command.getDescription());
            }
            if (command.getAcceptanceCriteria() != null) {
                task.setAcceptanceCriteria(new ArrayList<>(command.getAcceptanceCriteria()));
            }
            task.setRetryReason(null);
            task.setRetryContext(null);
            task.setRetryCategory(null);
            task.setAgentStatus(null);
            task.setConsecutiveFailures(0);
            task.setCostUsd(BigDecimal.ZERO);
            task.setBranchName(null);
            task.setPullRequestUrl(null);
            task.setPrNumber(0);
            task.setCloseReason(null);
            task.setStartedAt(null);
            task.setLastHeartbeatAt(null);
        }, now);
    }

    @Override
    public boolean updatePending(String id, TaskEditCommand command, LocalDateTime now) {
        return update(id, inStatus(TaskStatusEnum.PENDING), task -> {
            if (command.getTitle() != null) {
                task.setTitle(command.getTitle());
            }
            if (command.getDescription() != null) {
                task.setDescription(command.getDescription());
            }
            if (command.getAcceptanceCriteria() != null) {
                task.setAcceptanceCriteria(new ArrayList<>(command.getAcceptanceCriteria()));
            }
            if (command.getDependsOn() != null) {
                task.setDependsOn(new ArrayList<>(command.getDependsOn()));
            }
            if (command.getMaxAttempts() != null) {
                task.setMaxAttempts(command.getMaxAttempts());
            }
            if (command.getMaxCostUsd() != null) {
                task.setMaxCostUsd(command.getMaxCostUsd());
            }
            if (command.getSkipPr() != null) {
                task.setSkipPr(command.getSkipPr());
            }
            if (command.getModel() != null) {
                task.setModel(command.getModel());
            }
            if (command.getReady() != null) {
                task.setReady(command.getReady());
            }
        }, now);
    }

    @Override
    public boolean close(String id, String reason, LocalDateTime now) {
        return update(id, task -> !task.getStatus().isTerminal(), task -> {
            task.setStatus(TaskStatusEnum.CLOSED);
            task.setCloseReason(reason);
        }, now);
    }

    @Override
    public boolean setPullRequest(String id, String pullRequestUrl, int prNumber, LocalDateTime now) {
        return update(id, inStatus(TaskStatusEnum.RUNNING).or(inStatus(TaskStatusEnum.REVIEW)), task -> {
            task.setPullRequestUrl(pullRequestUrl);
            task.setPrNumber(prNumber);
            task.setStatus(TaskStatusEnum.REVIEW);
        }, now);
    }

    @Override
    public boolean setBranch(String id, String branchName, LocalDateTime now) {
        return update(id, inStatus(TaskStatusEnum.RUNNING).or(inStatus(TaskStatusEnum.REVIEW)), task -> {
            if (task.getBranchName() == null) {
                task.setBranchName(branchName);
            }
            task.setStatus(TaskStatusEnum.REVIEW);
        }, now);
    }

    @Override
    public boolean setAgentStatus(String id, String agentStatus, LocalDateTime now) {
        return update(id, task -> true, task -> task.setAgentStatus(agentStatus), now);
    }

    @Override
    public boolean setRetryContext(String id, String retryContext, LocalDateTime now) {
        return update(id, task -> true, task -> task.setRetryContext(retryContext), now);
    }

    @Override
    public boolean addCost(String id, BigDecimal costUsd, LocalDateTime now) {
        return update(id, task -> true, task -> task.setCostUsd(task.getCostUsd().add(costUsd)), now);
    }

    @Override
    public boolean setCloseReason(String id, String reason, LocalDateTime now) {
        return update(id, task -> true, task -> task.setCloseReason(reason), now);
    }

    @Override
    public boolean setReady(String id, boolean ready, LocalDateTime now) {
        return update(id, task -> true, task -> task.setReady(ready), now);
    }

    @Override
    public boolean removeDependency(String id, String dependencyId, LocalDateTime now) {
        return update(id, task -> true, task -> task.getDependsOn().removeIf(dependencyId::equals), now);
    }

    @Override
    public void appendLogs(String id, int attempt, List<String> lines, LocalDateTime now) {
        if (lines == null || lines.isEmpty()) {
            return;
        }
        store.lockedRun(() -> {
            TaskLogEntity batch = TaskLogEntity.create(id, attempt, lines, now);
            batch.setId(store.nextLogId());
            store.taskLogs.computeIfAbsent(id, key -> new ArrayList<>()).add(batch);
        });
    }

    @Override
    public List<String> findLogs(String id) {
        List<String> lines = new ArrayList<>();
        for (TaskLogEntity batch : findLogBatches(id)) {
            lines.addAll(batch.getLines());
        }
        return lines;
    }

    @Override
    public List<TaskLogEntity> findLogBatches(String id) {
        return store.locked(() -> store.taskLogs.getOrDefault(id, new ArrayList<>()).stream()
                .map(batch -> {
                    TaskLogEntity copy = TaskLogEntity.create(batch.getTaskId(), batch.getAttempt(),
                            batch.getLines(), batch.getCreatedAt());
                    copy.setId(batch.getId());
                    return copy;
                })
                .collect(Collectors.toList()));
    }

    @Override
    public void deleteLogs(String id) {
        store.lockedRun(() -> store.taskLogs.remove(id));
    }

    private List<TaskEntity> select(Predicate<TaskEntity> filter, boolean newestFirst) {
        return store.locked(() -> InMemoryDataStore.sorted(store.tasks.values().stream()
                .filter(filter)
                .map(TaskEntity::copy)
                .collect(Collectors.toList()), TaskEntity::getCreatedAt, TaskEntity::getId, newestFirst));
    }

    private boolean update(String id, Predicate<TaskEntity> precondition, Consumer<TaskEntity> mutation,
                           LocalDateTime now) {
        return store.locked(() -> {
            TaskEntity task = store.tasks.get(id);
            if (task == null || !precondition.test(task)) {
                return false;
            }
            mutation.accept(task);
            task.setUpdatedAt(now);
            return true;
        });
    }

    private static Predicate<TaskEntity> inStatus(TaskStatusEnum status) {
        return task -> task.getStatus() == status;
    }

    private static boolean isStale(TaskEntity task, LocalDateTime cutoff) {
        return task.getStatus() == TaskStatusEnum.RUNNING
                && task.getLastHeartbeatAt() != null
                && task.getLastHeartbeatAt().isBefore(cutoff);
    }

    private static void requeue(TaskEntity task, String reason) {
        task.setStatus(TaskStatusEnum.PENDING);
        task.setAttempt(task.getAttempt() + 1);
        task.setRetryReason(reason);
        task.setLastHeartbeatAt(null);
    }

    private static void resetFailureState(TaskEntity task) {
        task.setRetryCategory(null);
        task.setConsecutiveFailures(0);
        task.setCloseReason(null);
    }
}
