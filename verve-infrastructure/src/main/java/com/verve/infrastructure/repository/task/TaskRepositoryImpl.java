package com.verve.infrastructure.repository.task;

import com.verve.domain.task.adapter.repository.ITaskRepository;
import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.task.model.entity.TaskLogEntity;
import com.verve.domain.task.model.valobj.TaskEditCommand;
import com.verve.domain.task.model.valobj.TaskStartOverCommand;
import com.verve.infrastructure.dao.TaskDao;
import com.verve.infrastructure.dao.TaskLogDao;
import com.verve.infrastructure.dao.po.TaskLogPO;
import com.verve.infrastructure.dao.po.TaskPO;
import com.verve.infrastructure.persistence.StoreErrorTranslator;
import com.verve.infrastructure.util.JsonCodec;
import com.verve.types.enums.TaskStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 任务仓储 PostgreSQL 实现。
 * <p>
 * 所有状态迁移都是单条带前置条件的 UPDATE，影响行数为 0 即返回 false；
 * 列表字段以 JSONB 存储，读写经 {@link JsonCodec}。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "verve.store.type", havingValue = "postgres")
public class TaskRepositoryImpl implements ITaskRepository {

    private final TaskDao taskDao;
    private final TaskLogDao taskLogDao;
    private final JsonCodec jsonCodec;

    public TaskRepositoryImpl(TaskDao taskDao, TaskLogDao taskLogDao, JsonCodec jsonCodec) {
        this.taskDao = taskDao;
        this.taskLogDao = taskLogDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public TaskEntity save(TaskEntity entity) {
        entity.validate();
        TaskPO po = toPO(entity);
        StoreErrorTranslator.update("insert task " + entity.getId(), () -> taskDao.insert(po));
        return toEntity(po);
    }

    @Override
    public TaskEntity findById(String id) {
        TaskPO po = StoreErrorTranslator.call("read task " + id, () -> taskDao.selectById(id));
        return po != null ? toEntity(po) : null;
    }

    @Override
    public boolean existsById(String id) {
        return StoreErrorTranslator.update("read task " + id, () -> taskDao.countById(id)) > 0;
    }

    @Override
    public List<TaskEntity> findByIds(Collection<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return new ArrayList<>();
        }
        return toEntities(StoreErrorTranslator.call("read tasks", () -> taskDao.selectByIds(ids)));
    }

    @Override
    public List<TaskEntity> findAll() {
        return toEntities(StoreErrorTranslator.call("list tasks", taskDao::selectAll));
    }

    @Override
    public List<TaskEntity> findByRepoId(String repoId) {
        return toEntities(StoreErrorTranslator.call("list tasks", () -> taskDao.selectByRepoId(repoId)));
    }

    @Override
    public List<TaskEntity> findByStatus(TaskStatusEnum status) {
        return toEntities(StoreErrorTranslator.call("list tasks", () -> taskDao.selectByStatus(status.getCode())));
    }

    @Override
    public List<TaskEntity> findClaimCandidates(List<String> repoIds) {
        return toEntities(StoreErrorTranslator.call("list claimable tasks", () -> taskDao.selectClaimCandidates(repoIds)));
    }

    @Override
    public List<TaskEntity> findInReviewWithoutPullRequest() {
        return toEntities(StoreErrorTranslator.call("list review tasks", taskDao::selectInReviewWithoutPullRequest));
    }

    @Override
    public List<TaskEntity> findStaleRunning(LocalDateTime cutoff) {
        return toEntities(StoreErrorTranslator.call("list stale tasks", () -> taskDao.selectStaleRunning(cutoff)));
    }

    @Override
    public boolean hasTasksForRepo(String repoId) {
        return StoreErrorTranslator.update("count tasks", () -> taskDao.countByRepoId(repoId)) > 0;
    }

    @Override
    public boolean claim(String id, LocalDateTime now) {
        return StoreErrorTranslator.update("claim task " + id, () -> taskDao.claim(id, now)) > 0;
    }

    @Override
    public boolean heartbeat(String id, LocalDateTime now) {
        return StoreErrorTranslator.update("heartbeat task " + id, () -> taskDao.heartbeat(id, now)) > 0;
    }

    @Override
    public boolean transition(String id, TaskStatusEnum from, TaskStatusEnum to, LocalDateTime now) {
        return StoreErrorTranslator.update("transition task " + id,
                () -> taskDao.transition(id, from.getCode(), to.getCode(), now)) > 0;
    }

    @Override
    public boolean fail(String id, TaskStatusEnum from, String reason, LocalDateTime now) {
        return StoreErrorTranslator.update("fail task " + id, () -> taskDao.fail(id, from.getCode(), reason, now)) > 0;
    }

    @Override
    public boolean retryFromReview(String id, String reason, String category, int consecutiveFailures, LocalDateTime now) {
        return StoreErrorTranslator.update("retry task " + id,
                () -> taskDao.retryFromReview(id, reason, category, consecutiveFailures, now)) > 0;
    }

    @Override
    public boolean retryFromRunning(String id, String reason, int consecutiveFailures, LocalDateTime now) {
        return StoreErrorTranslator.update("retry task " + id,
                () -> taskDao.retryFromRunning(id, reason, consecutiveFailures, now)) > 0;
    }

    @Override
    public boolean requeueStale(String id, String reason, LocalDateTime cutoff, LocalDateTime now) {
        return StoreErrorTranslator.update("requeue task " + id, () -> taskDao.requeueStale(id, reason, cutoff, now)) > 0;
    }

    @Override
    public boolean manualRetry(String id, String instructions, LocalDateTime now) {
        return StoreErrorTranslator.update("retry task " + id, () -> taskDao.manualRetry(id, instructions, now)) > 0;
    }

    @Override
    public boolean feedbackRetry(String id, String feedback, LocalDateTime now) {
        return StoreErrorTranslator.update("retry task " + id, () -> taskDao.feedbackRetry(id, feedback, now)) > 0;
    }

    @Override
    public boolean startOver(String id, TaskStartOverCommand command, LocalDateTime now) {
        String criteria = command.getAcceptanceCriteria() == null ? null : jsonCodec.writeList(command.getAcceptanceCriteria());
        return StoreErrorTranslator.update("start over task " + id,
                () -> taskDao.startOver(id, command.getTitle(), command.getDescription(), criteria, now)) > 0;
    }

    @Override
    public boolean updatePending(String id, TaskEditCommand command, LocalDateTime now) {
        String criteria = command.getAcceptanceCriteria() == null ? null : jsonCodec.writeList(command.getAcceptanceCriteria());
        String dependsOn = command.getDependsOn() == null ? null : jsonCodec.writeList(command.getDependsOn());
        return StoreErrorTranslator.update("update task " + id,
                () -> taskDao.updatePending(id, command.getTitle(), command.getDescription(), criteria, dependsOn,
                        command.getMaxAttempts(), command.getMaxCostUsd(), command.getSkipPr(), command.getModel(),
                        command.getReady(), now)) > 0;
    }

    @Override
    public boolean close(String id, String reason, LocalDateTime now) {
        return StoreErrorTranslator.update("close task " + id, () -> taskDao.close(id, reason, now)) > 0;
    }

    @Override
    public boolean setPullRequest(String id, String pullRequestUrl, int prNumber, LocalDateTime now) {
        return StoreErrorTranslator.update("set pull request " + id,
                () -> taskDao.setPullRequest(id, pullRequestUrl, prNumber, now)) > 0;
    }

    @Override
    public boolean setBranch(String id, String branchName, LocalDateTime now) {
        return StoreErrorTranslator.update("set branch " + id, () -> taskDao.setBranch(id, branchName, now)) > 0;
    }

    @Override
    public boolean setAgentStatus(String id, String agentStatus, LocalDateTime now) {
        return StoreErrorTranslator.update("set agent status " + id, () -> taskDao.setAgentStatus(id, agentStatus, now)) > 0;
    }

    @Override
    public boolean setRetryContext(String id, String retryContext, LocalDateTime now) {
        return StoreErrorTranslator.update("set retry context " + id, () -> taskDao.setRetryContext(id, retryContext, now)) > 0;
    }

    @Override
    public boolean addCost(String id, BigDecimal costUsd, LocalDateTime now) {
        return StoreErrorTranslator.update("add cost " + id, () -> taskDao.addCost(id, costUsd, now)) > 0;
    }

    @Override
    public boolean setCloseReason(String id, String reason, LocalDateTime now) {
        return StoreErrorTranslator.update("set close reason " + id, () -> taskDao.setCloseReason(id, reason, now)) > 0;
    }

    @Override
    public boolean setReady(String id, boolean ready, LocalDateTime now) {
        return StoreErrorTranslator.update("set ready " + id, () -> taskDao.setReady(id, ready, now)) > 0;
    }

    @Override
    public boolean removeDependency(String id, String dependencyId, LocalDateTime now) {
        return StoreErrorTranslator.update("remove dependency " + id,
                () -> taskDao.removeDependency(id, dependencyId, now)) > 0;
    }

    @Override
    public void appendLogs(String id, int attempt, List<String> lines, LocalDateTime now) {
        if (lines == null || lines.isEmpty()) {
            return;
        }
        TaskLogPO po = TaskLogPO.builder()
                .taskId(id)
                .attempt(attempt)
                .lines(jsonCodec.writeList(lines))
                .createdAt(now)
                .build();
        StoreErrorTranslator.update("append logs " + id, () -> taskLogDao.insert(po));
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
        return StoreErrorTranslator.call("read logs " + id, () -> taskLogDao.selectByTaskId(id)).stream()
                .map(this::toLogEntity)
                .collect(Collectors.toList());
    }

    @Override
    public void deleteLogs(String id) {
        StoreErrorTranslator.update("delete logs " + id, () -> taskLogDao.deleteByTaskId(id));
    }

    private List<TaskEntity> toEntities(List<TaskPO> pos) {
        return pos.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private TaskEntity toEntity(TaskPO po) {
        TaskEntity entity = new TaskEntity();
        entity.setId(po.getId());
        entity.setRepoId(po.getRepoId());
        entity.setEpicId(po.getEpicId());
        entity.setTitle(po.getTitle());
        entity.setDescription(po.getDescription());
        entity.setAcceptanceCriteria(jsonCodec.readStringList(po.getAcceptanceCriteria()));
        entity.setStatus(TaskStatusEnum.fromCode(po.getStatus()));
        entity.setDependsOn(jsonCodec.readStringList(po.getDependsOn()));
        entity.setReady(po.getReady() == null || po.getReady());
        entity.setAttempt(po.getAttempt() == null ? 1 : po.getAttempt());
        entity.setMaxAttempts(po.getMaxAttempts() == null ? 0 : po.getMaxAttempts());
        entity.setRetryReason(po.getRetryReason());
        entity.setRetryContext(po.getRetryContext());
        entity.setRetryCategory(po.getRetryCategory());
        entity.setAgentStatus(po.getAgentStatus());
        entity.setConsecutiveFailures(po.getConsecutiveFailures() == null ? 0 : po.getConsecutiveFailures());
        entity.setCostUsd(po.getCostUsd() == null ? BigDecimal.ZERO : po.getCostUsd());
        entity.setMaxCostUsd(po.getMaxCostUsd() == null ? BigDecimal.ZERO : po.getMaxCostUsd());
        entity.setSkipPr(Boolean.TRUE.equals(po.getSkipPr()));
        entity.setModel(po.getModel());
        entity.setBranchName(po.getBranchName());
        entity.setPullRequestUrl(po.getPullRequestUrl());
        entity.setPrNumber(po.getPrNumber() == null ? 0 : po.getPrNumber());
        entity.setCloseReason(po.getCloseReason());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        entity.setStartedAt(po.getStartedAt());
        entity.setLastHeartbeatAt(po.getLastHeartbeatAt());
        return entity;
    }

    private TaskPO toPO(TaskEntity entity) {
        return TaskPO.builder()
                .id(entity.getId())
                .repoId(entity.getRepoId())
                .epicId(entity.getEpicId())
                .title(entity.getTitle())
                .description(entity.getDescription())
                .acceptanceCriteria(jsonCodec.writeList(entity.getAcceptanceCriteria()))
                .status(entity.getStatus().getCode())
                .dependsOn(jsonCodec.writeList(entity.getDependsOn()))
                .ready(entity.isReady())
                .attempt(entity.getAttempt())
                .maxAttempts(entity.getMaxAttempts())
                .retryReason(entity.getRetryReason())
                .retryContext(entity.getRetryContext())
                .retryCategory(entity.getRetryCategory())
                .agentStatus(entity.getAgentStatus())
                .consecutiveFailures(entity.getConsecutiveFailures())
                .costUsd(entity.getCostUsd())
                .maxCostUsd(entity.getMaxCostUsd())
                .skipPr(entity.isSkipPr())
                .model(entity.getModel())
                .branchName(entity.getBranchName())
                .pullRequestUrl(entity.getPullRequestUrl())
                .prNumber(entity.getPrNumber())
                .closeReason(entity.getCloseReason())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .startedAt(entity.getStartedAt())
                .lastHeartbeatAt(entity.getLastHeartbeatAt())
                .build();
    }

    private TaskLogEntity toLogEntity(TaskLogPO po) {
        TaskLogEntity entity = new TaskLogEntity();
        entity.setId(po.getId());
        entity.setTaskId(po.getTaskId());
        entity.setAttempt(po.getAttempt() == null ? 1 : po.getAttempt());
        entity.setLines(jsonCodec.readStringList(po.getLines()));
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }
}
