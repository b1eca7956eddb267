package com.verve.domain.task.adapter.repository;

import com.verve.domain.task.model.entity.TaskEntity;
import com.verve.domain.task.model.entity.TaskLogEntity;
import com.verve.domain.task.model.valobj.TaskEditCommand;
import com.verve.domain.task.model.valobj.TaskStartOverCommand;
import com.verve.types.enums.TaskStatusEnum;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 任务仓储接口
 * <p>
 * 所有 boolean 返回值的方法都是单语句条件更新：返回 true 表示行存在且前置条件成立并已修改，
 * false 表示前置条件不成立或行不存在，调用方需自行区分。
 * </p>
 *
 * @author verve
 * @since 2025-06-02
 */
public interface ITaskRepository {

    /**
     * 保存新任务，ID 重复时抛出 CONFLICT
     */
    TaskEntity save(TaskEntity entity);

    /**
     * 根据 ID 查询，不存在返回 null
     */
    TaskEntity findById(String id);

    boolean existsById(String id);

    List<TaskEntity> findByIds(Collection<String> ids);

    List<TaskEntity> findAll();

    List<TaskEntity> findByRepoId(String repoId);

    List<TaskEntity> findByStatus(TaskStatusEnum status);

    /**
     * 领取候选池：pending 且 ready，按创建时间升序；repoIds 为空表示不限仓库。
     * Postgres 实现只返回首个未被其他事务锁定的行（FOR UPDATE SKIP LOCKED），须在事务内调用。
     */
    List<TaskEntity> findClaimCandidates(List<String> repoIds);

    /**
     * 有分支但尚未关联 PR 的 review 任务
     */
    List<TaskEntity> findInReviewWithoutPullRequest();

    /**
     * 心跳早于 cutoff 的 running 任务
     */
    List<TaskEntity> findStaleRunning(LocalDateTime cutoff);

    boolean hasTasksForRepo(String repoId);

    /**
     * pending ∧ ready → running
     */
    boolean claim(String id, LocalDateTime now);

    /**
     * 仅 running 任务可续约心跳
     */
    boolean heartbeat(String id, LocalDateTime now);

    boolean transition(String id, TaskStatusEnum from, TaskStatusEnum to, LocalDateTime now);

    /**
     * from → failed，并记录关闭原因
     */
    boolean fail(String id, TaskStatusEnum from, String reason, LocalDateTime now);

    /**
     * review → pending，attempt+1
     */
    boolean retryFromReview(String id, String reason, String category, int consecutiveFailures, LocalDateTime now);

    /**
     * running → pending，attempt+1，保留 PR/分支
     */
    boolean retryFromRunning(String id, String reason, int consecutiveFailures, LocalDateTime now);

    /**
     * running 且心跳早于 cutoff → pending，attempt+1
     */
    boolean requeueStale(String id, String reason, LocalDateTime cutoff, LocalDateTime now);

    /**
     * review → pending，attempt+1，指令作为重试原因，熔断计数清零
     */
    boolean manualRetry(String id, String instructions, LocalDateTime now);

    /**
     * review → pending，attempt 重置为 1，保留 PR/分支
     */
    boolean feedbackRetry(String id, String feedback, LocalDateTime now);

    /**
     * review/failed → pending，完整重置
     */
    boolean startOver(String id, TaskStartOverCommand command, LocalDateTime now);

    /**
     * 仅 pending 任务可编辑
     */
    boolean updatePending(String id, TaskEditCommand command, LocalDateTime now);

    /**
     * 非 merged/closed → closed
     */
    boolean close(String id, String reason, LocalDateTime now);

    /**
     * running/review → review，写入 PR 信息
     */
    boolean setPullRequest(String id, String pullRequestUrl, int prNumber, LocalDateTime now);

    /**
     * running/review → review，分支名一旦写入不再覆盖
     */
    boolean setBranch(String id, String branchName, LocalDateTime now);

    boolean setAgentStatus(String id, String agentStatus, LocalDateTime now);

    boolean setRetryContext(String id, String retryContext, LocalDateTime now);

    boolean addCost(String id, BigDecimal costUsd, LocalDateTime now);

    boolean setCloseReason(String id, String reason, LocalDateTime now);

    boolean setReady(String id, boolean ready, LocalDateTime now);

    /**
     * 移除依赖，幂等；返回任务是否存在
     */
    boolean removeDependency(String id, String dependencyId, LocalDateTime now);

    void appendLogs(String id, int attempt, List<String> lines, LocalDateTime now);

    /**
     * 按追加顺序拼接全部日志行
     */
    List<String> findLogs(String id);

    List<TaskLogEntity> findLogBatches(String id);

    void deleteLogs(String id);
}
