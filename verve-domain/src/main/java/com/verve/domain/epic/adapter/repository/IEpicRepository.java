package com.verve.domain.epic.adapter.repository;

import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.epic.model.valobj.ProposedTask;
import com.verve.types.enums.EpicFeedbackTypeEnum;
import com.verve.types.enums.EpicStatusEnum;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Epic 仓储接口，boolean 返回值语义同 ITaskRepository。
 *
 * @author verve
 * @since 2025-06-02
 */
public interface IEpicRepository {

    EpicEntity save(EpicEntity entity);

    EpicEntity findById(String id);

    List<EpicEntity> findAll();

    List<EpicEntity> findByRepoId(String repoId);

    List<EpicEntity> findByStatus(EpicStatusEnum status);

    /**
     * planning 且未被领取，按创建时间升序；Postgres 实现同样只锁定返回首行
     */
    List<EpicEntity> findClaimCandidates();

    /**
     * 已被领取（planning/draft）且心跳早于 cutoff
     */
    List<EpicEntity> findStaleClaimed(LocalDateTime cutoff);

    /**
     * planning ∧ claimed_at IS NULL → 写入 claim
     */
    boolean claim(String id, LocalDateTime now);

    /**
     * 仅已领取的 epic 可续约
     */
    boolean heartbeat(String id, LocalDateTime now);

    /**
     * 清除 claim 并回到 planning
     */
    boolean releaseClaim(String id, LocalDateTime now);

    /**
     * 仅当仍被领取、仍处于 planning/draft 且心跳早于 cutoff 时释放
     */
    boolean releaseStaleClaim(String id, LocalDateTime cutoff, LocalDateTime now);

    /**
     * 写入信箱；status 非 null 时同时变更状态
     */
    boolean setFeedback(String id, String feedback, EpicFeedbackTypeEnum type, EpicStatusEnum status, LocalDateTime now);

    /**
     * 仅当信箱内容仍为读取时的值才清空
     */
    boolean clearFeedback(String id, String expectedFeedback, EpicFeedbackTypeEnum expectedType, LocalDateTime now);

    /**
     * 写入拟定任务并进入 draft
     */
    boolean updateProposedTasks(String id, List<ProposedTask> proposedTasks, LocalDateTime now);

    boolean appendSessionLog(String id, List<String> lines, LocalDateTime now);

    /**
     * draft/ready → planning
     */
    boolean startPlanning(String id, String planningPrompt, LocalDateTime now);

    /**
     * draft/ready → active/ready，写入 task_ids 并投递 confirmed 信号
     */
    boolean confirm(String id, List<String> taskIds, boolean notReady, LocalDateTime now);

    /**
     * 非 closed → closed，并投递 closed 信号
     */
    boolean close(String id, LocalDateTime now);

    /**
     * active → completed
     */
    boolean complete(String id, LocalDateTime now);

    /**
     * 仅删除 draft 状态的 epic
     */
    boolean deleteDraft(String id);
}
