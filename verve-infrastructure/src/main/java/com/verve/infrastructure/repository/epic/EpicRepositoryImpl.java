package com.verve.infrastructure.repository.epic;

import com.verve.domain.epic.adapter.repository.IEpicRepository;
import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.epic.model.valobj.ProposedTask;
import com.verve.infrastructure.dao.EpicDao;
import com.verve.infrastructure.dao.po.EpicPO;
import com.verve.infrastructure.persistence.StoreErrorTranslator;
import com.verve.infrastructure.util.JsonCodec;
import com.verve.types.enums.EpicFeedbackTypeEnum;
import com.verve.types.enums.EpicStatusEnum;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Epic 仓储 PostgreSQL 实现。
 *
 * @author verve
 * @since 2025-06-02
 */
@Repository
@ConditionalOnProperty(name = "verve.store.type", havingValue = "postgres")
public class EpicRepositoryImpl implements IEpicRepository {

    private final EpicDao epicDao;
    private final JsonCodec jsonCodec;

    public EpicRepositoryImpl(EpicDao epicDao, JsonCodec jsonCodec) {
        this.epicDao = epicDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public EpicEntity save(EpicEntity entity) {
        entity.validate();
        EpicPO po = toPO(entity);
        StoreErrorTranslator.update("insert epic " + entity.getId(), () -> epicDao.insert(po));
        return toEntity(po);
    }

    @Override
    public EpicEntity findById(String id) {
        EpicPO po = StoreErrorTranslator.call("read epic " + id, () -> epicDao.selectById(id));
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<EpicEntity> findAll() {
        return toEntities(StoreErrorTranslator.call("list epics", epicDao::selectAll));
    }

    @Override
    public List<EpicEntity> findByRepoId(String repoId) {
        return toEntities(StoreErrorTranslator.call("list epics", () -> epicDao.selectByRepoId(repoId)));
    }

    @Override
    public List<EpicEntity> findByStatus(EpicStatusEnum status) {
        return toEntities(StoreErrorTranslator.call("list epics", () -> epicDao.selectByStatus(status.getCode())));
    }

    @Override
    public List<EpicEntity> findClaimCandidates() {
        return toEntities(StoreErrorTranslator.call("list claimable epics", epicDao::selectClaimCandidates));
    }

    @Override
    public List<EpicEntity> findStaleClaimed(LocalDateTime cutoff) {
        return toEntities(StoreErrorTranslator.call("list stale epics", () -> epicDao.selectStaleClaimed(cutoff)));
    }

    @Override
    public boolean claim(String id, LocalDateTime now) {
        return StoreErrorTranslator.update("claim epic " + id, () -> epicDao.claim(id, now)) > 0;
    }

    @Override
    public boolean heartbeat(String id, LocalDateTime now) {
        return StoreErrorTranslator.update("heartbeat epic " + id, () -> epicDao.heartbeat(id, now)) > 0;
    }

    @Override
    public boolean releaseClaim(String id, LocalDateTime now) {
        return StoreErrorTranslator.update("release epic " + id, () -> epicDao.releaseClaim(id, now)) > 0;
    }

    @Override
    public boolean releaseStaleClaim(String id, LocalDateTime cutoff, LocalDateTime now) {
        return StoreErrorTranslator.update("release stale epic " + id,
                () -> epicDao.releaseStaleClaim(id, cutoff, now)) > 0;
    }

    @Override
    public boolean setFeedback(String id, String feedback, EpicFeedbackTypeEnum type, EpicStatusEnum status,
                               LocalDateTime now) {
        String statusCode = status == null ? null : status.getCode();
        return StoreErrorTranslator.update("set epic feedback " + id,
                () -> epicDao.setFeedback(id, feedback, type.getCode(), statusCode, now)) > 0;
    }

    @Override
    public boolean clearFeedback(String id, String expectedFeedback, EpicFeedbackTypeEnum expectedType,
                                 LocalDateTime now) {
        return StoreErrorTranslator.update("clear epic feedback " + id,
                () -> epicDao.clearFeedback(id, expectedFeedback, expectedType.getCode(), now)) > 0;
    }

    @Override
    public boolean updateProposedTasks(String id, List<ProposedTask> proposedTasks, LocalDateTime now) {
        String json = jsonCodec.writeList(proposedTasks);
        return StoreErrorTranslator.update("update proposed tasks " + id,
                () -> epicDao.updateProposedTasks(id, json, now)) > 0;
    }

    @Override
    public boolean appendSessionLog(String id, List<String> lines, LocalDateTime now) {
        String json = jsonCodec.writeList(lines);
        return StoreErrorTranslator.update("append session log " + id, () -> epicDao.appendSessionLog(id, json, now)) > 0;
    }

    @Override
    public boolean startPlanning(String id, String planningPrompt, LocalDateTime now) {
        return StoreErrorTranslator.update("start planning " + id, () -> epicDao.startPlanning(id, planningPrompt, now)) > 0;
    }

    @Override
    public boolean confirm(String id, List<String> taskIds, boolean notReady, LocalDateTime now) {
        String json = jsonCodec.writeList(taskIds);
        String status = notReady ? EpicStatusEnum.READY.getCode() : EpicStatusEnum.ACTIVE.getCode();
        return StoreErrorTranslator.update("confirm epic " + id, () -> epicDao.confirm(id, json, status, notReady, now)) > 0;
    }

    @Override
    public boolean close(String id, LocalDateTime now) {
        return StoreErrorTranslator.update("close epic " + id, () -> epicDao.close(id, now)) > 0;
    }

    @Override
    public boolean complete(String id, LocalDateTime now) {
        return StoreErrorTranslator.update("complete epic " + id, () -> epicDao.complete(id, now)) > 0;
    }

    @Override
    public boolean deleteDraft(String id) {
        return StoreErrorTranslator.update("delete epic " + id, () -> epicDao.deleteDraft(id)) > 0;
    }

    private List<EpicEntity> toEntities(List<EpicPO> pos) {
        return pos.stream().map(this::toEntity).collect(Collectors.toList());
    }

    private EpicEntity toEntity(EpicPO po) {
        EpicEntity entity = new EpicEntity();
        entity.setId(po.getId());
        entity.setRepoId(po.getRepoId());
        entity.setTitle(po.getTitle());
        entity.setDescription(po.getDescription());
        entity.setStatus(EpicStatusEnum.fromCode(po.getStatus()));
        entity.setPlanningPrompt(po.getPlanningPrompt());
        entity.setModel(po.getModel());
        entity.setProposedTasks(jsonCodec.readProposedTasks(po.getProposedTasks()));
        entity.setTaskIds(jsonCodec.readStringList(po.getTaskIds()));
        entity.setSessionLog(jsonCodec.readStringList(po.getSessionLog()));
        entity.setNotReady(Boolean.TRUE.equals(po.getNotReady()));
        entity.setClaimedAt(po.getClaimedAt());
        entity.setLastHeartbeatAt(po.getLastHeartbeatAt());
        entity.setFeedback(po.getFeedback());
        entity.setFeedbackType(po.getFeedbackType() == null ? null : EpicFeedbackTypeEnum.fromCode(po.getFeedbackType()));
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private EpicPO toPO(EpicEntity entity) {
        return EpicPO.builder()
                .id(entity.getId())
                .repoId(entity.getRepoId())
                .title(entity.getTitle())
                .description(entity.getDescription())
                .status(entity.getStatus().getCode())
                .planningPrompt(entity.getPlanningPrompt())
                .model(entity.getModel())
                .proposedTasks(jsonCodec.writeList(entity.getProposedTasks()))
                .taskIds(jsonCodec.writeList(entity.getTaskIds()))
                .sessionLog(jsonCodec.writeList(entity.getSessionLog()))
                .notReady(entity.isNotReady())
                .claimedAt(entity.getClaimedAt())
                .lastHeartbeatAt(entity.getLastHeartbeatAt())
                .feedback(entity.getFeedback())
                .feedbackType(entity.getFeedbackType() == null ? null : entity.getFeedbackType().getCode())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
