package com.verve.infrastructure.repository.memory;

import com.verve.domain.epic.adapter.repository.IEpicRepository;
import com.verve.domain.epic.model.entity.EpicEntity;
import com.verve.domain.epic.model.valobj.ProposedTask;
import com.verve.types.enums.EpicFeedbackTypeEnum;
import com.verve.types.enums.EpicStatusEnum;
import com.verve.types.exception.AppException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Epic 仓储内存实现。
 *
 * @author verve
 * @since 2025-06-02
 */
@Repository
@ConditionalOnProperty(name = "verve.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryEpicRepository implements IEpicRepository {

    private final InMemoryDataStore store;

    public InMemoryEpicRepository(InMemoryDataStore store) {
        this.store = store;
    }

    @Override
    public EpicEntity save(EpicEntity entity) {
        entity.validate();
        return store.locked(() -> {
            if (store.epics.containsKey(entity.getId())) {
                throw AppException.conflict("Epic already exists: " + entity.getId());
            }
            store.epics.put(entity.getId(), entity.copy());
            return entity.copy();
        });
    }

    @Override
    public EpicEntity findById(String id) {
        return store.locked(() -> {
            EpicEntity epic = store.epics.get(id);
            return epic == null ? null : epic.copy();
        });
    }

    @Override
    public List<EpicEntity> findAll() {
        return select(epic -> true, EpicEntity::getCreatedAt, true);
    }

    @Override
    public List<EpicEntity> findByRepoId(String repoId) {
        return select(epic -> repoId.equals(epic.getRepoId()), EpicEntity::getCreatedAt, true);
    }

    @Override
    public List<EpicEntity> findByStatus(EpicStatusEnum status) {
        return select(epic -> epic.getStatus() == status, EpicEntity::getCreatedAt, false);
    }

    @Override
    public List<EpicEntity> findClaimCandidates() {
        return select(EpicEntity::isClaimable, EpicEntity::getCreatedAt, false);
    }

    @Override
    public List<EpicEntity> findStaleClaimed(LocalDateTime cutoff) {
        return select(epic -> isStaleClaim(epic, cutoff), EpicEntity::getLastHeartbeatAt, false);
    }

    @Override
    public boolean claim(String id, LocalDateTime now) {
        return update(id, EpicEntity::isClaimable, epic -> {
            epic.setClaimedAt(now);
            epic.setLastHeartbeatAt(now);
        }, now);
    }

    @Override
    public boolean heartbeat(String id, LocalDateTime now) {
        return update(id, EpicEntity::isClaimed, epic -> epic.setLastHeartbeatAt(now), now);
    }

    @Override
    public boolean releaseClaim(String id, LocalDateTime now) {
        return update(id, epic -> true, epic -> {
            epic.setClaimedAt(null);
            epic.setLastHeartbeatAt(null);
            epic.setStatus(EpicStatusEnum.PLANNING);
        }, now);
    }

    @Override
    public boolean releaseStaleClaim(String id, LocalDateTime cutoff, LocalDateTime now) {
        return update(id, epic -> isStaleClaim(epic, cutoff), epic -> {
            epic.setClaimedAt(null);
            epic.setLastHeartbeatAt(null);
            epic.setStatus(EpicStatusEnum.PLANNING);
        }, now);
    }

    @Override
    public boolean setFeedback(String id, String feedback, EpicFeedbackTypeEnum type, EpicStatusEnum status,
                               LocalDateTime now) {
        return update(id, epic -> true, epic -> {
            epic.setFeedback(feedback);
            epic.setFeedbackType(type);
            if (status != null) {
                epic.setStatus(status);
            }
        }, now);
    }

    @Override
    public boolean clearFeedback(String id, String expectedFeedback, EpicFeedbackTypeEnum expectedType,
                                 LocalDateTime now) {
        return update(id, epic -> epic.getFeedbackType() == expectedType
                && Objects.equals(epic.getFeedback(), expectedFeedback), epic -> {
            epic.setFeedback(null);
            epic.setFeedbackType(null);
        }, now);
    }

    @Override
    public boolean updateProposedTasks(String id, List<ProposedTask> proposedTasks, LocalDateTime now) {
        return update(id, epic -> true, epic -> {
            epic.setProposedTasks(proposedTasks == null ? new ArrayList<>()
                    : proposedTasks.stream().map(ProposedTask::copy).collect(Collectors.toList()));
            epic.setStatus(EpicStatusEnum.DRAFT);
        }, now);
    }

    @Override
    public boolean appendSessionLog(String id, List<String> lines, LocalDateTime now) {
        return update(id, epic -> true, epic -> {
            if (lines != null) {
                epic.getSessionLog().addAll(lines);
            }
        }, now);
    }

    @Override
    public boolean startPlanning(String id, String planningPrompt, LocalDateTime now) {
        return update(id, EpicEntity::isConfirmable, epic -> {
            epic.setPlanningPrompt(planningPrompt);
            epic.setStatus(EpicStatusEnum.PLANNING);
        }, now);
    }

    @Override
    public boolean confirm(String id, List<String> taskIds, boolean notReady, LocalDateTime now) {
        return update(id, EpicEntity::isConfirmable, epic -> {
            epic.setTaskIds(new ArrayList<>(taskIds));
            epic.setStatus(notReady ? EpicStatusEnum.READY : EpicStatusEnum.ACTIVE);
            epic.setNotReady(notReady);
            epic.setFeedback(null);
            epic.setFeedbackType(EpicFeedbackTypeEnum.CONFIRMED);
        }, now);
    }

    @Override
    public boolean close(String id, LocalDateTime now) {
        return update(id, epic -> epic.getStatus() != EpicStatusEnum.CLOSED, epic -> {
            epic.setStatus(EpicStatusEnum.CLOSED);
            epic.setFeedback(null);
            epic.setFeedbackType(EpicFeedbackTypeEnum.CLOSED);
        }, now);
    }

    @Override
    public boolean complete(String id, LocalDateTime now) {
        return update(id, epic -> epic.getStatus() == EpicStatusEnum.ACTIVE,
                epic -> epic.setStatus(EpicStatusEnum.COMPLETED), now);
    }

    @Override
    public boolean deleteDraft(String id) {
        return store.locked(() -> {
            EpicEntity epic = store.epics.get(id);
            if (epic == null || epic.getStatus() != EpicStatusEnum.DRAFT) {
                return false;
            }
            store.epics.remove(id);
            return true;
        });
    }

    private List<EpicEntity> select(Predicate<EpicEntity> filter,
                                    Function<EpicEntity, LocalDateTime> sortKey,
                                    boolean newestFirst) {
        return store.locked(() -> InMemoryDataStore.sorted(store.epics.values().stream()
                .filter(filter)
                .map(EpicEntity::copy)
                .collect(Collectors.toList()), sortKey, EpicEntity::getId, newestFirst));
    }

    private boolean update(String id, Predicate<EpicEntity> precondition, Consumer<EpicEntity> mutation,
                           LocalDateTime now) {
        return store.locked(() -> {
            EpicEntity epic = store.epics.get(id);
            if (epic == null || !precondition.test(epic)) {
                return false;
            }
            mutation.accept(epic);
            epic.setUpdatedAt(now);
            return true;
        });
    }

    private static boolean isStaleClaim(EpicEntity epic, LocalDateTime cutoff) {
        return epic.isClaimed()
                && epic.getLastHeartbeatAt() != null
                && epic.getLastHeartbeatAt().isBefore(cutoff)
                && (epic.getStatus() == EpicStatusEnum.PLANNING || epic.getStatus() == EpicStatusEnum.DRAFT);
    }
}
