package com.verve.infrastructure.repository.repo;

import com.verve.domain.repo.adapter.repository.IRepoRepository;
import com.verve.domain.repo.model.entity.RepoEntity;
import com.verve.infrastructure.dao.RepoDao;
import com.verve.infrastructure.dao.po.RepoPO;
import com.verve.infrastructure.persistence.StoreErrorTranslator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 仓库登记 PostgreSQL 实现，full_name 唯一约束冲突映射为 CONFLICT。
 *
 * @author verve
 * @since 2025-06-02
 */
@Repository
@ConditionalOnProperty(name = "verve.store.type", havingValue = "postgres")
public class RepoRepositoryImpl implements IRepoRepository {

    private final RepoDao repoDao;

    public RepoRepositoryImpl(RepoDao repoDao) {
        this.repoDao = repoDao;
    }

    @Override
    public RepoEntity save(RepoEntity entity) {
        RepoPO po = toPO(entity);
        StoreErrorTranslator.update("insert repo " + entity.getFullName(), () -> repoDao.insert(po));
        return toEntity(po);
    }

    @Override
    public RepoEntity findById(String id) {
        RepoPO po = StoreErrorTranslator.call("read repo " + id, () -> repoDao.selectById(id));
        return po != null ? toEntity(po) : null;
    }

    @Override
    public RepoEntity findByFullName(String fullName) {
        RepoPO po = StoreErrorTranslator.call("read repo " + fullName, () -> repoDao.selectByFullName(fullName));
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<RepoEntity> findAll() {
        return StoreErrorTranslator.call("list repos", repoDao::selectAll).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public boolean deleteById(String id) {
        return StoreErrorTranslator.update("delete repo " + id, () -> repoDao.deleteById(id)) > 0;
    }

    private RepoEntity toEntity(RepoPO po) {
        RepoEntity entity = new RepoEntity();
        entity.setId(po.getId());
        entity.setOwner(po.getOwner());
        entity.setName(po.getName());
        entity.setFullName(po.getFullName());
        entity.setCreatedAt(po.getCreatedAt());
        return entity;
    }

    private RepoPO toPO(RepoEntity entity) {
        return RepoPO.builder()
                .id(entity.getId())
                .owner(entity.getOwner())
                .name(entity.getName())
                .fullName(entity.getFullName())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
