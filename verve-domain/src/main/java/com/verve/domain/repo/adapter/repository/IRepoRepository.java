package com.verve.domain.repo.adapter.repository;

import com.verve.domain.repo.model.entity.RepoEntity;

import java.util.List;

/**
 * 仓库仓储接口
 */
public interface IRepoRepository {

    /**
     * 保存仓库，full_name 重复时抛出 CONFLICT
     */
    RepoEntity save(RepoEntity entity);

    RepoEntity findById(String id);

    RepoEntity findByFullName(String fullName);

    List<RepoEntity> findAll();

    boolean deleteById(String id);
}
