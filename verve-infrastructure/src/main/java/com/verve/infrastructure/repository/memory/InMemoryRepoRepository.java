package com.verve.infrastructure.repository.memory;

import com.verve.domain.repo.adapter.repository.IRepoRepository;
import com.verve.domain.repo.model.entity.RepoEntity;
import com.verve.types.exception.AppException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 仓库登记内存实现。
 */
@Repository
@ConditionalOnProperty(name = "verve.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemoryRepoRepository implements IRepoRepository {

    private final InMemoryDataStore store;

    public InMemoryRepoRepository(InMemoryDataStore store) {
        this.store = store;
    }

    @Override
    public RepoEntity save(RepoEntity entity) {
        return store.locked(() -> {
            boolean duplicate = store.repos.containsKey(entity.getId()) || store.repos.values().stream()
                    .anyMatch(repo -> repo.getFullName().equals(entity.getFullName()));
            if (duplicate) {
                throw AppException.conflict("Repo already exists: " + entity.getFullName());
            }
            store.repos.put(entity.getId(), copy(entity));
            return copy(entity);
        });
    }

    @Override
    public RepoEntity findById(String id) {
        return store.locked(() -> {
            RepoEntity repo = store.repos.get(id);
            return repo == null ? null : copy(repo);
        });
    }

    @Override
    public RepoEntity findByFullName(String fullName) {
        return store.locked(() -> store.repos.values().stream()
                .filter(repo -> repo.getFullName().equals(fullName))
                .findFirst()
                .map(InMemoryRepoRepository::copy)
                .orElse(null));
    }

    @Override
    public List<RepoEntity> findAll() {
        return store.locked(() -> store.repos.values().stream()
                .sorted((left, right) -> left.getFullName().compareTo(right.getFullName()))
                .map(InMemoryRepoRepository::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public boolean deleteById(String id) {
        return store.locked(() -> store.repos.remove(id) != null);
    }

    private static RepoEntity copy(RepoEntity source) {
        RepoEntity copy = new RepoEntity();
        copy.setId(source.getId());
        copy.setOwner(source.getOwner());
        copy.setName(source.getName());
        copy.setFullName(source.getFullName());
        copy.setCreatedAt(source.getCreatedAt());
        return copy;
    }
}
