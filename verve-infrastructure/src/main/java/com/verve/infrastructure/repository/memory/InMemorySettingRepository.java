package com.verve.infrastructure.repository.memory;

import com.verve.domain.setting.adapter.repository.ISettingRepository;
import com.verve.domain.setting.model.entity.SettingEntity;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 设置项内存实现。
 */
@Repository
@ConditionalOnProperty(name = "verve.store.type", havingValue = "memory", matchIfMissing = true)
public class InMemorySettingRepository implements ISettingRepository {

    private final InMemoryDataStore store;

    public InMemorySettingRepository(InMemoryDataStore store) {
        this.store = store;
    }

    @Override
    public SettingEntity findByKey(String key) {
        return store.locked(() -> {
            SettingEntity setting = store.settings.get(key);
            return setting == null ? null : copy(setting);
        });
    }

    @Override
    public List<SettingEntity> findAll() {
        return store.locked(() -> store.settings.values().stream()
                .sorted((left, right) -> left.getKey().compareTo(right.getKey()))
                .map(InMemorySettingRepository::copy)
                .collect(Collectors.toList()));
    }

    @Override
    public void upsert(SettingEntity entity) {
        store.lockedRun(() -> store.settings.put(entity.getKey(), copy(entity)));
    }

    @Override
    public boolean deleteByKey(String key) {
        return store.locked(() -> store.settings.remove(key) != null);
    }

    private static SettingEntity copy(SettingEntity source) {
        SettingEntity copy = new SettingEntity();
        copy.setKey(source.getKey());
        copy.setValue(source.getValue());
        copy.setUpdatedAt(source.getUpdatedAt());
        return copy;
    }
}
