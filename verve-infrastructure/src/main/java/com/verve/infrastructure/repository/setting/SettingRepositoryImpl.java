package com.verve.infrastructure.repository.setting;

import com.verve.domain.setting.adapter.repository.ISettingRepository;
import com.verve.domain.setting.model.entity.SettingEntity;
import com.verve.infrastructure.dao.SettingDao;
import com.verve.infrastructure.dao.po.SettingPO;
import com.verve.infrastructure.persistence.StoreErrorTranslator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 设置项 PostgreSQL 实现。
 *
 * @author verve
 * @since 2025-06-02
 */
@Repository
@ConditionalOnProperty(name = "verve.store.type", havingValue = "postgres")
public class SettingRepositoryImpl implements ISettingRepository {

    private final SettingDao settingDao;

    public SettingRepositoryImpl(SettingDao settingDao) {
        this.settingDao = settingDao;
    }

    @Override
    public SettingEntity findByKey(String key) {
        SettingPO po = StoreErrorTranslator.call("read setting " + key, () -> settingDao.selectByKey(key));
        return po != null ? toEntity(po) : null;
    }

    @Override
    public List<SettingEntity> findAll() {
        return StoreErrorTranslator.call("list settings", settingDao::selectAll).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public void upsert(SettingEntity entity) {
        SettingPO po = SettingPO.builder()
                .settingKey(entity.getKey())
                .settingValue(entity.getValue())
                .updatedAt(entity.getUpdatedAt())
                .build();
        StoreErrorTranslator.update("write setting " + entity.getKey(), () -> settingDao.upsert(po));
    }

    @Override
    public boolean deleteByKey(String key) {
        return StoreErrorTranslator.update("delete setting " + key, () -> settingDao.deleteByKey(key)) > 0;
    }

    private SettingEntity toEntity(SettingPO po) {
        SettingEntity entity = new SettingEntity();
        entity.setKey(po.getSettingKey());
        entity.setValue(po.getSettingValue());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }
}
