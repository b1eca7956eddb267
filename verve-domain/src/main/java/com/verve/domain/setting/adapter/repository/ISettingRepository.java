package com.verve.domain.setting.adapter.repository;

import com.verve.domain.setting.model.entity.SettingEntity;

import java.util.List;

/**
 * 设置仓储接口
 */
public interface ISettingRepository {

    SettingEntity findByKey(String key);

    List<SettingEntity> findAll();

    /**
     * 写入或覆盖
     */
    void upsert(SettingEntity entity);

    boolean deleteByKey(String key);
}
