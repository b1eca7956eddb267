package com.verve.trigger.application.command;

import com.google.common.cache.Cache;
import com.verve.domain.setting.adapter.repository.ISettingRepository;
import com.verve.domain.setting.model.entity.SettingEntity;
import com.verve.trigger.application.common.StoreTimeoutRetrier;
import com.verve.types.common.Constants;
import com.verve.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 设置项读写用例，读路径经 Guava 本地缓存，写入后立即失效。
 *
 * @author verve
 * @since 2025-06-02
 */
@Slf4j
@Service
public class SettingCommandService {

    private final ISettingRepository settingRepository;
    private final Cache<String, String> settingCache;
    private final StoreTimeoutRetrier retrier;

    public SettingCommandService(ISettingRepository settingRepository,
                                 @Qualifier("settingCache") Cache<String, String> settingCache,
                                 StoreTimeoutRetrier retrier) {
        this.settingRepository = settingRepository;
        this.settingCache = settingCache;
        this.retrier = retrier;
    }

    /**
     * 读取设置值，不存在返回 null（缺失值不进缓存）。
     */
    public String getValue(String key) {
        String cached = settingCache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }
        SettingEntity setting = retrier.call("read setting", () -> settingRepository.findByKey(key));
        if (setting == null || setting.getValue() == null) {
            return null;
        }
        settingCache.put(key, setting.getValue());
        return setting.getValue();
    }

    /**
     * 新任务与 Epic 的默认模型：设置项优先，否则回落到内置默认值。
     */
    public String defaultModel() {
        return StringUtils.defaultIfBlank(getValue(Constants.SETTING_DEFAULT_MODEL), Constants.FALLBACK_MODEL);
    }

    /**
     * 列出普通设置，加密存储的凭据不对外暴露。
     */
    public List<SettingEntity> listSettings() {
        return retrier.call("list settings", settingRepository::findAll).stream()
                .filter(setting -> !Constants.SETTING_CODE_HOST_TOKEN.equals(setting.getKey()))
                .collect(Collectors.toList());
    }

    public SettingEntity putSetting(String key, String value) {
        if (StringUtils.isBlank(key)) {
            throw AppException.illegalParameter("Setting key is required");
        }
        if (Constants.SETTING_CODE_HOST_TOKEN.equals(key)) {
            throw AppException.illegalParameter("Use the code host token endpoint to store credentials");
        }
        SettingEntity setting = new SettingEntity();
        setting.setKey(key.trim());
        setting.setValue(StringUtils.defaultString(value));
        setting.setUpdatedAt(LocalDateTime.now());
        writeRaw(setting);
        log.info("Setting updated. key={}", setting.getKey());
        return setting;
    }

    /**
     * 写入已处理过的值（如加密后的凭据），不做 key 校验。
     */
    void writeRaw(SettingEntity setting) {
        retrier.run("write setting", () -> settingRepository.upsert(setting));
        settingCache.invalidate(setting.getKey());
    }
}
