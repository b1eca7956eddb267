package com.verve.domain.setting.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 键值设置项。
 */
@Data
public class SettingEntity {

    private String key;
    private String value;
    private LocalDateTime updatedAt;
}
