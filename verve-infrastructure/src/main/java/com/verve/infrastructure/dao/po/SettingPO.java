package com.verve.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 设置项 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SettingPO {

    private String settingKey;
    private String settingValue;
    private LocalDateTime updatedAt;
}
