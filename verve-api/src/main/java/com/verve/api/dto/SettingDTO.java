package com.verve.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 设置项视图，凭据类设置不返回明文。
 */
@Data
public class SettingDTO {

    private String key;
    private String value;
    private LocalDateTime updatedAt;
}
