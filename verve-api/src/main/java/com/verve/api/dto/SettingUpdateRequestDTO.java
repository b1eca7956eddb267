package com.verve.api.dto;

import lombok.Data;

/**
 * 写设置项请求 DTO
 */
@Data
public class SettingUpdateRequestDTO {

    private String value;
}
