package com.verve.api.dto;

import lombok.Data;

/**
 * 设置 ready 标记请求 DTO
 */
@Data
public class TaskReadyRequestDTO {

    private Boolean ready;
}
