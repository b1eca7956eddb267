package com.verve.api.dto;

import lombok.Data;

/**
 * 人工重试请求 DTO
 */
@Data
public class TaskRetryRequestDTO {

    /**
     * 写入 retryReason 的补充说明
     */
    private String instructions;
}
