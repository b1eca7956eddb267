package com.verve.api.dto;

import lombok.Data;

/**
 * 关闭任务请求 DTO
 */
@Data
public class TaskCloseRequestDTO {

    private String reason;
}
