package com.verve.api.dto;

import lombok.Data;

/**
 * 确认 Epic 请求 DTO
 */
@Data
public class EpicConfirmRequestDTO {

    /**
     * true 时生成的任务 ready=false，Epic 进入 ready 而非 active
     */
    private Boolean notReady;
}
