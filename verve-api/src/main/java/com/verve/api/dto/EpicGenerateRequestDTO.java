package com.verve.api.dto;

import lombok.Data;

/**
 * 调用规划器生成候选任务请求 DTO
 */
@Data
public class EpicGenerateRequestDTO {

    private String instructions;
}
