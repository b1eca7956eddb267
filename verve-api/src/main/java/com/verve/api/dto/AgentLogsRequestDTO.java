package com.verve.api.dto;

import lombok.Data;

import java.util.List;

/**
 * Worker 追加日志请求 DTO
 */
@Data
public class AgentLogsRequestDTO {

    private Integer attempt;
    private List<String> lines;
}
