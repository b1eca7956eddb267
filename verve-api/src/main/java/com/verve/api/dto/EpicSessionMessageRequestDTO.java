package com.verve.api.dto;

import lombok.Data;

/**
 * 规划会话消息请求 DTO
 */
@Data
public class EpicSessionMessageRequestDTO {

    private String message;
}
