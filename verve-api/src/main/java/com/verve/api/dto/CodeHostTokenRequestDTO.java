package com.verve.api.dto;

import lombok.Data;

/**
 * 保存代码托管平台访问令牌请求 DTO
 */
@Data
public class CodeHostTokenRequestDTO {

    private String token;
}
