package com.verve.api.dto;

import lombok.Data;

/**
 * 登记仓库请求 DTO
 */
@Data
public class RepoCreateRequestDTO {

    /**
     * owner/name
     */
    private String fullName;
}
