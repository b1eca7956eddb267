package com.verve.api.dto;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 仓库视图 DTO
 */
@Data
public class RepoDTO {

    private String id;
    private String owner;
    private String name;
    private String fullName;
    private LocalDateTime createdAt;
}
