package com.verve.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 仓库 PO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RepoPO {

    private String id;
    private String owner;
    private String name;
    private String fullName;
    private LocalDateTime createdAt;
}
