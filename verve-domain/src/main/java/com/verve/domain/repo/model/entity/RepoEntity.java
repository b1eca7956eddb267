package com.verve.domain.repo.model.entity;

import com.verve.types.common.IdGenerator;
import com.verve.types.exception.AppException;
import lombok.Data;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDateTime;

/**
 * 代码仓库领域实体，创建后不可变。
 */
@Data
public class RepoEntity {

    private String id;
    private String owner;
    private String name;
    private String fullName;
    private LocalDateTime createdAt;

    /**
     * 解析 owner/name 形式的仓库全名。
     */
    public static RepoEntity create(String fullName, LocalDateTime now) {
        String trimmed = StringUtils.trimToEmpty(fullName);
        int slash = trimmed.indexOf('/');
        if (slash <= 0 || slash == trimmed.length() - 1 || trimmed.indexOf('/', slash + 1) >= 0) {
            throw AppException.illegalParameter("invalid repo full name \"" + fullName + "\": expected owner/name");
        }
        RepoEntity entity = new RepoEntity();
        entity.setId(IdGenerator.newRepoId());
        entity.setOwner(trimmed.substring(0, slash));
        entity.setName(trimmed.substring(slash + 1));
        entity.setFullName(trimmed);
        entity.setCreatedAt(now);
        return entity;
    }
}
