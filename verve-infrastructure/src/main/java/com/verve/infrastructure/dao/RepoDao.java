package com.verve.infrastructure.dao;

import com.verve.infrastructure.dao.po.RepoPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 仓库 DAO
 */
@Mapper
public interface RepoDao {

    int insert(RepoPO po);

    RepoPO selectById(@Param("id") String id);

    RepoPO selectByFullName(@Param("fullName") String fullName);

    List<RepoPO> selectAll();

    int deleteById(@Param("id") String id);
}
