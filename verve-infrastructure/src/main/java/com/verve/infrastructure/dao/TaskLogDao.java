package com.verve.infrastructure.dao;

import com.verve.infrastructure.dao.po.TaskLogPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 任务日志 DAO
 */
@Mapper
public interface TaskLogDao {

    int insert(TaskLogPO po);

    /**
     * 按插入顺序返回
     */
    List<TaskLogPO> selectByTaskId(@Param("taskId") String taskId);

    int deleteByTaskId(@Param("taskId") String taskId);
}
