package com.verve.infrastructure.dao;

import com.verve.infrastructure.dao.po.SettingPO;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 设置项 DAO
 */
@Mapper
public interface SettingDao {

    SettingPO selectByKey(@Param("settingKey") String settingKey);

    List<SettingPO> selectAll();

    int upsert(SettingPO po);

    int deleteByKey(@Param("settingKey") String settingKey);
}
