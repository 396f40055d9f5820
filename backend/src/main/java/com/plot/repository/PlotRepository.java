package com.plot.repository;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.plot.domain.entity.Plot;
import com.plot.dto.PlotSearchCriteria;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.SelectProvider;
import org.apache.ibatis.annotations.Update;

import java.util.List;

@Mapper
public interface PlotRepository extends BaseMapper<Plot> {

    /**
     * 按作品、状态、关键词筛选剧情
     */
    @SelectProvider(type = PlotSqlProvider.class, method = "search")
    List<Plot> search(PlotSearchCriteria criteria);

    /**
     * 整体覆盖四个可变字段，summary 为 null 时同样写入 null
     */
    @Update("UPDATE plots SET title = #{title}, work = #{work}, status = #{status}, " +
            "summary = #{summary,jdbcType=VARCHAR} WHERE id = #{id}")
    int replace(Plot plot);
}
