package com.plot.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

/**
 * 剧情实体，对应 plots 表
 */
@Data
@TableName("plots")
public class Plot {

    /**
     * 剧情ID（数据库自增，创建后不可变）
     */
    @TableId(type = IdType.AUTO)
    private Long id;

    /**
     * 标题，最长200
     */
    private String title;

    /**
     * 所属作品，最长100
     */
    private String work;

    /**
     * 状态，最长50
     */
    private String status;

    /**
     * 概要（可为空）
     */
    private String summary;
}
