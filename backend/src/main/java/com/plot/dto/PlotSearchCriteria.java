package com.plot.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 剧情列表的筛选条件，三个条件均可选，同时给出时取交集
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlotSearchCriteria {

    /**
     * 作品名（精确匹配）
     */
    private String work;

    /**
     * 状态（精确匹配）
     */
    private String status;

    /**
     * 关键词，在标题或概要中做不区分大小写的包含匹配
     */
    private String q;

    /**
     * 关键词对应的 LIKE 模式
     */
    public String getKeywordPattern() {
        return q == null ? null : "%" + q + "%";
    }
}
