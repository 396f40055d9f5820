package com.plot.repository;

import com.plot.dto.PlotSearchCriteria;
import org.apache.ibatis.jdbc.SQL;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 剧情动态查询SQL
 */
public class PlotSqlProvider {

    /**
     * 按条件查询剧情列表，条件之间以 AND 连接，按ID升序
     */
    public String search(PlotSearchCriteria criteria) {
        SQL sql = new SQL()
                .SELECT("id, title, work, status, summary")
                .FROM("plots");
        for (String condition : conditions(criteria)) {
            sql.WHERE(condition);
        }
        return sql.ORDER_BY("id ASC").toString();
    }

    /**
     * 收集生效的筛选条件，空字符串视为未传
     */
    static List<String> conditions(PlotSearchCriteria criteria) {
        List<String> conditions = new ArrayList<>();
        if (criteria == null) {
            return conditions;
        }
        if (StringUtils.hasLength(criteria.getWork())) {
            conditions.add("work = #{work}");
        }
        if (StringUtils.hasLength(criteria.getStatus())) {
            conditions.add("status = #{status}");
        }
        if (StringUtils.hasLength(criteria.getQ())) {
            conditions.add("(title ILIKE #{keywordPattern} OR summary ILIKE #{keywordPattern})");
        }
        return conditions;
    }
}
