package com.plot.service;

import com.plot.config.GlobalExceptionHandler.PlotNotFoundException;
import com.plot.domain.entity.Plot;
import com.plot.dto.PlotCreateRequest;
import com.plot.dto.PlotSearchCriteria;
import com.plot.repository.PlotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 剧情服务
 * 每个操作只执行单条语句，不开启跨语句事务；先查后写之间的并发修改以最后一次写入为准
 */
@Service
@Slf4j
public class PlotService {

    @Autowired
    private PlotRepository plotRepository;

    /**
     * 按条件查询剧情列表（按ID升序）
     */
    public List<Plot> listPlots(PlotSearchCriteria criteria) {
        log.info("查询剧情列表: work={}, status={}, q={}",
                criteria.getWork(), criteria.getStatus(), criteria.getQ());
        return plotRepository.search(criteria);
    }

    /**
     * 根据ID获取剧情，不存在时抛出 PlotNotFoundException
     */
    public Plot getPlot(Long id) {
        Plot plot = plotRepository.selectById(id);
        if (plot == null) {
            throw new PlotNotFoundException(id);
        }
        return plot;
    }

    /**
     * 创建剧情，返回写入后重新读取的记录
     */
    public Plot createPlot(PlotCreateRequest request) {
        log.info("创建剧情: title={}, work={}", request.getTitle(), request.getWork());

        Plot plot = new Plot();
        apply(plot, request);

        int result = plotRepository.insert(plot);
        if (result <= 0) {
            throw new IllegalStateException("剧情创建失败");
        }
        log.info("剧情创建成功，ID={}", plot.getId());
        return getPlot(plot.getId());
    }

    /**
     * 整体更新剧情，四个字段全部覆盖（summary 未传时置为 null）
     */
    public Plot updatePlot(Long id, PlotCreateRequest request) {
        log.info("更新剧情ID={}", id);

        Plot plot = getPlot(id);
        apply(plot, request);

        // 查询与更新之间记录可能已被删除
        if (plotRepository.replace(plot) == 0) {
            throw new PlotNotFoundException(id);
        }
        return getPlot(id);
    }

    /**
     * 删除剧情
     */
    public void deletePlot(Long id) {
        log.info("删除剧情ID={}", id);

        getPlot(id);
        if (plotRepository.deleteById(id) == 0) {
            throw new PlotNotFoundException(id);
        }
    }

    private static void apply(Plot plot, PlotCreateRequest request) {
        plot.setTitle(request.getTitle());
        plot.setWork(request.getWork());
        plot.setStatus(request.getStatus());
        plot.setSummary(request.getSummary());
    }
}
