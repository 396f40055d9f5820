package com.plot.controller;

import com.plot.domain.entity.Plot;
import com.plot.dto.PlotCreateRequest;
import com.plot.dto.PlotSearchCriteria;
import com.plot.service.PlotService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import javax.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 剧情控制器
 */
@RestController
@RequestMapping("/plots")
@CrossOrigin(origins = "*")
@Slf4j
public class PlotController {

    @Autowired
    private PlotService plotService;

    /**
     * 获取剧情列表（支持作品、状态筛选和关键词搜索）
     */
    @GetMapping
    public ResponseEntity<List<Plot>> listPlots(
            @RequestParam(required = false) String work,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String q) {
        log.info("API: 获取剧情列表");
        return ResponseEntity.ok(plotService.listPlots(new PlotSearchCriteria(work, status, q)));
    }

    /**
     * 获取单个剧情
     */
    @GetMapping("/{plotId}")
    public ResponseEntity<Plot> getPlot(@PathVariable Long plotId) {
        log.info("API: 获取剧情ID={}", plotId);
        return ResponseEntity.ok(plotService.getPlot(plotId));
    }

    /**
     * 创建剧情
     */
    @PostMapping
    public ResponseEntity<Plot> createPlot(@Valid @RequestBody PlotCreateRequest request) {
        log.info("API: 创建剧情");
        return ResponseEntity.ok(plotService.createPlot(request));
    }

    /**
     * 整体更新剧情
     */
    @PutMapping("/{plotId}")
    public ResponseEntity<Plot> updatePlot(
            @PathVariable Long plotId,
            @Valid @RequestBody PlotCreateRequest request) {
        log.info("API: 更新剧情ID={}", plotId);
        return ResponseEntity.ok(plotService.updatePlot(plotId, request));
    }

    /**
     * 删除剧情
     */
    @DeleteMapping("/{plotId}")
    public ResponseEntity<Map<String, Object>> deletePlot(@PathVariable Long plotId) {
        log.info("API: 删除剧情ID={}", plotId);
        plotService.deletePlot(plotId);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("message", "deleted");
        response.put("id", plotId);
        return ResponseEntity.ok(response);
    }
}
