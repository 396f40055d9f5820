package com.plot.dto;

import lombok.Data;

import javax.validation.constraints.NotNull;

/**
 * 创建/整体更新剧情的请求体
 */
@Data
public class PlotCreateRequest {

    @NotNull(message = "title不能为空")
    private String title;

    @NotNull(message = "work不能为空")
    private String work;

    @NotNull(message = "status不能为空")
    private String status;

    private String summary;
}
