package com.plot;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 剧情记录服务主应用类
 *
 * @author Plot Record Service
 * @version 1.0.0
 */
@SpringBootApplication
@MapperScan("com.plot.repository")
public class PlotRecordApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlotRecordApplication.class, args);
        System.out.println("🚀 剧情记录服务启动成功");
        System.out.println("📚 访问地址: http://localhost:8000/plots");
        System.out.println("🔍 健康检测 http://localhost:8000/ping");
    }
}
