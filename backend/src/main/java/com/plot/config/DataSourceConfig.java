package com.plot.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 数据源配置
 *
 * <p>连接池在启动时创建一次，随 Spring 容器关闭时释放。每次 Mapper 调用从池中借出连接，
 * 调用结束（无论成功或异常）后归还。
 */
@Slf4j
@Configuration
public class DataSourceConfig {

    @Value("${plot.datasource.url:postgresql://app:pass@db:5432/appdb}")
    private String url;

    @Value("${plot.datasource.pool-size:10}")
    private int poolSize;

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource() {
        DatabaseUrl databaseUrl = DatabaseUrl.parse(url);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(databaseUrl.getJdbcUrl());
        if (databaseUrl.getUsername() != null) {
            config.setUsername(databaseUrl.getUsername());
        }
        if (databaseUrl.getPassword() != null) {
            config.setPassword(databaseUrl.getPassword());
        }
        config.setMaximumPoolSize(poolSize);
        config.setPoolName("PlotPool");

        log.info("🔌 初始化数据库连接池: {} (最大连接数: {})", databaseUrl.describe(), poolSize);
        return new HikariDataSource(config);
    }
}
