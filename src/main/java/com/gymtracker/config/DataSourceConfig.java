package com.gymtracker.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import javax.sql.DataSource;

/**
 * 训练库连接池。prod 使用较大的池并开启泄漏检测，dev 只保留少量连接。
 * spring.datasource.hikari.* 中的配置会覆盖 prod 池的默认值。
 */
@Slf4j
@Configuration
public class DataSourceConfig {

    private static final String APPLICATION_NAME = "gym_tracker_backend";

    @Value("${spring.datasource.url:jdbc:postgresql://localhost:5432/gym_tracker}")
    private String jdbcUrl;

    @Value("${spring.datasource.username:gym_tracker_app}")
    private String username;

    @Value("${spring.datasource.password:}")
    private String password;

    @Value("${gym.datasource.max-pool-size:20}")
    private int maxPoolSize;

    @Value("${gym.datasource.min-idle:5}")
    private int minIdle;

    @Bean
    @ConfigurationProperties(prefix = "spring.datasource.hikari")
    @Profile("prod")
    public DataSource prodDataSource() {
        HikariConfig config = poolConfig("GymTrackerProdPool", maxPoolSize, minIdle);

        config.setConnectionTimeout(30000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        config.setLeakDetectionThreshold(60000);
        config.setValidationTimeout(5000);
        config.setInitializationFailTimeout(60000);
        config.setConnectionInitSql("SELECT 1");

        // 日历区间查询反复使用同几条语句
        config.addDataSourceProperty("prepareThreshold", "5");
        config.addDataSourceProperty("preparedStatementCacheQueries", "256");
        config.addDataSourceProperty("preparedStatementCacheSizeMiB", "5");

        return new HikariDataSource(config);
    }

    @Bean
    @Profile("dev")
    public DataSource devDataSource() {
        return new HikariDataSource(poolConfig("GymTrackerDevPool", 5, 1));
    }

    private HikariConfig poolConfig(String poolName, int maximumPoolSize, int minimumIdle) {
        log.info("初始化连接池 - pool: {}, url: {}, maxPoolSize: {}", poolName, jdbcUrl, maximumPoolSize);

        HikariConfig config = new HikariConfig();
        config.setPoolName(poolName);
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setMaximumPoolSize(maximumPoolSize);
        config.setMinimumIdle(Math.min(minimumIdle, maximumPoolSize));
        config.addDataSourceProperty("ApplicationName", APPLICATION_NAME);
        return config;
    }
}
