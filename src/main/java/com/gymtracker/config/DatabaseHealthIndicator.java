package com.gymtracker.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * 训练库健康检查：连接可用，且训练相关的表都已建好
 */
@Component
@Slf4j
public class DatabaseHealthIndicator implements HealthIndicator {

    static final List<String> REQUIRED_TABLES = List.of("workouts", "workout_exercises", "workout_plans");

    private static final String TABLE_EXISTS_SQL =
            "SELECT COUNT(*) FROM information_schema.tables WHERE table_name = ?";

    private final JdbcTemplate jdbcTemplate;

    public DatabaseHealthIndicator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        try {
            jdbcTemplate.queryForObject("SELECT 1", Integer.class);

            List<String> missing = new ArrayList<>();
            for (String table : REQUIRED_TABLES) {
                Integer count = jdbcTemplate.queryForObject(TABLE_EXISTS_SQL, Integer.class, table);
                if (count == null || count == 0) {
                    missing.add(table);
                }
            }

            if (!missing.isEmpty()) {
                log.warn("训练库缺少数据表: {}", missing);
                return Health.down()
                        .withDetail("database", "connected")
                        .withDetail("missing_tables", missing)
                        .build();
            }
            return Health.up()
                    .withDetail("database", "connected")
                    .withDetail("tables", REQUIRED_TABLES)
                    .build();

        } catch (DataAccessException e) {
            log.error("数据库健康检查失败", e);
            return Health.down()
                    .withDetail("error", e.getMessage())
                    .withDetail("timestamp", System.currentTimeMillis())
                    .build();
        }
    }
}
