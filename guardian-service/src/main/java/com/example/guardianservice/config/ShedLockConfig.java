package com.example.guardianservice.config;

import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.provider.jdbctemplate.JdbcTemplateLockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * ShedLock locking, backed by the {@code shedlock} table (migration V1).
 * 
 * Used two ways:
 * - @SchedulerLock on scheduled jobs, so one replica runs the panel integrity check
 * - programmatically by the overhaul orchestrator, one lock per guild ({@code overhaul-<guildId>});
 *   a second run while the lock is held is rejected
 */
@Configuration
@EnableSchedulerLock(defaultLockAtMostFor = "10m")
public class ShedLockConfig {

    @Bean
    public LockProvider lockProvider(DataSource dataSource) {
        return new JdbcTemplateLockProvider(JdbcTemplateLockProvider.Configuration.builder()
                .withJdbcTemplate(new JdbcTemplate(dataSource))
                .usingDbTime() // database clock, consistent across instances
                .build());
    }
}
