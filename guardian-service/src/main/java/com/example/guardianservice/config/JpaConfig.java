package com.example.guardianservice.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repositories for level profiles, tier ladders, reaction-role lists, panel records and
 * recorded remote identifiers. Auditing fills {@code created_at} / {@code updated_at} on
 * entity saves; the native upserts write those columns themselves.
 */
@Configuration
@EnableJpaAuditing
@EnableJpaRepositories(basePackages = "com.example.guardianservice.repository")
public class JpaConfig {
}
