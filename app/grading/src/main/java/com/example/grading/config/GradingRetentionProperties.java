/*
 * Where: Grading application configuration binding
 * What: Holds retention cleanup settings
 * Why: Keep retention policy and schedule tunable per environment
 */
package com.example.grading.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "grading.retention")
public record GradingRetentionProperties(
                boolean enabled,
                int retentionDays,
                Duration cleanupInterval) {
}
