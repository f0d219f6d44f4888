/*
 * Where: Grading application configuration binding
 * What: Holds student-facing message settings
 * Why: Keep the feedback preview size tunable per environment
 */
package com.example.grading.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "grading.notification")
public record NotificationProperties(int feedbackPreviewLength) {}
