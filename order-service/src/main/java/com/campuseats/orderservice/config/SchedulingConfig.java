package com.campuseats.orderservice.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

// Integration tests switch this off and drive the jobs by hand
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "campuseats.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
