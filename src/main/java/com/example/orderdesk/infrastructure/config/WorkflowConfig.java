package com.example.orderdesk.infrastructure.config;

import com.example.orderdesk.domain.model.StatusRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@Configuration
@EnableScheduling
public class WorkflowConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StatusRegistry statusRegistry() {
        return StatusRegistry.standard();
    }
}
