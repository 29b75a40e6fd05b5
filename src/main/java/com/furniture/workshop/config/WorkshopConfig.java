package com.furniture.workshop.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(WorkshopProperties.class)
public class WorkshopConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(name = "graphFetchExecutor")
    public ThreadPoolTaskExecutor graphFetchExecutor(WorkshopProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getGraph().getFetchThreads());
        executor.setMaxPoolSize(properties.getGraph().getFetchThreads());
        executor.setThreadNamePrefix("graph-fetch-");
        executor.initialize();
        return executor;
    }
}
