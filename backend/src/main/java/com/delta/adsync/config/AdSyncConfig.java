package com.delta.adsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class AdSyncConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(AdSyncProperties properties) {
        int size = Math.max(4, properties.getGraph().getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "syncRunExecutor", destroyMethod = "shutdown")
    public ExecutorService syncRunExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean(name = "schedulerExecutor", destroyMethod = "shutdownNow")
    public ScheduledExecutorService schedulerExecutor() {
        return Executors.newSingleThreadScheduledExecutor();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
