package com.ecvi.riskengine.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class VerificationConfig {

    @Bean(name = "adapterExecutor", destroyMethod = "shutdownNow")
    public ExecutorService adapterExecutor(VerificationProperties properties) {
        return Executors.newFixedThreadPool(properties.getAdapterPoolSize());
    }

    @Bean(name = "verificationRunExecutor", destroyMethod = "shutdownNow")
    public ExecutorService verificationRunExecutor(VerificationProperties properties) {
        return Executors.newFixedThreadPool(properties.getRunConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(VerificationProperties properties) {
        int size = Math.max(4, properties.getAdapterPoolSize());
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
