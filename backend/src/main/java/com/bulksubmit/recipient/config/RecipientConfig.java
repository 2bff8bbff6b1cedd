package com.bulksubmit.recipient.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class RecipientConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(RecipientProperties properties) {
        int size = Math.max(4, properties.getDownloadConcurrency());
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "transferExecutor", destroyMethod = "shutdownNow")
    public ExecutorService transferExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("transfer-run");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "downloadExecutor", destroyMethod = "shutdownNow")
    public ExecutorService downloadExecutor(RecipientProperties properties) {
        return Executors.newFixedThreadPool(properties.getDownloadConcurrency(), runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("transfer-download");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
