package com.zzf.simon.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.simon.store.DocumentStore;
import com.zzf.simon.store.FileDocumentStore;
import com.zzf.simon.store.InMemoryDocumentStore;
import com.zzf.simon.store.RetryPolicy;
import com.zzf.simon.store.RetryingDocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    public RetryPolicy storeRetryPolicy(SimonProperties properties) {
        SimonProperties.Retry retry = properties.getStore().getRetry();
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMaxBackoff(), retry.getMultiplier());
    }

    @Bean
    public DocumentStore documentStore(SimonProperties properties, ObjectMapper objectMapper, RetryPolicy storeRetryPolicy) {
        SimonProperties.Store store = properties.getStore();
        DocumentStore backing;
        if ("memory".equalsIgnoreCase(store.getType())) {
            backing = new InMemoryDocumentStore(objectMapper);
        } else if ("file".equalsIgnoreCase(store.getType())) {
            backing = new FileDocumentStore(Paths.get(store.getDirectory()), objectMapper);
        } else {
            throw new IllegalStateException("Unknown simon.store.type: " + store.getType());
        }
        log.info("store.init type={} maxAttempts={}", store.getType(), storeRetryPolicy.getMaxAttempts());
        return new RetryingDocumentStore(backing, storeRetryPolicy);
    }
}
