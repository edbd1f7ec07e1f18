package com.guno.orderpipeline.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.guno.orderpipeline.checkpoint.CheckpointStore;
import com.guno.orderpipeline.checkpoint.FileCheckpointStore;
import com.guno.orderpipeline.checkpoint.InMemoryCheckpointStore;
import com.guno.orderpipeline.entity.Order;
import com.guno.orderpipeline.repository.AnalyticsStore;
import com.guno.orderpipeline.repository.InMemoryAnalyticsStore;
import com.guno.orderpipeline.repository.InMemoryOrderStore;
import com.guno.orderpipeline.repository.JdbcAnalyticsStore;
import com.guno.orderpipeline.repository.JdbcOrderStore;
import com.guno.orderpipeline.repository.KeyedStore;
import com.guno.orderpipeline.util.BackoffRetry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.nio.file.Path;

/**
 * Store wiring, selected by pipeline.store.type (memory | jdbc)
 */
@Configuration
@Slf4j
public class StoreConfig {

    @Configuration
    @ConditionalOnProperty(prefix = "pipeline.store", name = "type", havingValue = "memory", matchIfMissing = true)
    static class MemoryStores {

        @Bean
        public KeyedStore<Order> orderStore() {
            log.info("🧠 Using in-memory order store");
            return new InMemoryOrderStore();
        }

        @Bean
        public AnalyticsStore analyticsStore() {
            return new InMemoryAnalyticsStore();
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "pipeline.store", name = "type", havingValue = "jdbc")
    static class JdbcStores {

        @Bean
        public KeyedStore<Order> orderStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
            log.info("🐘 Using PostgreSQL order store");
            JdbcOrderStore store = new JdbcOrderStore(jdbcTemplate, objectMapper);
            store.ensureTable();
            return store;
        }

        @Bean
        public AnalyticsStore analyticsStore(JdbcTemplate jdbcTemplate) {
            return new JdbcAnalyticsStore(jdbcTemplate);
        }
    }

    @Bean
    public BackoffRetry storeRetry(PipelineProperties properties) {
        PipelineProperties.Store store = properties.getStore();
        return new BackoffRetry(store.getMaxAttempts(), store.getInitialBackoffMs());
    }

    @Bean
    public CheckpointStore checkpointStore(PipelineProperties properties, ObjectMapper objectMapper) {
        String dir = properties.getCheckpoint().getDir();
        if (dir == null || dir.isBlank()) {
            return new InMemoryCheckpointStore();
        }
        log.info("📍 Checkpoints stored under {}", dir);
        return new FileCheckpointStore(Path.of(dir), objectMapper);
    }
}
