package com.guno.orderpipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Pipeline Configuration
 *
 * Usage in application.yml:
 * pipeline:
 *   batch:
 *     worker-threads: 4
 *   store:
 *     type: jdbc          # or memory
 *     max-attempts: 3
 *     initial-backoff-ms: 500
 *   projection:
 *     table: order_items_flat
 *     derive-campaign-flag: true
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineProperties {

    private Batch batch = new Batch();
    private Store store = new Store();
    private Projection projection = new Projection();
    private Input input = new Input();
    private Checkpoint checkpoint = new Checkpoint();
    private Analytics analytics = new Analytics();
    private Scheduler scheduler = new Scheduler();

    @Data
    public static class Batch {
        private int workerThreads = Runtime.getRuntime().availableProcessors();
    }

    @Data
    public static class Store {
        private String type = "memory";
        private int maxAttempts = 3;
        private long initialBackoffMs = 500;
    }

    @Data
    public static class Projection {
        private String table = "order_items_flat";
        private boolean deriveCampaignFlag = true;
        private String exportPath;
    }

    @Data
    public static class Input {
        private String path;
    }

    @Data
    public static class Checkpoint {
        /**
         * Directory for checkpoint files; checkpoints stay in memory when unset
         */
        private String dir;
    }

    @Data
    public static class Analytics {
        private long churnAfterDays = 180;
        private int topLimit = 10;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;
    }
}
