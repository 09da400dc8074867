package org.listingwatch.tracker.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Worker pool for batch ingestion. One task per listing group, so groups for different
 * listings run in parallel while each group stays sequential.
 */
@Configuration
public class IngestionExecutorConfig {

    public static final String INGESTION_EXECUTOR = "ingestion-executor";

    @Bean(name = INGESTION_EXECUTOR)
    public Executor ingestionExecutor(@Value("${listings.ingestion.batch-parallelism:4}") int parallelism) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(parallelism);
        e.setMaxPoolSize(parallelism);
        e.setThreadNamePrefix("ingest-");
        e.initialize();
        return e;
    }
}
