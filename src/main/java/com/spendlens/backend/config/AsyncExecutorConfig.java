package com.spendlens.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    public static final String CHUNK_DISPATCH_EXECUTOR = "chunkDispatchExecutor";

    @Bean(name = CHUNK_DISPATCH_EXECUTOR)
    public ThreadPoolTaskExecutor chunkDispatchExecutor(ChunkingProperties chunkingProperties) {
        int workers = Math.max(1, chunkingProperties.getMaxConcurrency());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("chunk-dispatch-");
        executor.initialize();
        return executor;
    }
}
