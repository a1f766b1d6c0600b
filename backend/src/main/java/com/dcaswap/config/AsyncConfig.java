package com.dcaswap.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: dca-executor runs one scheduled swap per thread (bounded by max-concurrency);
 * dca-io-executor serves the concurrent balance / permitted-version / quote reads of each run.
 */
@Configuration
@EnableConfigurationProperties(DcaSchedulerProperties.class)
public class AsyncConfig {

    public static final String DCA_EXECUTOR = "dca-executor";
    public static final String DCA_IO_EXECUTOR = "dca-io-executor";

    @Bean(name = DCA_EXECUTOR)
    public Executor dcaExecutor(DcaSchedulerProperties schedulerProperties) {
        int size = Math.max(1, schedulerProperties.getMaxConcurrency());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        // Permits are released just before a worker goes idle; the queue absorbs that overlap.
        e.setQueueCapacity(size);
        e.setThreadNamePrefix("dca-");
        e.initialize();
        return e;
    }

    /** Three reads per run, so three threads per concurrent run. */
    @Bean(name = DCA_IO_EXECUTOR)
    public Executor dcaIoExecutor(DcaSchedulerProperties schedulerProperties) {
        int size = Math.max(1, schedulerProperties.getMaxConcurrency()) * 3;
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(size);
        e.setMaxPoolSize(size);
        e.setThreadNamePrefix("dca-io-");
        e.initialize();
        return e;
    }
}
