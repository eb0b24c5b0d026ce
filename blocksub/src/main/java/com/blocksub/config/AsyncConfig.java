package com.blocksub.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools for application-level consumers. BlockSub itself owns its worker, poll and delivery threads.
 */
@Configuration
public class AsyncConfig {

    public static final String HEADER_LOG_EXECUTOR = "header-log-executor";

    /** Single thread that drains the logging subscription. */
    @Bean(name = HEADER_LOG_EXECUTOR)
    public Executor headerLogExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix("header-log-");
        e.initialize();
        return e;
    }
}
