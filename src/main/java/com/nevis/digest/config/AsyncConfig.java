package com.nevis.digest.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;

import java.time.Clock;
import java.util.concurrent.Executor;

@Configuration
@EnableAsync
public class AsyncConfig {

    @Bean(name = "digestTaskExecutor")
    public Executor digestTaskExecutor(DigestProperties properties) {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("digest-");
        executor.setConcurrencyLimit(properties.concurrency());
        return executor;
    }

    @Bean(name = "queueTaskExecutor")
    public Executor queueTaskExecutor(TaskQueueProperties properties) {
        SimpleAsyncTaskExecutor executor = new SimpleAsyncTaskExecutor("task-");
        executor.setConcurrencyLimit(properties.concurrency());
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
