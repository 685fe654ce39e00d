package com.nevis.digest.config;

import com.nevis.digest.infra.RateLimiter;
import com.nevis.digest.infra.TokenBucketRateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LimiterConfig {

    @Bean("taskLimiter")
    public RateLimiter taskLimiter(TaskQueueProperties properties) {
        return new TokenBucketRateLimiter(properties.requestsPerSecond());
    }
}
