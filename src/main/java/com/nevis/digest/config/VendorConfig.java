package com.nevis.digest.config;

import com.nevis.digest.vendor.ContentExtractionClient;
import com.nevis.digest.vendor.UnconfiguredContentExtractionClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class VendorConfig {

    @Bean
    @ConditionalOnMissingBean(ContentExtractionClient.class)
    public ContentExtractionClient contentExtractionClient() {
        return new UnconfiguredContentExtractionClient();
    }
}
