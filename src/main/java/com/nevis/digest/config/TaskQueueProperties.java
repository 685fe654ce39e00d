package com.nevis.digest.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.task-queue")
public record TaskQueueProperties(
	@NotNull Boolean autoStart,
	@NotNull @Min(1) Integer batchSize,
	@NotNull @Min(1) Integer maxAttempts,
	@NotNull @Min(1) Integer staleTimeoutSeconds,
	@NotNull @Min(1) Integer requestsPerSecond,
	@NotNull @Min(1) Integer concurrency,
	@NotNull @Min(1) Long retryBaseSeconds,
	@NotNull @Min(1) Long retryMaxSeconds,
	@NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double retryJitter
) {}
