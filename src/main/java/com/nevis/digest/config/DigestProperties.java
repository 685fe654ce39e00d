package com.nevis.digest.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Validated
@ConfigurationProperties(prefix = "app.digest")
public record DigestProperties(
	@NotNull Boolean supervisorEnabled,
	@NotNull @Min(1) Integer maxAttempts,
	@NotNull @Min(1) Integer batchSize,
	@NotNull @Min(1) Integer concurrency,
	@NotNull @Min(1) Integer staleThresholdMinutes,
	@NotNull @Min(1) Integer lockTimeoutMinutes,
	@NotNull List<String> excludedPrefixes,
	@NotBlank String dataRoot
) {}
