package com.ztverify.riskauth.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client and worker pool for IP geolocation. Lookups run off the request thread and are
 * bounded both here (socket timeouts) and by the caller's overall deadline.
 */
@Configuration
public class GeolocationConfig {

    @Bean
    public RestTemplate geoRestTemplate(RestTemplateBuilder builder,
                                        @Value("${app.geo.connect-timeout-ms:1000}") long connectTimeoutMs,
                                        @Value("${app.geo.read-timeout-ms:2000}") long readTimeoutMs) {
        return builder
                .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
                .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                .build();
    }

    @Bean
    public ThreadPoolTaskExecutor geoLookupExecutor(@Value("${app.geo.pool-size:4}") int poolSize,
                                                    @Value("${app.geo.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("geo-lookup-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
