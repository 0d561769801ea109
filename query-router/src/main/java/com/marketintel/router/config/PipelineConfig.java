package com.marketintel.router.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, QueryRouterProperties properties) {
        return builder
                .setConnectTimeout(properties.getBlob().getConnectTimeout())
                .setReadTimeout(properties.getBlob().getReadTimeout())
                .build();
    }

    /**
     * Pool for dataset loads. Sized small: loads are I/O bound and each key is read once.
     */
    @Bean(name = "datasetLoaderExecutor", destroyMethod = "shutdown")
    public ExecutorService datasetLoaderExecutor(QueryRouterProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "dataset-loader-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getCache().getLoaderThreads()), threads);
    }
}
