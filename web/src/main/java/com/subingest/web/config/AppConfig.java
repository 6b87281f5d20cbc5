/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.web.config;

import com.subingest.common.util.ConfigPropertyResolver;
import com.subingest.messaging.config.MessagingFactory;
import com.subingest.server.input.InputContext;
import com.subingest.server.input.InputRegistry;
import com.subingest.server.input.InputService;
import com.subingest.server.input.pubsub.PubSubInput;
import com.subingest.server.pipeline.BufferedEventPipeline;
import com.subingest.server.pipeline.EventPublisher;
import com.subingest.server.pipeline.LoggingEventPublisher;
import com.subingest.server.status.StatusReporter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Value("${subingest.inputs.config-dir:config/inputs}")
    private String inputsConfigDir;

    @Value("${subingest.pipeline.queue-capacity:4096}")
    private int pipelineQueueCapacity;

    @Value("${subingest.pipeline.publisher-threads:2}")
    private int pipelinePublisherThreads;

    @Value("${subingest.version:1.0.0}")
    private String version;

    @Bean
    public ConfigPropertyResolver configPropertyResolver() {
        ConfigPropertyResolver resolver = new ConfigPropertyResolver();
        resolver.loadClasspathProperties("application.properties");
        return resolver;
    }

    @Bean
    public InputRegistry inputRegistry() {
        InputRegistry registry = new InputRegistry();
        PubSubInput.register(registry);
        log.info("Registered input types: {}", registry.names());
        return registry;
    }

    @Bean
    public MessagingFactory messagingFactory() {
        return new MessagingFactory();
    }

    @Bean
    public EventPublisher eventPublisher() {
        return new LoggingEventPublisher();
    }

    // stopped by ShutdownOrchestrator after the inputs
    @Bean(destroyMethod = "")
    public BufferedEventPipeline eventPipeline(EventPublisher eventPublisher) {
        BufferedEventPipeline pipeline = new BufferedEventPipeline(
                pipelineQueueCapacity, pipelinePublisherThreads, eventPublisher);
        pipeline.start();
        return pipeline;
    }

    @Bean
    public StatusReporter inputStatusReporter() {
        return (state, detail) -> {
            if (detail == null || detail.isEmpty()) {
                log.info("Input status → {}", state);
            } else {
                log.info("Input status → {} ({})", state, detail);
            }
        };
    }

    @Bean
    public InputContext inputContext(BufferedEventPipeline eventPipeline, MeterRegistry meterRegistry,
                                     MessagingFactory messagingFactory, StatusReporter inputStatusReporter) {
        return InputContext.builder()
                .pipeline(eventPipeline)
                .meterRegistry(meterRegistry)
                .clientFactory(messagingFactory)
                .statusReporter(() -> inputStatusReporter)
                .version(version)
                .build();
    }

    @Bean
    public InputService inputService(InputRegistry inputRegistry, InputContext inputContext,
                                     ConfigPropertyResolver configPropertyResolver) {
        return new InputService(inputsConfigDir, inputRegistry, inputContext, configPropertyResolver);
    }
}
