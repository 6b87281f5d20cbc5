/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.server.input;

import com.subingest.messaging.config.MessagingFactory;
import com.subingest.messaging.core.MessageSourceClientFactory;
import com.subingest.server.pipeline.PipelineConnector;
import com.subingest.server.status.NoopStatusReporter;
import com.subingest.server.status.StatusReporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Host services handed to an input when it is constructed.
 */
public final class InputContext {

    public static final String DEFAULT_VERSION = "1.0.0";

    private final PipelineConnector pipeline;
    private final MeterRegistry meterRegistry;
    private final Supplier<StatusReporter> statusReporterSupplier;
    private final MessageSourceClientFactory clientFactory;
    private final String version;

    private InputContext(Builder b) {
        this.pipeline = Objects.requireNonNull(b.pipeline, "pipeline");
        this.meterRegistry = b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry();
        this.statusReporterSupplier = b.statusReporterSupplier;
        this.clientFactory = b.clientFactory != null ? b.clientFactory : new MessagingFactory();
        this.version = b.version != null ? b.version : DEFAULT_VERSION;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The host's status reporter, or the no-op reporter when the host has
     * none to offer.
     */
    public StatusReporter statusReporter() {
        if (statusReporterSupplier == null) return NoopStatusReporter.INSTANCE;
        StatusReporter reporter = statusReporterSupplier.get();
        return reporter != null ? reporter : NoopStatusReporter.INSTANCE;
    }

    public String userAgent() {
        return "SubIngest/" + version;
    }

    public PipelineConnector getPipeline() { return pipeline; }
    public MeterRegistry getMeterRegistry() { return meterRegistry; }
    public MessageSourceClientFactory getClientFactory() { return clientFactory; }
    public String getVersion() { return version; }

    public static final class Builder {
        private PipelineConnector pipeline;
        private MeterRegistry meterRegistry;
        private Supplier<StatusReporter> statusReporterSupplier;
        private MessageSourceClientFactory clientFactory;
        private String version;

        private Builder() {}

        public Builder pipeline(PipelineConnector pipeline) { this.pipeline = pipeline; return this; }
        public Builder meterRegistry(MeterRegistry registry) { this.meterRegistry = registry; return this; }
        public Builder statusReporter(Supplier<StatusReporter> supplier) { this.statusReporterSupplier = supplier; return this; }
        public Builder clientFactory(MessageSourceClientFactory factory) { this.clientFactory = factory; return this; }
        public Builder version(String version) { this.version = version; return this; }

        public InputContext build() {
            return new InputContext(this);
        }
    }
}
