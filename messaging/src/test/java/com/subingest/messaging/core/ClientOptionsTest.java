/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.core;

import com.subingest.common.config.WorkerConfig;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClientOptionsTest {

    @Test
    void splitsSchemeFromAddress() {
        ClientOptions options = new ClientOptions("p", "memory://local", null, null, "SubIngest/1.0.0");

        assertThat(options.endpointScheme()).isEqualTo("memory");
        assertThat(options.endpointAddress()).isEqualTo("local");
    }

    @Test
    void endpointWithoutSchemeIsKeptVerbatim() {
        ClientOptions options = new ClientOptions("p", "localhost:8085", null, null, "ua");

        assertThat(options.endpointScheme()).isNull();
        assertThat(options.endpointAddress()).isEqualTo("localhost:8085");
    }

    @Test
    void noEndpoint() {
        ClientOptions options = new ClientOptions("p", null, null, null, "ua");

        assertThat(options.endpointScheme()).isNull();
        assertThat(options.endpointAddress()).isNull();
    }

    @Test
    void passesConfigThroughVerbatim() {
        WorkerConfig config = WorkerConfig.builder()
                .projectId("acme").topic("t").subscriptionName("s")
                .alternativeHost("memory://x").credentialsJson("{\"type\":\"sa\"}")
                .build();

        ClientOptions options = ClientOptions.from(config, "SubIngest/2.0");

        assertThat(options.getProjectId()).isEqualTo("acme");
        assertThat(options.getEndpoint()).isEqualTo("memory://x");
        assertThat(options.getCredentialsFile()).isNull();
        assertThat(new String(options.getCredentialsJson())).isEqualTo("{\"type\":\"sa\"}");
        assertThat(options.getUserAgent()).isEqualTo("SubIngest/2.0");
    }
}
