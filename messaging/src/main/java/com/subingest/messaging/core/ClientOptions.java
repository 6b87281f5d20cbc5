/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.messaging.core;

import com.subingest.common.config.WorkerConfig;

/**
 * Connection settings passed through verbatim to a message-source client.
 * At most one of {@code credentialsFile} and {@code credentialsJson} is set.
 */
public final class ClientOptions {

    private final String projectId;
    private final String endpoint;
    private final String credentialsFile;
    private final byte[] credentialsJson;
    private final String userAgent;

    public ClientOptions(String projectId, String endpoint, String credentialsFile,
                         byte[] credentialsJson, String userAgent) {
        this.projectId = projectId;
        this.endpoint = endpoint;
        this.credentialsFile = credentialsFile;
        this.credentialsJson = credentialsJson;
        this.userAgent = userAgent;
    }

    public static ClientOptions from(WorkerConfig config, String userAgent) {
        return new ClientOptions(config.getProjectId(), config.getAlternativeHost(),
                config.getCredentialsFile(), config.getCredentialsJsonBytes(), userAgent);
    }

    /**
     * Scheme of the endpoint ({@code memory} for {@code memory://local}), or null
     * when no alternate endpoint is configured or it carries no scheme.
     */
    public String endpointScheme() {
        if (endpoint == null) return null;
        int idx = endpoint.indexOf("://");
        return idx > 0 ? endpoint.substring(0, idx) : null;
    }

    /**
     * Endpoint with any scheme prefix removed.
     */
    public String endpointAddress() {
        if (endpoint == null) return null;
        int idx = endpoint.indexOf("://");
        return idx >= 0 ? endpoint.substring(idx + 3) : endpoint;
    }

    public String getProjectId() { return projectId; }
    public String getEndpoint() { return endpoint; }
    public String getCredentialsFile() { return credentialsFile; }
    public byte[] getCredentialsJson() { return credentialsJson; }
    public String getUserAgent() { return userAgent; }
}
