/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.config;

import com.subingest.common.exception.ConfigurationException;
import com.subingest.common.util.ConfigIdentity;
import com.subingest.common.util.Durations;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable configuration of one pub/sub input worker.
 *
 * <p>Built either programmatically through {@link #builder()} or from a
 * parsed JSON tree through {@link #fromMap(Map)}:</p>
 * <pre>
 * {
 *   "id": "orders",
 *   "type": "gcp-pubsub",
 *   "project_id": "acme-prod",
 *   "topic": "orders",
 *   "subscription": { "name": "orders-ingest", "create": true,
 *                     "num_goroutines": 2, "max_outstanding_messages": 500 },
 *   "credentials_file": "/etc/subingest/sa.json",
 *   "retry_interval": "30s"
 * }
 * </pre>
 */
public final class WorkerConfig {

    public static final boolean DEFAULT_SUBSCRIPTION_CREATE = true;
    public static final int DEFAULT_NUM_GOROUTINES = 1;
    public static final int DEFAULT_MAX_OUTSTANDING_MESSAGES = 1000;
    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(30);

    private final String id;
    private final String type;
    private final boolean enabled;
    private final String projectId;
    private final String topic;
    private final String subscriptionName;
    private final boolean subscriptionCreate;
    private final int numGoroutines;
    private final int maxOutstandingMessages;
    private final String credentialsFile;
    private final String credentialsJson;
    private final String alternativeHost;
    private final Duration retryInterval;
    private final Map<String, Object> raw;

    private WorkerConfig(Builder b) {
        this.type = b.type;
        this.enabled = b.enabled;
        this.projectId = b.projectId;
        this.topic = b.topic;
        this.subscriptionName = b.subscriptionName;
        this.subscriptionCreate = b.subscriptionCreate;
        this.numGoroutines = b.numGoroutines;
        this.maxOutstandingMessages = b.maxOutstandingMessages;
        this.credentialsFile = b.credentialsFile;
        this.credentialsJson = b.credentialsJson;
        this.alternativeHost = b.alternativeHost;
        this.retryInterval = b.retryInterval;
        this.raw = Collections.unmodifiableMap(b.raw != null ? new LinkedHashMap<>(b.raw) : toMap(b));
        this.id = b.id != null && !b.id.isBlank() ? b.id : ConfigIdentity.derive(this.raw);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse a configuration tree (placeholders already resolved) and validate it.
     *
     * @throws ConfigurationException on missing, malformed or conflicting values
     */
    public static WorkerConfig fromMap(Map<String, Object> tree) {
        if (tree == null) throw new ConfigurationException("input configuration is empty");
        Builder b = builder()
                .id(string(tree, "id"))
                .type(string(tree, "type"))
                .enabled(bool(tree, "enabled", true))
                .projectId(string(tree, "project_id"))
                .topic(string(tree, "topic"))
                .credentialsFile(string(tree, "credentials_file"))
                .credentialsJson(string(tree, "credentials_json"))
                .alternativeHost(string(tree, "alternative_host"));

        Object sub = tree.get("subscription");
        if (sub != null && !(sub instanceof Map)) {
            throw new ConfigurationException("'subscription' must be an object");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> subscription = sub != null ? (Map<String, Object>) sub : Map.of();
        b.subscriptionName(string(subscription, "name"))
                .subscriptionCreate(bool(subscription, "create", DEFAULT_SUBSCRIPTION_CREATE))
                .numGoroutines(integer(subscription, "num_goroutines", DEFAULT_NUM_GOROUTINES))
                .maxOutstandingMessages(integer(subscription, "max_outstanding_messages",
                        DEFAULT_MAX_OUTSTANDING_MESSAGES));

        String retry = string(tree, "retry_interval");
        if (retry != null) {
            try {
                b.retryInterval(Durations.parse(retry));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("'retry_interval': " + e.getMessage(), e);
            }
        }
        return b.raw(tree).build();
    }

    /**
     * @throws ConfigurationException describing the first problem found
     */
    public void validate() {
        require(projectId, "project_id");
        require(topic, "topic");
        require(subscriptionName, "subscription.name");
        if (numGoroutines < 1) {
            throw new ConfigurationException("'subscription.num_goroutines' must be at least 1, got " + numGoroutines);
        }
        if (maxOutstandingMessages == 0) {
            throw new ConfigurationException("'subscription.max_outstanding_messages' must be non-zero "
                    + "(negative means unlimited)");
        }
        if (credentialsFile != null && credentialsJson != null) {
            throw new ConfigurationException("'credentials_file' and 'credentials_json' are mutually exclusive");
        }
        if (credentialsFile != null) {
            Path path = Path.of(credentialsFile);
            if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
                throw new ConfigurationException("credentials file '" + credentialsFile + "' does not exist or is not readable");
            }
        }
        if (retryInterval == null || retryInterval.isNegative() || retryInterval.isZero()) {
            throw new ConfigurationException("'retry_interval' must be positive, got " + retryInterval);
        }
    }

    public boolean hasInlineCredentials() { return credentialsJson != null; }

    public byte[] getCredentialsJsonBytes() {
        return credentialsJson != null ? credentialsJson.getBytes(StandardCharsets.UTF_8) : null;
    }

    public String getId() { return id; }
    public String getType() { return type; }
    public boolean isEnabled() { return enabled; }
    public String getProjectId() { return projectId; }
    public String getTopic() { return topic; }
    public String getSubscriptionName() { return subscriptionName; }
    public boolean isSubscriptionCreate() { return subscriptionCreate; }
    public int getNumGoroutines() { return numGoroutines; }
    public int getMaxOutstandingMessages() { return maxOutstandingMessages; }
    public String getCredentialsFile() { return credentialsFile; }
    public String getCredentialsJson() { return credentialsJson; }
    public String getAlternativeHost() { return alternativeHost; }
    public Duration getRetryInterval() { return retryInterval; }
    public Map<String, Object> getRaw() { return raw; }

    @Override
    public String toString() {
        return "WorkerConfig{id=" + id + ", project=" + projectId + ", topic=" + topic
                + ", subscription=" + subscriptionName + "}";
    }

    // ─── Parsing helpers ────────────────────────────────────────────

    private static void require(String value, String key) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("missing required field '" + key + "'");
        }
    }

    private static String string(Map<String, Object> map, String key) {
        Object val = map.get(key);
        if (val == null) return null;
        String s = val.toString().trim();
        return s.isEmpty() ? null : s;
    }

    private static boolean bool(Map<String, Object> map, String key, boolean defaultValue) {
        Object val = map.get(key);
        if (val == null) return defaultValue;
        if (val instanceof Boolean b) return b;
        String s = val.toString().trim().toLowerCase();
        if (s.equals("true")) return true;
        if (s.equals("false")) return false;
        throw new ConfigurationException("'" + key + "' must be true or false, got '" + val + "'");
    }

    private static int integer(Map<String, Object> map, String key, int defaultValue) {
        Object val = map.get(key);
        if (val == null) return defaultValue;
        if (val instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || d < Integer.MIN_VALUE || d > Integer.MAX_VALUE) {
                throw new ConfigurationException("'" + key + "' must be an integer, got '" + val + "'");
            }
            return n.intValue();
        }
        try {
            return Integer.parseInt(val.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + val + "'", e);
        }
    }

    private static Map<String, Object> toMap(Builder b) {
        Map<String, Object> subscription = new LinkedHashMap<>();
        subscription.put("name", b.subscriptionName);
        subscription.put("create", b.subscriptionCreate);
        subscription.put("num_goroutines", b.numGoroutines);
        subscription.put("max_outstanding_messages", b.maxOutstandingMessages);

        Map<String, Object> map = new LinkedHashMap<>();
        if (b.id != null) map.put("id", b.id);
        if (b.type != null) map.put("type", b.type);
        map.put("project_id", b.projectId);
        map.put("topic", b.topic);
        map.put("subscription", subscription);
        if (b.credentialsFile != null) map.put("credentials_file", b.credentialsFile);
        if (b.credentialsJson != null) map.put("credentials_json", b.credentialsJson);
        if (b.alternativeHost != null) map.put("alternative_host", b.alternativeHost);
        map.put("retry_interval", String.valueOf(b.retryInterval));
        return map;
    }

    // ─── Builder ────────────────────────────────────────────────────

    public static final class Builder {
        private String id;
        private String type;
        private boolean enabled = true;
        private String projectId;
        private String topic;
        private String subscriptionName;
        private boolean subscriptionCreate = DEFAULT_SUBSCRIPTION_CREATE;
        private int numGoroutines = DEFAULT_NUM_GOROUTINES;
        private int maxOutstandingMessages = DEFAULT_MAX_OUTSTANDING_MESSAGES;
        private String credentialsFile;
        private String credentialsJson;
        private String alternativeHost;
        private Duration retryInterval = DEFAULT_RETRY_INTERVAL;
        private Map<String, Object> raw;

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder type(String type) { this.type = type; return this; }
        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }
        public Builder projectId(String projectId) { this.projectId = projectId; return this; }
        public Builder topic(String topic) { this.topic = topic; return this; }
        public Builder subscriptionName(String name) { this.subscriptionName = name; return this; }
        public Builder subscriptionCreate(boolean create) { this.subscriptionCreate = create; return this; }
        public Builder numGoroutines(int n) { this.numGoroutines = n; return this; }
        public Builder maxOutstandingMessages(int n) { this.maxOutstandingMessages = n; return this; }
        public Builder credentialsFile(String path) { this.credentialsFile = path; return this; }
        public Builder credentialsJson(String json) { this.credentialsJson = json; return this; }
        public Builder alternativeHost(String host) { this.alternativeHost = host; return this; }
        public Builder retryInterval(Duration interval) { this.retryInterval = interval; return this; }
        Builder raw(Map<String, Object> raw) { this.raw = raw; return this; }

        /**
         * @throws ConfigurationException if the configuration is invalid
         */
        public WorkerConfig build() {
            WorkerConfig config = new WorkerConfig(this);
            config.validate();
            return config;
        }
    }
}
