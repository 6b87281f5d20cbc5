/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.subingest.common.util;

import com.subingest.common.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${key}} and {@code ${key:defaultValue}} placeholders in input
 * configuration values. Lookup order:
 *
 * <ol>
 *   <li>JVM system properties ({@code -Dkey=value})</li>
 *   <li>application properties handed to the resolver</li>
 *   <li>environment variables</li>
 *   <li>the inline default after the colon</li>
 * </ol>
 *
 * <p>A placeholder that resolves nowhere is a {@link ConfigurationException}.
 * Use {@code \:} to put a literal colon in a default, e.g.
 * {@code ${pubsub.host:memory\://local}}.</p>
 */
public class ConfigPropertyResolver {

    private static final Logger log = LoggerFactory.getLogger(ConfigPropertyResolver.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private final Properties appProperties;
    private final Function<String, String> environment;

    public ConfigPropertyResolver() {
        this(new Properties());
    }

    public ConfigPropertyResolver(Properties properties) {
        this(properties, System::getenv);
    }

    public ConfigPropertyResolver(Properties properties, Function<String, String> environment) {
        this.appProperties = properties != null ? properties : new Properties();
        this.environment = environment;
    }

    public void loadClasspathProperties(String resource) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                appProperties.load(is);
                log.info("Loaded {} properties from classpath:{}", appProperties.size(), resource);
            }
        } catch (IOException e) {
            log.warn("Could not load classpath properties {}: {}", resource, e.getMessage());
        }
    }

    /**
     * Replace every placeholder in a single value.
     *
     * @throws ConfigurationException if a placeholder cannot be resolved
     */
    public String resolve(String value) {
        if (value == null || !value.contains("${")) return value;

        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String resolved = resolveExpression(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Deep copy of a configuration tree with all string leaves resolved.
     * The input tree is left untouched.
     */
    public Map<String, Object> resolveTree(Map<String, Object> tree) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (tree == null) return out;
        tree.forEach((k, v) -> out.put(k, resolveValue(v)));
        return out;
    }

    @SuppressWarnings("unchecked")
    private Object resolveValue(Object val) {
        if (val instanceof String s) return resolve(s);
        if (val instanceof Map<?, ?> m) return resolveTree((Map<String, Object>) m);
        if (val instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) out.add(resolveValue(item));
            return out;
        }
        return val;
    }

    private String resolveExpression(String expr) {
        String key;
        String defaultValue = null;

        int colonIdx = findUnescapedColon(expr);
        if (colonIdx >= 0) {
            key = expr.substring(0, colonIdx).trim();
            defaultValue = expr.substring(colonIdx + 1).replace("\\:", ":");
        } else {
            key = expr.trim();
        }

        String val = System.getProperty(key);
        if (val != null) {
            log.debug("Resolved placeholder {} from JVM system property", key);
            return val;
        }
        val = appProperties.getProperty(key);
        if (val != null) {
            log.debug("Resolved placeholder {} from application properties", key);
            return val;
        }
        val = environment.apply(key);
        if (val != null) {
            log.debug("Resolved placeholder {} from environment variable", key);
            return val;
        }
        if (defaultValue != null) {
            log.debug("Resolved placeholder {} using inline default", key);
            return defaultValue;
        }

        throw new ConfigurationException("Cannot resolve configuration placeholder ${" + key + "}. "
                + "Provide it as -D" + key + "=value, an application property, "
                + "an environment variable, or an inline default ${" + key + ":value}");
    }

    private int findUnescapedColon(String expr) {
        for (int i = 0; i < expr.length(); i++) {
            if (expr.charAt(i) == ':' && (i == 0 || expr.charAt(i - 1) != '\\')) {
                return i;
            }
        }
        return -1;
    }
}
