package com.skanga.dbgate.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.text.MessageFormat;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads externalized message templates from YAML resources on the classpath.
 * Templates are formatted with {@link MessageFormat}, so placeholders are {@code {0}}, {@code {1}}, ...
 *
 * <p>Template formatting failures are propagated as {@link IllegalArgumentException}
 * so that a broken resource file is detected instead of silently producing garbage.
 */
public final class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    static final String ERROR_MESSAGES = "error-messages.yaml";
    static final String TOOL_DESCRIPTIONS = "tool-descriptions.yaml";

    // Resources never change at runtime, so entries are loaded once
    static final Map<String, Map<String, String>> yamlCache = new ConcurrentHashMap<>();

    private ResourceManager() {
    }

    /**
     * Gets an error message with parameters.
     *
     * @param messageKey The error message template key
     * @param paramsList Parameters for template formatting
     * @return Formatted error message, or a "not found" marker naming the key
     * @throws IllegalArgumentException if template formatting fails
     */
    public static String getErrorMessage(String messageKey, Object... paramsList) {
        return format(ERROR_MESSAGES, messageKey, "Error message not found: " + messageKey, paramsList);
    }

    /**
     * Gets the description text declared for a tool or one of its parameters.
     *
     * @param descriptionKey key such as {@code execute-query} or {@code param.sql}
     * @return the description, or an empty string when it is not declared
     */
    public static String getToolDescription(String descriptionKey) {
        if (descriptionKey == null) {
            return "";
        }
        return loadYamlResource(TOOL_DESCRIPTIONS).getOrDefault(descriptionKey, "");
    }

    private static String format(String resourcePath, String key, String fallback, Object... paramsList) {
        if (key == null) {
            return fallback;
        }
        String template = loadYamlResource(resourcePath).getOrDefault(key, fallback);
        try {
            return MessageFormat.format(template, paramsList);
        } catch (IllegalArgumentException e) {
            String errorMsg = String.format("Failed to format template '%s' from %s with %d parameters: %s",
                    key, resourcePath, paramsList != null ? paramsList.length : 0, e.getMessage());
            logger.error(errorMsg, e);
            throw new IllegalArgumentException(errorMsg, e);
        }
    }

    /**
     * Loads a flat YAML resource into a key/value map, caching the result.
     * A missing or unreadable resource yields an empty map and is not cached.
     */
    static Map<String, String> loadYamlResource(String resourcePath) {
        Map<String, String> cached = yamlCache.get(resourcePath);
        if (cached != null) {
            return cached;
        }

        Map<String, String> yamlMap = new HashMap<>();
        try (InputStream inputStream = ResourceManager.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                logger.warn("YAML resource file not found: {}", resourcePath);
                return yamlMap;
            }
            JsonNode rootNode = yamlMapper.readTree(inputStream);
            rootNode.fields().forEachRemaining(entry -> yamlMap.put(entry.getKey(), entry.getValue().asText()));
            logger.debug("Loaded YAML resource file: {} with {} entries", resourcePath, yamlMap.size());
        } catch (IOException e) {
            logger.error("Failed to load YAML resource file: {}", resourcePath, e);
            return yamlMap;
        }

        Map<String, String> immutable = Collections.unmodifiableMap(yamlMap);
        yamlCache.put(resourcePath, immutable);
        return immutable;
    }
}
