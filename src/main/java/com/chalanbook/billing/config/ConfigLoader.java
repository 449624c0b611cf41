package com.chalanbook.billing.config;

import com.chalanbook.billing.exception.BillingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static com.chalanbook.billing.config.BillingConfigConstants.*;

/**
 * Billing configuration loader.
 * Reads an optional JSON file and environment variables and merges them,
 * later sources overriding earlier ones.
 */
public class ConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper objectMapper;

    public ConfigLoader() {
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Load configuration from a JSON file
     *
     * @param path path to JSON configuration file
     * @return configuration map
     * @throws BillingException if file not found or invalid JSON
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> fromFile(String path) {
        Path filePath = Paths.get(path).toAbsolutePath();

        if (!Files.exists(filePath)) {
            throw new BillingException("Configuration file not found: " + filePath, "CONFIG_FILE_NOT_FOUND");
        }

        try {
            JsonNode rootNode = objectMapper.readTree(filePath.toFile());
            if (rootNode == null || !rootNode.isObject()) {
                throw new BillingException("Configuration file is not a JSON object: " + filePath, "CONFIG_PARSE_ERROR");
            }
            return objectMapper.convertValue(rootNode, Map.class);
        } catch (IOException e) {
            throw new BillingException("Invalid JSON in configuration file: " + filePath, "CONFIG_PARSE_ERROR", e);
        }
    }

    /**
     * Load configuration from the process environment
     */
    public Map<String, Object> fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Load configuration from the given environment variables
     *
     * @param env variable name to value
     * @return configuration map
     */
    public Map<String, Object> fromEnvironment(Map<String, String> env) {
        Map<String, Object> config = new HashMap<>();

        for (Map.Entry<String, String> entry : ENV_VAR_MAPPING.entrySet()) {
            String value = env.get(entry.getKey());
            if (value != null && !value.isEmpty()) {
                config.put(entry.getValue(), parseEnvValue(entry.getValue(), value));
            }
        }

        return config;
    }

    /**
     * Merge multiple configuration sources
     * Priority: later sources override earlier sources
     *
     * @param sources configuration maps in order of increasing priority
     * @return merged configuration
     */
    @SafeVarargs
    public final Map<String, Object> merge(Map<String, Object>... sources) {
        Map<String, Object> merged = new HashMap<>();

        for (Map<String, Object> source : sources) {
            for (Map.Entry<String, Object> entry : source.entrySet()) {
                if (entry.getValue() != null) {
                    merged.put(entry.getKey(), entry.getValue());
                }
            }
        }

        return merged;
    }

    /**
     * Resolve configuration map to a BillingConfig
     *
     * @param configMap configuration map
     * @return validated config
     */
    public BillingConfig resolve(Map<String, Object> configMap) {
        BillingConfig.Builder builder = BillingConfig.builder();

        if (configMap.containsKey(KEY_DATABASE_FILE)) {
            builder.databaseFile(String.valueOf(configMap.get(KEY_DATABASE_FILE)));
        }
        if (configMap.containsKey(KEY_PDF_DIRECTORY)) {
            builder.pdfDirectory(String.valueOf(configMap.get(KEY_PDF_DIRECTORY)));
        }
        if (configMap.containsKey(KEY_TEMPLATE_DIRECTORY)) {
            builder.templateDirectory(String.valueOf(configMap.get(KEY_TEMPLATE_DIRECTORY)));
        }
        if (configMap.containsKey(KEY_OPEN_PDF_AFTER_EXPORT)) {
            builder.openPdfAfterExport(toBoolean(configMap.get(KEY_OPEN_PDF_AFTER_EXPORT), DEFAULT_OPEN_PDF_AFTER_EXPORT));
        }

        return builder.build();
    }

    /**
     * Load, merge, and resolve configuration.
     *
     * <p>When {@code filePath} is null, {@value BillingConfigConstants#DEFAULT_CONFIG_FILE}
     * in the working directory is used if present.
     *
     * @param filePath explicit JSON configuration file, or null
     * @return resolved config
     */
    public BillingConfig load(String filePath) {
        Map<String, Object> fileConfig = new HashMap<>();
        if (filePath != null) {
            fileConfig = fromFile(filePath);
            logger.info("Loaded configuration from {}", filePath);
        } else if (Files.exists(Paths.get(DEFAULT_CONFIG_FILE))) {
            fileConfig = fromFile(DEFAULT_CONFIG_FILE);
            logger.info("Loaded configuration from {}", DEFAULT_CONFIG_FILE);
        }
        return resolve(merge(fileConfig, fromEnvironment()));
    }

    private Object parseEnvValue(String key, String value) {
        if (KEY_OPEN_PDF_AFTER_EXPORT.equals(key)) {
            return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
        }
        return value;
    }

    private boolean toBoolean(Object value, boolean defaultValue) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value == null) {
            return defaultValue;
        }
        String s = String.valueOf(value).trim();
        return "true".equalsIgnoreCase(s) || "1".equals(s) || "yes".equalsIgnoreCase(s);
    }
}
