package com.tiergate.config;

import com.tiergate.core.Tier;
import com.tiergate.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads engine configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static GateConfig load(String path) {
        log.info("Loading Tiergate configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Configuration not found: " + path);
        }
        try (InputStream inputStream = resource.getInputStream()) {
            return parse(inputStream);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    /**
     * Parse configuration from a YAML stream.
     */
    @SuppressWarnings("unchecked")
    public static GateConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object loaded;
        try {
            loaded = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Configuration is not valid YAML: " + e.getMessage(), e);
        }

        if (loaded == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        if (!(loaded instanceof Map)) {
            throw new ConfigurationException("Configuration root must be a mapping");
        }
        Map<String, Object> root = (Map<String, Object>) loaded;

        // Section may be at root or under 'tiergate' key
        Map<String, Object> gateConfig = root.containsKey("tiergate")
                ? getMap(root, "tiergate")
                : root;

        String name = getString(gateConfig, "name", "default-gate");
        ExecutionConfig execution = parseExecution(getMap(gateConfig, "execution"));
        Map<Tier, Long> tierTimeouts = parseTierTimeouts(getMap(gateConfig, "tiers"));
        List<FamilyConfig> families = parseFamilies(getList(gateConfig, "families"));
        List<CatalogEntry> catalog = parseCatalog(getList(gateConfig, "tasks"));

        GateConfig config = new GateConfig(name, execution, tierTimeouts, families, catalog);

        log.info("Loaded Tiergate configuration: {} with {} families, {} catalog entries, timeout cap {}ms",
                name, families.size(), catalog.size(), execution.timeoutMs());

        return config;
    }

    private static ExecutionConfig parseExecution(Map<String, Object> map) {
        ExecutionConfig defaults = ExecutionConfig.defaults();
        if (map == null) {
            return defaults;
        }
        long timeoutMs = getLong(map, "timeout-ms", defaults.timeoutMs());
        boolean fallback = getBoolean(map, "fallback-to-sequential", defaults.fallbackToSequential());
        boolean verbose = getBoolean(map, "verbose", defaults.verbose());
        long killGraceMs = getLong(map, "kill-grace-ms", defaults.killGraceMs());
        String workingDirectory = getString(map, "working-directory", null);

        if (killGraceMs < 0) {
            throw new ConfigurationException("execution.kill-grace-ms must not be negative: " + killGraceMs);
        }
        return new ExecutionConfig(timeoutMs, fallback, verbose, killGraceMs, workingDirectory);
    }

    private static Map<Tier, Long> parseTierTimeouts(Map<String, Object> map) {
        Map<Tier, Long> timeouts = new EnumMap<>(Tier.class);
        if (map == null) {
            return timeouts;
        }
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            Tier tier = requireTier(entry.getKey(), "tiers");
            if (!(entry.getValue() instanceof Map<?, ?>)) {
                throw new ConfigurationException("tiers." + entry.getKey() + " must be a mapping");
            }
            Map<String, Object> tierMap = getMap(map, entry.getKey());
            long timeoutMs = getLong(tierMap, "timeout-ms", tier.defaultTimeoutMs());
            if (timeoutMs <= 0) {
                throw new ConfigurationException("tiers." + entry.getKey() + ".timeout-ms must be positive");
            }
            timeouts.put(tier, timeoutMs);
            log.debug("Parsed tier timeout: tier={}, timeoutMs={}", tier.label(), timeoutMs);
        }
        return timeouts;
    }

    private static List<FamilyConfig> parseFamilies(List<Map<String, Object>> list) {
        if (list == null) {
            return List.of();
        }
        List<FamilyConfig> families = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> item = list.get(i);
            String name = getString(item, "name", null);
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("families[" + i + "] has no name");
            }
            if (!seen.add(name)) {
                throw new ConfigurationException("Duplicate family '" + name + "'");
            }
            String tierLabel = getString(item, "tier", null);
            Tier tier = tierLabel != null ? requireTier(tierLabel, "families[" + i + "].tier") : Tier.MEDIUM;
            families.add(new FamilyConfig(name, tier, getString(item, "description", "")));
        }
        return families;
    }

    private static List<CatalogEntry> parseCatalog(List<Map<String, Object>> list) {
        if (list == null) {
            return List.of();
        }
        List<CatalogEntry> entries = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> item = list.get(i);
            String command = getString(item, "command", null);
            if (command == null || command.isBlank()) {
                throw new ConfigurationException("tasks[" + i + "] has no command");
            }
            String tierLabel = getString(item, "tier", null);
            Tier tier = tierLabel != null ? requireTier(tierLabel, "tasks[" + i + "].tier") : null;
            Long timeoutMs = item.containsKey("timeout-ms") ? getLong(item, "timeout-ms", 0) : null;
            if (timeoutMs != null && timeoutMs <= 0) {
                throw new ConfigurationException("tasks[" + i + "].timeout-ms must be positive");
            }
            entries.add(new CatalogEntry(
                    command,
                    tier,
                    getString(item, "family", null),
                    timeoutMs,
                    getString(item, "description", null)
            ));
            log.debug("Parsed catalog entry: command={}, tier={}", command, tierLabel);
        }
        return entries;
    }

    private static Tier requireTier(String label, String location) {
        return Tier.fromLabel(label)
                .orElseThrow(() -> new ConfigurationException(
                        "Unknown tier '" + label + "' at " + location));
    }

    // Helper methods

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof Map) return (Map<String, Object>) value;
        throw new ConfigurationException("'" + key + "' must be a mapping");
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> getList(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (value instanceof List) return (List<Map<String, Object>>) value;
        throw new ConfigurationException("'" + key + "' must be a list");
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number: " + value, e);
        }
    }
}
