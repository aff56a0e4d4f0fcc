package com.layout.config;

import com.layout.exception.ConfigurationException;
import com.layout.policy.Combinator;
import com.layout.policy.End;
import com.layout.policy.PolicyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads policy set configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
    }

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static PolicySetConfig load(String path) {
        log.info("Loading policy configuration from: {}", path);

        Resource resource = getResource(path);
        if (!resource.exists()) {
            throw new ConfigurationException("Policy configuration not found: " + path);
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
    public static PolicySetConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Object document;
        try {
            document = yaml.load(inputStream);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Policy configuration is not valid YAML", e);
        }

        if (document == null) {
            throw new ConfigurationException("Configuration file is empty");
        }
        Map<String, Object> root = asMap(document, "document root");

        // The policy set may sit at the root or under 'layout'
        Map<String, Object> setConfig = root.containsKey("layout")
                ? asMap(root.get("layout"), "layout")
                : root;

        String name = getString(setConfig, "name", "default-policies");
        String version = getString(setConfig, "version", "1.0");
        Combinator combinator = parseEnum(Combinator.class,
                getString(setConfig, "combinator", "AND_THEN"), "combinator");

        List<PolicyConfig> policies = parsePolicies(setConfig.get("policies"), "policies");

        if (policies.isEmpty()) {
            log.warn("No policies configured for '{}', paths start without constraints", name);
        }

        PolicySetConfig config = new PolicySetConfig(name, version, combinator, policies);
        log.info("Loaded policy configuration: {} v{} with {} root policies, combinator: {}",
                name, version, policies.size(), combinator);
        return config;
    }

    private static List<PolicyConfig> parsePolicies(Object value, String where) {
        if (value == null) {
            return List.of();
        }
        List<?> list = asList(value, where);
        List<PolicyConfig> policies = new ArrayList<>();
        for (int i = 0; i < list.size(); i++) {
            String entry = where + "[" + i + "]";
            if (list.get(i) == null) {
                throw new ConfigurationException("Empty policy entry at " + entry);
            }
            policies.add(parsePolicy(asMap(list.get(i), entry), entry));
        }
        return policies;
    }

    private static PolicyConfig parsePolicy(Map<String, Object> map, String where) {
        PolicyType type = parseEnum(PolicyType.class, getString(map, "type", "CLAUSE"), where + ".type");
        String label = getString(map, "label", null);
        EndConfig end = parseEnd(map.get("end"), where + ".end");
        boolean noDequeue = getBoolean(map, "no-dequeue", false);
        OverrideConfig override = parseOverride(map.get("override"), where + ".override");
        List<PolicyConfig> nested = null;
        if (map.get("policies") != null) {
            nested = parsePolicies(map.get("policies"), where + ".policies");
        }

        log.debug("Parsed policy at {}: type={}, label={}, end={}", where, type, label, end);
        return new PolicyConfig(type, label, end, noDequeue, override, nested);
    }

    private static EndConfig parseEnd(Object value, String where) {
        if (value == null) {
            return null;
        }
        Map<String, Object> map = asMap(value, where);
        Object kind = map.get("kind");
        if (kind == null) {
            throw new ConfigurationException("End boundary at " + where + " requires a kind");
        }
        if (map.get("pos") == null) {
            throw new ConfigurationException("End boundary at " + where + " requires a pos");
        }
        return new EndConfig(parseEndKind(kind, where + ".kind"), getInt(map, "pos", 0, where));
    }

    /**
     * YAML 1.1 reads a bare {@code ON} as boolean true.
     */
    private static End parseEndKind(Object kind, String where) {
        if (Boolean.TRUE.equals(kind)) {
            return End.ON;
        }
        return parseEnum(End.class, kind.toString(), where);
    }

    private static OverrideConfig parseOverride(Object value, String where) {
        if (value == null) {
            return null;
        }
        Map<String, Object> map = asMap(value, where);
        String action = getString(map, "action", null);
        List<?> splits = map.get("splits") != null ? asList(map.get("splits"), where + ".splits") : null;
        return new OverrideConfig(
                getString(map, "left", null),
                getString(map, "right", null),
                action != null ? parseEnum(ActionType.class, action, where + ".action") : null,
                splits != null ? splits.stream().map(String::valueOf).toList() : null
        );
    }

    // Helper methods

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String where) {
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT).replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown " + type.getSimpleName() + " '" + value + "' at " + where, e);
        }
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String where) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("Expected a mapping at " + where + " but got: " + value);
        }
        return (Map<String, Object>) value;
    }

    private static List<?> asList(Object value, String where) {
        if (!(value instanceof List)) {
            throw new ConfigurationException("Expected a list at " + where + " but got: " + value);
        }
        return (List<?>) value;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue, String where) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Integer) return (Integer) value;
        try {
            if (value instanceof Long) return Math.toIntExact((Long) value);
            if (value instanceof Number) {
                throw new ConfigurationException("Expected an integer for '" + key + "' at " + where + " but got: " + value);
            }
            return Integer.parseInt(value.toString());
        } catch (ArithmeticException | NumberFormatException e) {
            throw new ConfigurationException("Expected an integer for '" + key + "' at " + where + " but got: " + value, e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }
}
