package com.slicer.infrastructure.config;

import com.slicer.domain.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.PropertyResolver;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed reader of the {@code slicer.*} server options.
 *
 * Options are read from the Spring environment (application.yml, system
 * properties, environment variables), coerced to their declared type and
 * checked against the allowed values. Used during startup only; not
 * thread-safe.
 */
@Slf4j
public class ConfigurationStore {

    public static final String PREFIX = "slicer.";

    private static final Set<String> TRUE_VALUES = Set.of("1", "yes", "true", "on");
    private static final Set<String> FALSE_VALUES = Set.of("0", "no", "false", "off");

    private final PropertyResolver source;
    private final Map<String, ConfigurationOption> options = new LinkedHashMap<>();

    public ConfigurationStore(PropertyResolver source) {
        this.source = source;
    }

    /**
     * Resolve an option.
     *
     * @param name         option name without the {@code slicer.} prefix
     * @param defaultValue value used when the option is not configured
     * @param type         type the configured text is coerced to
     * @param allowed      allowed values, null to accept any value
     * @return the resolved value
     * @throws ConfigurationException if the value can't be coerced, is not
     *                                allowed, or the option was already configured
     */
    public Object configure(String name, Object defaultValue, OptionType type, Collection<?> allowed) {
        if (options.containsKey(name)) {
            throw new ConfigurationException("Option '" + name + "' is already configured");
        }

        String raw = source.getProperty(PREFIX + name);
        Object value = raw != null ? coerce(name, raw, type) : defaultValue;

        if (allowed != null && !allowed.contains(value)) {
            throw new ConfigurationException("Invalid value '" + value + "' for option '" + name + "'");
        }

        List<?> allowedList = allowed != null ? List.copyOf(allowed) : null;
        options.put(name, new ConfigurationOption(name, value, type, allowedList));
        log.debug("Configured option {}={} ({})", name, value, raw != null ? "configured" : "default");
        return value;
    }

    public boolean configureBoolean(String name, boolean defaultValue) {
        return (Boolean) configure(name, defaultValue, OptionType.BOOL, null);
    }

    public int configureInt(String name, int defaultValue) {
        return (Integer) configure(name, defaultValue, OptionType.INT, null);
    }

    public String configureString(String name, String defaultValue, Collection<String> allowed) {
        return (String) configure(name, defaultValue, OptionType.STRING, allowed);
    }

    public Optional<ConfigurationOption> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    public List<ConfigurationOption> options() {
        return List.copyOf(options.values());
    }

    private static Object coerce(String name, String raw, OptionType type) {
        switch (type) {
            case BOOL:
                return parseBoolean(name, raw);
            case INT:
                try {
                    return Integer.parseInt(raw.trim());
                } catch (NumberFormatException e) {
                    throw new ConfigurationException("Option '" + name + "' should be an integer, got '" + raw + "'", e);
                }
            default:
                return raw;
        }
    }

    private static boolean parseBoolean(String name, String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        if (TRUE_VALUES.contains(value)) {
            return true;
        }
        if (FALSE_VALUES.contains(value)) {
            return false;
        }
        throw new ConfigurationException("Option '" + name + "' should be a boolean, got '" + raw + "'");
    }
}
