package io.flowcheck;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tunable settings for an analysis run, optionally loaded from a YAML file:
 * <pre>
 * nestingThreshold: 3      # DEEP_NESTING when this many decisions precede a decision
 * maxCycles: 0             # stop cycle enumeration after this many cycles (0 = unbounded)
 * maxPaths: 0              # stop path enumeration per start/target pair (0 = unbounded)
 * disabledRules:           # rule ids to skip
 *   - nesting-depth
 * </pre>
 */
public class AnalysisConfig {

    public static final int DEFAULT_NESTING_THRESHOLD = 3;

    private static final AnalysisConfig DEFAULTS =
            new AnalysisConfig(DEFAULT_NESTING_THRESHOLD, 0, 0, Set.of());

    private final int nestingThreshold;
    private final int maxCycles;
    private final int maxPaths;
    private final Set<String> disabledRules;

    private AnalysisConfig(int nestingThreshold, int maxCycles, int maxPaths, Set<String> disabledRules) {
        if (nestingThreshold < 1) {
            throw new IllegalArgumentException("nestingThreshold must be at least 1, got " + nestingThreshold);
        }
        if (maxCycles < 0 || maxPaths < 0) {
            throw new IllegalArgumentException("maxCycles and maxPaths cannot be negative");
        }
        this.nestingThreshold = nestingThreshold;
        this.maxCycles = maxCycles;
        this.maxPaths = maxPaths;
        this.disabledRules = disabledRules;
    }

    /**
     * Returns the default configuration: threshold 3, unbounded enumeration, all rules enabled.
     */
    public static AnalysisConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Load configuration from a YAML file. Missing keys keep their defaults.
     *
     * @throws IOException if the file cannot be read or holds invalid values
     */
    public static AnalysisConfig load(Path configPath) throws IOException {
        Yaml yaml = new Yaml();

        try (InputStream in = Files.newInputStream(configPath)) {
            Object loaded = yaml.load(in);
            if (loaded == null) {
                return defaults();
            }
            if (!(loaded instanceof Map<?, ?> data)) {
                throw new IOException("Config file must contain a mapping: " + configPath);
            }

            Builder builder = builder();
            builder.nestingThreshold(getInt(data, "nestingThreshold", DEFAULT_NESTING_THRESHOLD, configPath));
            builder.maxCycles(getInt(data, "maxCycles", 0, configPath));
            builder.maxPaths(getInt(data, "maxPaths", 0, configPath));
            builder.disabledRules(getStringList(data, "disabledRules", configPath));
            return builder.build();
        } catch (YAMLException e) {
            throw new IOException("Invalid YAML in config file " + configPath + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid config file " + configPath + ": " + e.getMessage(), e);
        }
    }

    private static int getInt(Map<?, ?> data, String key, int defaultValue, Path configPath) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Integer i) {
            return i;
        }
        throw new IOException("'" + key + "' must be an integer in " + configPath + ", got: " + value);
    }

    private static List<String> getStringList(Map<?, ?> data, String key, Path configPath) throws IOException {
        Object value = data.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IOException("'" + key + "' must be a list in " + configPath);
        }
        return list.stream()
                .filter(item -> item != null && !item.toString().isBlank())
                .map(item -> item.toString().trim())
                .toList();
    }

    public int getNestingThreshold() {
        return nestingThreshold;
    }

    public int getMaxCycles() {
        return maxCycles;
    }

    public int getMaxPaths() {
        return maxPaths;
    }

    public Set<String> getDisabledRules() {
        return disabledRules;
    }

    public boolean isRuleEnabled(String ruleId) {
        return !disabledRules.contains(ruleId);
    }

    /**
     * Returns a copy with a different nesting threshold.
     */
    public AnalysisConfig withNestingThreshold(int threshold) {
        return new AnalysisConfig(threshold, maxCycles, maxPaths, disabledRules);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int nestingThreshold = DEFAULT_NESTING_THRESHOLD;
        private int maxCycles;
        private int maxPaths;
        private final Set<String> disabledRules = new LinkedHashSet<>();

        public Builder nestingThreshold(int nestingThreshold) {
            this.nestingThreshold = nestingThreshold;
            return this;
        }

        public Builder maxCycles(int maxCycles) {
            this.maxCycles = maxCycles;
            return this;
        }

        public Builder maxPaths(int maxPaths) {
            this.maxPaths = maxPaths;
            return this;
        }

        public Builder disabledRules(Collection<String> ruleIds) {
            this.disabledRules.addAll(ruleIds);
            return this;
        }

        public Builder disableRule(String ruleId) {
            this.disabledRules.add(ruleId);
            return this;
        }

        public AnalysisConfig build() {
            return new AnalysisConfig(nestingThreshold, maxCycles, maxPaths,
                    Collections.unmodifiableSet(new LinkedHashSet<>(disabledRules)));
        }
    }
}
