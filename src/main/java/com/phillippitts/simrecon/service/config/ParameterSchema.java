package com.phillippitts.simrecon.service.config;

import com.phillippitts.simrecon.exception.ValidationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Set of valid parameter keys for one engine entry point, with their types and descriptions.
 */
public final class ParameterSchema {

    /**
     * One valid key.
     *
     * @param key parameter key as used in config files and on the engine command line
     * @param type value type
     * @param description help text for generated command-line options
     */
    public record ParameterSpec(String key, ParameterType type, String description) {
        public ParameterSpec {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(type, "type");
        }
    }

    private final String name;
    private final Map<String, ParameterSpec> specs;

    private ParameterSchema(String name, Map<String, ParameterSpec> specs) {
        this.name = name;
        this.specs = Collections.unmodifiableMap(specs);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public boolean contains(String key) {
        return specs.containsKey(key);
    }

    public ParameterSpec spec(String key) {
        return specs.get(key);
    }

    public Collection<ParameterSpec> specs() {
        return specs.values();
    }

    /**
     * Returns the entries of {@code settings} whose key belongs to this schema, coerced to
     * the key's type. Null values are kept so merges can tell "cleared" from "absent".
     */
    public Map<String, Object> select(Map<String, Object> settings) {
        Map<String, Object> selected = new LinkedHashMap<>();
        settings.forEach((key, value) -> {
            ParameterSpec spec = specs.get(key);
            if (spec != null) {
                selected.put(key, ConfigMerger.isUnsetValue(value) ? null : spec.type().coerce(key, value));
            }
        });
        return selected;
    }

    /**
     * Rejects any key of {@code settings} that this schema does not define.
     *
     * @param source description of where the settings came from, for the error message
     * @throws ValidationException listing the unknown keys
     */
    public void validate(Map<String, Object> settings, String source) {
        Set<String> unknown = new TreeSet<>();
        for (String key : settings.keySet()) {
            if (!specs.containsKey(key)) {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ValidationException("Invalid " + name + " setting(s) in " + source + ": " + unknown);
        }
    }

    public static final class Builder {
        private final String name;
        private final Map<String, ParameterSpec> specs = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder add(String key, ParameterType type, String description) {
            specs.put(key, new ParameterSpec(key, type, description));
            return this;
        }

        public ParameterSchema build() {
            return new ParameterSchema(name, new LinkedHashMap<>(specs));
        }
    }
}
