package com.phillippitts.simrecon.service.config;

import com.phillippitts.simrecon.exception.ValidationException;

import java.util.Locale;

/**
 * Value types accepted by engine parameters, with lenient coercion from config file values.
 */
public enum ParameterType {
    INTEGER(Integer.class),
    DOUBLE(Double.class),
    BOOLEAN(Boolean.class),
    STRING(String.class);

    private final Class<?> javaType;

    ParameterType(Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> javaType() {
        return javaType;
    }

    /**
     * Converts a raw value (YAML scalar or command-line value) to this type.
     * Null passes through unchanged.
     *
     * @throws ValidationException when the value cannot be converted
     */
    public Object coerce(String key, Object raw) {
        if (raw == null) {
            return null;
        }
        try {
            switch (this) {
                case INTEGER:
                    if (raw instanceof Number n) {
                        if (n.doubleValue() != Math.rint(n.doubleValue())) {
                            throw new ValidationException("'" + key + "' must be an integer, got " + raw);
                        }
                        return n.intValue();
                    }
                    return Integer.valueOf(raw.toString().trim());
                case DOUBLE:
                    if (raw instanceof Number n) {
                        return n.doubleValue();
                    }
                    return Double.valueOf(raw.toString().trim());
                case BOOLEAN:
                    if (raw instanceof Boolean b) {
                        return b;
                    }
                    String text = raw.toString().trim().toLowerCase(Locale.ROOT);
                    if (text.equals("true") || text.equals("yes") || text.equals("1")) {
                        return Boolean.TRUE;
                    }
                    if (text.equals("false") || text.equals("no") || text.equals("0")) {
                        return Boolean.FALSE;
                    }
                    throw new ValidationException("'" + key + "' must be a boolean, got " + raw);
                default:
                    return raw.toString();
            }
        } catch (NumberFormatException e) {
            throw new ValidationException("'" + key + "' must be " + name().toLowerCase(Locale.ROOT)
                    + ", got " + raw);
        }
    }
}
