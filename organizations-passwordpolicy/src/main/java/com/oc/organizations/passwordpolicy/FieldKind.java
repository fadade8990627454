package com.oc.organizations.passwordpolicy;

import java.math.BigInteger;

/**
 * The declared kind of a model property. {@link #coerce} is the only conversion consulted on assignment.
 */
public enum FieldKind {

    INTEGER(Integer.class) {
        @Override
        Object convert(final String propertyName, final Object value) {
            if (value instanceof Number) {
                return toInt(propertyName, (Number) value);
            }
            if (value instanceof Boolean) {
                return ((Boolean) value) ? 1 : 0;
            }
            if (value instanceof String) {
                try {
                    return Integer.parseInt(((String) value).trim());
                } catch (final NumberFormatException e) {
                    throw new TypeConversionException(propertyName, value, this, e);
                }
            }
            throw new TypeConversionException(propertyName, value, this);
        }
    },

    BOOLEAN(Boolean.class) {
        @Override
        Object convert(final String propertyName, final Object value) {
            if (value instanceof Number) {
                return ((Number) value).doubleValue() != 0;
            }
            if (value instanceof String) {
                final String text = ((String) value).trim();
                if ("true".equalsIgnoreCase(text)) {
                    return Boolean.TRUE;
                }
                if ("false".equalsIgnoreCase(text)) {
                    return Boolean.FALSE;
                }
            }
            throw new TypeConversionException(propertyName, value, this);
        }
    },

    STRING(String.class) {
        @Override
        Object convert(final String propertyName, final Object value) {
            return String.valueOf(value);
        }
    };

    private final Class<?> javaType;

    FieldKind(final Class<?> javaType) {
        this.javaType = javaType;
    }

    public Class<?> getJavaType() {
        return this.javaType;
    }

    /**
     * Converts a loosely typed value into this kind. Null passes through untouched and means "unspecified".
     * For BOOLEAN, integer 0 and the string "false" are always false.
     *
     * @param propertyName  the property being assigned, used in failure messages
     * @param value         the incoming value
     * @return the value as an instance of {@link #getJavaType()}, or null
     * @throws TypeConversionException when the value cannot be converted
     */
    public Object coerce(final String propertyName, final Object value) {
        if (value == null) {
            return null;
        }
        if (this == BOOLEAN && (isZero(value) || "false".equals(value))) {
            return Boolean.FALSE;
        }
        if (this.javaType.isInstance(value)) {
            return value;
        }
        return convert(propertyName, value);
    }

    abstract Object convert(String propertyName, Object value);

    /**
     * Integral values must fit an int exactly. Floating values are truncated toward zero once known to be in range.
     */
    private static int toInt(final String propertyName, final Number value) {
        try {
            if (value instanceof BigInteger) {
                return ((BigInteger) value).intValueExact();
            }
            if (value instanceof Long || value instanceof Short || value instanceof Byte) {
                return Math.toIntExact(value.longValue());
            }
        } catch (final ArithmeticException e) {
            throw new TypeConversionException(propertyName, value, INTEGER, e);
        }

        final double number = value.doubleValue();
        if (Double.isNaN(number) || number < Integer.MIN_VALUE || number >= Integer.MAX_VALUE + 1.0d) {
            throw new TypeConversionException(propertyName, value, INTEGER);
        }
        return (int) number;
    }

    private static boolean isZero(final Object value) {
        return (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)
            && ((Number) value).longValue() == 0L;
    }
}
