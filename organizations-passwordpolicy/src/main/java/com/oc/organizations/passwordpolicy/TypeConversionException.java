package com.oc.organizations.passwordpolicy;

import lombok.Getter;

/**
 * Thrown when a value assigned to a model property cannot be converted to the property's declared kind
 */
@Getter
public class TypeConversionException extends RuntimeException {

    private static final long serialVersionUID = 2916382061538140574L;

    private final String propertyName;
    private final transient Object value;
    private final FieldKind kind;

    public TypeConversionException(final String propertyName,
                                   final Object value,
                                   final FieldKind kind) {
        this(propertyName, value, kind, null);
    }

    public TypeConversionException(final String propertyName,
                                   final Object value,
                                   final FieldKind kind,
                                   final Throwable cause) {
        super(String.format("Cannot convert value '%s' (%s) of property %s to %s",
                value,
                value == null ? "null" : value.getClass().getSimpleName(),
                propertyName,
                kind),
            cause);
        this.propertyName = propertyName;
        this.value = value;
        this.kind = kind;
    }
}
