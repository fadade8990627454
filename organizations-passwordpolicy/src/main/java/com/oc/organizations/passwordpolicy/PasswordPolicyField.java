package com.oc.organizations.passwordpolicy;

import java.util.HashMap;
import java.util.Map;

/**
 * Static schema of the password policy resource: property name, declared kind and whether the
 * property is part of the IAM update payload
 */
public enum PasswordPolicyField {
    RESOURCE_ID("ResourceId", FieldKind.STRING, false),
    MINIMUM_PASSWORD_LENGTH("MinimumPasswordLength", FieldKind.INTEGER, true),
    REQUIRE_SYMBOLS("RequireSymbols", FieldKind.BOOLEAN, true),
    REQUIRE_NUMBERS("RequireNumbers", FieldKind.BOOLEAN, true),
    REQUIRE_UPPERCASE_CHARACTERS("RequireUppercaseCharacters", FieldKind.BOOLEAN, true),
    REQUIRE_LOWERCASE_CHARACTERS("RequireLowercaseCharacters", FieldKind.BOOLEAN, true),
    ALLOW_USERS_TO_CHANGE_PASSWORD("AllowUsersToChangePassword", FieldKind.BOOLEAN, true),
    // derived by IAM from MaxPasswordAge; read-only
    EXPIRE_PASSWORDS("ExpirePasswords", FieldKind.BOOLEAN, false),
    MAX_PASSWORD_AGE("MaxPasswordAge", FieldKind.INTEGER, true),
    PASSWORD_REUSE_PREVENTION("PasswordReusePrevention", FieldKind.INTEGER, true),
    HARD_EXPIRY("HardExpiry", FieldKind.BOOLEAN, true);

    private static final Map<String, PasswordPolicyField> BY_PROPERTY_NAME = new HashMap<>();

    static {
        for (final PasswordPolicyField field : values()) {
            BY_PROPERTY_NAME.put(field.propertyName, field);
        }
    }

    private final String propertyName;
    private final FieldKind kind;
    private final boolean serializable;

    PasswordPolicyField(final String propertyName,
                        final FieldKind kind,
                        final boolean serializable) {
        this.propertyName = propertyName;
        this.kind = kind;
        this.serializable = serializable;
    }

    public String getPropertyName() {
        return this.propertyName;
    }

    public FieldKind getKind() {
        return this.kind;
    }

    /**
     * @return false for bookkeeping properties that must never reach IAM
     */
    public boolean isSerializable() {
        return this.serializable;
    }

    public Object coerce(final Object value) {
        return this.kind.coerce(this.propertyName, value);
    }

    /**
     * @throws IllegalArgumentException if the resource has no property of that name
     */
    public static boolean isDefined(final String propertyName) {
        return BY_PROPERTY_NAME.containsKey(propertyName);
    }

    public static PasswordPolicyField fromPropertyName(final String propertyName) {
        final PasswordPolicyField field = BY_PROPERTY_NAME.get(propertyName);
        if (field == null) {
            throw new IllegalArgumentException(
                String.format("%s has no property '%s'", ResourceModel.TYPE_NAME, propertyName));
        }
        return field;
    }
}
