package com.oc.organizations.passwordpolicy;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The OC::Organizations::PasswordPolicy resource. Every assignment is coerced to the property's
 * declared kind, so a stored value always has the declared runtime type. Unset properties are
 * absent from both views of the model.
 */
@EqualsAndHashCode
@ToString
@JsonAutoDetect(
    fieldVisibility = Visibility.NONE,
    getterVisibility = Visibility.NONE,
    isGetterVisibility = Visibility.NONE,
    setterVisibility = Visibility.NONE)
public class ResourceModel {

    public static final String TYPE_NAME = "OC::Organizations::PasswordPolicy";

    private final Map<PasswordPolicyField, Object> values = new EnumMap<>(PasswordPolicyField.class);

    /**
     * Builds a model from loosely typed resource properties, coercing each entry. Names the type does not
     * declare are skipped.
     * @param properties property name to value; may be null
     * @throws TypeConversionException if a value does not convert to its property's kind
     */
    public static ResourceModel of(final Map<String, ?> properties) {
        final ResourceModel model = new ResourceModel();
        if (properties != null) {
            for (final Map.Entry<String, ?> entry : properties.entrySet()) {
                if (PasswordPolicyField.isDefined(entry.getKey())) {
                    model.set(entry.getKey(), entry.getValue());
                }
            }
        }
        return model;
    }

    /**
     * @return the names in {@code properties} that {@link #of} would skip, in iteration order
     */
    public static List<String> undeclaredProperties(final Map<String, ?> properties) {
        final List<String> names = new ArrayList<>();
        if (properties != null) {
            for (final String name : properties.keySet()) {
                if (!PasswordPolicyField.isDefined(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    public static ResourceModel copyOf(final ResourceModel source) {
        final ResourceModel model = new ResourceModel();
        if (source != null) {
            model.values.putAll(source.values);
        }
        return model;
    }

    /**
     * @throws IllegalArgumentException if the type declares no such property
     */
    public ResourceModel set(final String propertyName, final Object value) {
        return set(PasswordPolicyField.fromPropertyName(propertyName), value);
    }

    public ResourceModel set(final PasswordPolicyField field, final Object value) {
        final Object coerced = field.coerce(value);
        if (coerced == null) {
            this.values.remove(field);
        } else {
            this.values.put(field, coerced);
        }
        return this;
    }

    public Object get(final PasswordPolicyField field) {
        return this.values.get(field);
    }

    /**
     * @return the IAM payload: every set property except ResourceId and ExpirePasswords
     */
    public Map<String, Object> serialize() {
        final Map<String, Object> payload = new LinkedHashMap<>();
        for (final Map.Entry<PasswordPolicyField, Object> entry : this.values.entrySet()) {
            if (entry.getKey().isSerializable()) {
                payload.put(entry.getKey().getPropertyName(), entry.getValue());
            }
        }
        return payload;
    }

    /**
     * @return every set property keyed by property name; this is the model's JSON form
     */
    @JsonAnyGetter
    public Map<String, Object> toMap() {
        final Map<String, Object> properties = new LinkedHashMap<>();
        for (final Map.Entry<PasswordPolicyField, Object> entry : this.values.entrySet()) {
            properties.put(entry.getKey().getPropertyName(), entry.getValue());
        }
        return properties;
    }

    public String getResourceId() {
        return (String) get(PasswordPolicyField.RESOURCE_ID);
    }

    public void setResourceId(final Object resourceId) {
        set(PasswordPolicyField.RESOURCE_ID, resourceId);
    }

    public Integer getMinimumPasswordLength() {
        return (Integer) get(PasswordPolicyField.MINIMUM_PASSWORD_LENGTH);
    }

    public void setMinimumPasswordLength(final Object minimumPasswordLength) {
        set(PasswordPolicyField.MINIMUM_PASSWORD_LENGTH, minimumPasswordLength);
    }

    public Boolean getRequireSymbols() {
        return (Boolean) get(PasswordPolicyField.REQUIRE_SYMBOLS);
    }

    public void setRequireSymbols(final Object requireSymbols) {
        set(PasswordPolicyField.REQUIRE_SYMBOLS, requireSymbols);
    }

    public Boolean getRequireNumbers() {
        return (Boolean) get(PasswordPolicyField.REQUIRE_NUMBERS);
    }

    public void setRequireNumbers(final Object requireNumbers) {
        set(PasswordPolicyField.REQUIRE_NUMBERS, requireNumbers);
    }

    public Boolean getRequireUppercaseCharacters() {
        return (Boolean) get(PasswordPolicyField.REQUIRE_UPPERCASE_CHARACTERS);
    }

    public void setRequireUppercaseCharacters(final Object requireUppercaseCharacters) {
        set(PasswordPolicyField.REQUIRE_UPPERCASE_CHARACTERS, requireUppercaseCharacters);
    }

    public Boolean getRequireLowercaseCharacters() {
        return (Boolean) get(PasswordPolicyField.REQUIRE_LOWERCASE_CHARACTERS);
    }

    public void setRequireLowercaseCharacters(final Object requireLowercaseCharacters) {
        set(PasswordPolicyField.REQUIRE_LOWERCASE_CHARACTERS, requireLowercaseCharacters);
    }

    public Boolean getAllowUsersToChangePassword() {
        return (Boolean) get(PasswordPolicyField.ALLOW_USERS_TO_CHANGE_PASSWORD);
    }

    public void setAllowUsersToChangePassword(final Object allowUsersToChangePassword) {
        set(PasswordPolicyField.ALLOW_USERS_TO_CHANGE_PASSWORD, allowUsersToChangePassword);
    }

    public Boolean getExpirePasswords() {
        return (Boolean) get(PasswordPolicyField.EXPIRE_PASSWORDS);
    }

    public void setExpirePasswords(final Object expirePasswords) {
        set(PasswordPolicyField.EXPIRE_PASSWORDS, expirePasswords);
    }

    public Integer getMaxPasswordAge() {
        return (Integer) get(PasswordPolicyField.MAX_PASSWORD_AGE);
    }

    public void setMaxPasswordAge(final Object maxPasswordAge) {
        set(PasswordPolicyField.MAX_PASSWORD_AGE, maxPasswordAge);
    }

    public Integer getPasswordReusePrevention() {
        return (Integer) get(PasswordPolicyField.PASSWORD_REUSE_PREVENTION);
    }

    public void setPasswordReusePrevention(final Object passwordReusePrevention) {
        set(PasswordPolicyField.PASSWORD_REUSE_PREVENTION, passwordReusePrevention);
    }

    public Boolean getHardExpiry() {
        return (Boolean) get(PasswordPolicyField.HARD_EXPIRY);
    }

    public void setHardExpiry(final Object hardExpiry) {
        set(PasswordPolicyField.HARD_EXPIRY, hardExpiry);
    }
}
