package com.oc.organizations.passwordpolicy;

import com.amazonaws.services.identitymanagement.model.PasswordPolicy;
import com.amazonaws.services.identitymanagement.model.UpdateAccountPasswordPolicyRequest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps between the resource properties and the IAM SDK password policy shapes
 */
final class Translator {

    private Translator() {
    }

    /**
     * @return the non-null properties of the IAM policy, keyed by property name
     */
    static Map<String, Object> translateFromReadResponse(final PasswordPolicy policy) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        if (policy == null) {
            return properties;
        }
        putIfSet(properties, PasswordPolicyField.MINIMUM_PASSWORD_LENGTH, policy.getMinimumPasswordLength());
        putIfSet(properties, PasswordPolicyField.REQUIRE_SYMBOLS, policy.getRequireSymbols());
        putIfSet(properties, PasswordPolicyField.REQUIRE_NUMBERS, policy.getRequireNumbers());
        putIfSet(properties, PasswordPolicyField.REQUIRE_UPPERCASE_CHARACTERS, policy.getRequireUppercaseCharacters());
        putIfSet(properties, PasswordPolicyField.REQUIRE_LOWERCASE_CHARACTERS, policy.getRequireLowercaseCharacters());
        putIfSet(properties, PasswordPolicyField.ALLOW_USERS_TO_CHANGE_PASSWORD, policy.getAllowUsersToChangePassword());
        putIfSet(properties, PasswordPolicyField.EXPIRE_PASSWORDS, policy.getExpirePasswords());
        putIfSet(properties, PasswordPolicyField.MAX_PASSWORD_AGE, policy.getMaxPasswordAge());
        putIfSet(properties, PasswordPolicyField.PASSWORD_REUSE_PREVENTION, policy.getPasswordReusePrevention());
        putIfSet(properties, PasswordPolicyField.HARD_EXPIRY, policy.getHardExpiry());
        return properties;
    }

    /**
     * Binds a serialized model to the named parameters of UpdateAccountPasswordPolicy
     * @param payload output of {@link ResourceModel#serialize()}
     * @throws ClassCastException if a value is not of the type the parameter accepts
     * @throws IllegalArgumentException if a key is not an update parameter
     */
    static UpdateAccountPasswordPolicyRequest translateToUpdateRequest(final Map<String, Object> payload) {
        final UpdateAccountPasswordPolicyRequest request = new UpdateAccountPasswordPolicyRequest();
        for (final Map.Entry<String, Object> entry : payload.entrySet()) {
            final PasswordPolicyField field = PasswordPolicyField.fromPropertyName(entry.getKey());
            final Object value = entry.getValue();
            switch (field) {
                case MINIMUM_PASSWORD_LENGTH:
                    request.setMinimumPasswordLength((Integer) value);
                    break;
                case REQUIRE_SYMBOLS:
                    request.setRequireSymbols((Boolean) value);
                    break;
                case REQUIRE_NUMBERS:
                    request.setRequireNumbers((Boolean) value);
                    break;
                case REQUIRE_UPPERCASE_CHARACTERS:
                    request.setRequireUppercaseCharacters((Boolean) value);
                    break;
                case REQUIRE_LOWERCASE_CHARACTERS:
                    request.setRequireLowercaseCharacters((Boolean) value);
                    break;
                case ALLOW_USERS_TO_CHANGE_PASSWORD:
                    request.setAllowUsersToChangePassword((Boolean) value);
                    break;
                case MAX_PASSWORD_AGE:
                    request.setMaxPasswordAge((Integer) value);
                    break;
                case PASSWORD_REUSE_PREVENTION:
                    request.setPasswordReusePrevention((Integer) value);
                    break;
                case HARD_EXPIRY:
                    request.setHardExpiry((Boolean) value);
                    break;
                default:
                    throw new IllegalArgumentException(
                        String.format("%s is not a parameter of UpdateAccountPasswordPolicy", entry.getKey()));
            }
        }
        return request;
    }

    private static void putIfSet(final Map<String, Object> properties,
                                 final PasswordPolicyField field,
                                 final Object value) {
        if (value != null) {
            properties.put(field.getPropertyName(), value);
        }
    }
}
