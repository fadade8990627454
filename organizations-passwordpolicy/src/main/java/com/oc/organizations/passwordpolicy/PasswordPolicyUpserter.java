package com.oc.organizations.passwordpolicy;

import com.amazonaws.services.identitymanagement.AmazonIdentityManagement;
import com.amazonaws.services.identitymanagement.model.UpdateAccountPasswordPolicyRequest;
import com.oc.cfn.exceptions.InternalFailureException;
import com.oc.cfn.proxy.Logger;
import com.oc.cfn.proxy.SessionProxy;

import java.util.UUID;

/**
 * Writes a model as the account password policy. IAM has a single policy per account, so create
 * and update are the same call.
 */
public final class PasswordPolicyUpserter {

    private PasswordPolicyUpserter() {
    }

    /**
     * Assigns a random ResourceId when the model has none, then pushes the serialized model to IAM
     * @return the same model instance
     * @throws InternalFailureException if the payload does not bind to the IAM request
     */
    public static ResourceModel upsert(final SessionProxy session,
                                       final ResourceModel model,
                                       final String logicalResourceIdentifier,
                                       final Logger logger) {
        final AmazonIdentityManagement client = ClientBuilder.getClient(session);

        if (model.getResourceId() == null) {
            model.setResourceId(UUID.randomUUID().toString());
        }

        final UpdateAccountPasswordPolicyRequest request;
        try {
            request = Translator.translateToUpdateRequest(model.serialize());
        } catch (final ClassCastException | IllegalArgumentException e) {
            throw new InternalFailureException(String.format("was not expecting type %s", e.getMessage()), e);
        }
        client.updateAccountPasswordPolicy(request);

        logger.log(String.format("%s [%s] [%s] successfully upserted.",
            ResourceModel.TYPE_NAME, model.getResourceId(), logicalResourceIdentifier));
        return model;
    }
}
