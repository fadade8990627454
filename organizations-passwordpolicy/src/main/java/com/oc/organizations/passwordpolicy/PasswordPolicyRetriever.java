package com.oc.organizations.passwordpolicy;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.services.identitymanagement.AmazonIdentityManagement;
import com.amazonaws.services.identitymanagement.model.GetAccountPasswordPolicyRequest;
import com.amazonaws.services.identitymanagement.model.GetAccountPasswordPolicyResult;
import com.oc.cfn.exceptions.ResourceNotFoundException;
import com.oc.cfn.proxy.Logger;
import com.oc.cfn.proxy.SessionProxy;

import java.util.Map;

/**
 * Reads the account password policy and merges it over a model
 */
public final class PasswordPolicyRetriever {

    static final String NO_SUCH_ENTITY = "NoSuchEntity";

    private PasswordPolicyRetriever() {
    }

    /**
     * @param session                   caller session the IAM client is built from
     * @param model                     current known state; IAM values win where both are set
     * @param logicalResourceIdentifier used as ResourceId when the merged model has none
     * @param logger                    handler logger
     * @return a new model holding the merged state
     * @throws ResourceNotFoundException when the account has no password policy
     */
    public static ResourceModel retrieve(final SessionProxy session,
                                         final ResourceModel model,
                                         final String logicalResourceIdentifier,
                                         final Logger logger) {
        final AmazonIdentityManagement client = ClientBuilder.getClient(session);

        final GetAccountPasswordPolicyResult result;
        try {
            result = client.getAccountPasswordPolicy(new GetAccountPasswordPolicyRequest());
        } catch (final AmazonServiceException e) {
            if (NO_SUCH_ENTITY.equals(e.getErrorCode())) {
                final String identifier = model != null && model.getResourceId() != null
                    ? model.getResourceId()
                    : logicalResourceIdentifier;
                throw new ResourceNotFoundException(ResourceModel.TYPE_NAME, identifier);
            }
            throw e;
        }

        final ResourceModel merged = ResourceModel.copyOf(model);
        final Map<String, Object> current = Translator.translateFromReadResponse(result.getPasswordPolicy());
        for (final Map.Entry<String, Object> entry : current.entrySet()) {
            merged.set(entry.getKey(), entry.getValue());
        }
        if (merged.getResourceId() == null) {
            merged.setResourceId(logicalResourceIdentifier);
        }

        logger.log(String.format("%s [%s] [%s] successfully retrieved.",
            ResourceModel.TYPE_NAME, merged.getResourceId(), logicalResourceIdentifier));
        return merged;
    }
}
