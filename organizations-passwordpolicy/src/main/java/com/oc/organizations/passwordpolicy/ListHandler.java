package com.oc.organizations.passwordpolicy;

import com.oc.cfn.exceptions.InternalFailureException;
import com.oc.cfn.exceptions.ResourceNotFoundException;
import com.oc.cfn.proxy.Logger;
import com.oc.cfn.proxy.OperationStatus;
import com.oc.cfn.proxy.ProgressEvent;
import com.oc.cfn.proxy.ResourceHandlerRequest;
import com.oc.cfn.proxy.SessionProxy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The policy is a per-account singleton, so a listing holds zero or one models
 */
public class ListHandler extends BaseHandler {

    @Override
    public ProgressEvent<ResourceModel> handleRequest(
        final SessionProxy session,
        final ResourceHandlerRequest<ResourceModel> request,
        final Map<String, Object> callbackContext,
        final Logger logger) {

        if (session == null) {
            throw new InternalFailureException("Credentials are required to list " + ResourceModel.TYPE_NAME);
        }

        final List<ResourceModel> models = new ArrayList<>();
        try {
            models.add(PasswordPolicyRetriever.retrieve(
                session, request.getDesiredResourceState(), request.getLogicalResourceIdentifier(), logger));
        } catch (final ResourceNotFoundException e) {
            logger.log(String.format("%s: no password policy set", ResourceModel.TYPE_NAME));
        }

        final ProgressEvent<ResourceModel> progress = new ProgressEvent<>();
        progress.setResourceModels(models);
        progress.setStatus(OperationStatus.SUCCESS);
        return progress;
    }
}
