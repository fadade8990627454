package com.oc.organizations.passwordpolicy;

import com.oc.cfn.exceptions.InternalFailureException;
import com.oc.cfn.proxy.Logger;
import com.oc.cfn.proxy.OperationStatus;
import com.oc.cfn.proxy.ProgressEvent;
import com.oc.cfn.proxy.ResourceHandlerRequest;
import com.oc.cfn.proxy.SessionProxy;

import java.util.Map;

public class ReadHandler extends BaseHandler {

    @Override
    public ProgressEvent<ResourceModel> handleRequest(
        final SessionProxy session,
        final ResourceHandlerRequest<ResourceModel> request,
        final Map<String, Object> callbackContext,
        final Logger logger) {

        if (session == null) {
            throw new InternalFailureException("Credentials are required to read " + ResourceModel.TYPE_NAME);
        }

        final ResourceModel model = PasswordPolicyRetriever.retrieve(
            session, request.getDesiredResourceState(), request.getLogicalResourceIdentifier(), logger);
        return ProgressEvent.progress(model, OperationStatus.SUCCESS);
    }
}
