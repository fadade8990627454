package com.oc.organizations.passwordpolicy;

import com.oc.cfn.proxy.Logger;
import com.oc.cfn.proxy.OperationStatus;
import com.oc.cfn.proxy.ProgressEvent;
import com.oc.cfn.proxy.ResourceHandlerRequest;
import com.oc.cfn.proxy.SessionProxy;

import java.util.Map;

public class CreateHandler extends BaseHandler {

    @Override
    public ProgressEvent<ResourceModel> handleRequest(
        final SessionProxy session,
        final ResourceHandlerRequest<ResourceModel> request,
        final Map<String, Object> callbackContext,
        final Logger logger) {

        final ResourceModel model = ResourceModel.copyOf(request.getDesiredResourceState());

        // no credentials yet; ask to be re-invoked
        if (session == null) {
            return ProgressEvent.progress(model, OperationStatus.IN_PROGRESS);
        }

        // an existing policy is overwritten
        final ResourceModel upserted = PasswordPolicyUpserter.upsert(
            session, model, request.getLogicalResourceIdentifier(), logger);
        return ProgressEvent.progress(upserted, OperationStatus.SUCCESS);
    }
}
