package com.oc.organizations.passwordpolicy;

import com.oc.cfn.proxy.Logger;
import com.oc.cfn.proxy.OperationStatus;
import com.oc.cfn.proxy.ProgressEvent;
import com.oc.cfn.proxy.ResourceHandlerRequest;
import com.oc.cfn.proxy.SessionProxy;

import java.util.Map;

public class UpdateHandler extends BaseHandler {

    @Override
    public ProgressEvent<ResourceModel> handleRequest(
        final SessionProxy session,
        final ResourceHandlerRequest<ResourceModel> request,
        final Map<String, Object> callbackContext,
        final Logger logger) {

        final ResourceModel model = ResourceModel.copyOf(request.getDesiredResourceState());

        if (session == null) {
            return ProgressEvent.progress(model, OperationStatus.IN_PROGRESS);
        }

        // fails with NotFound if the policy has gone; the merged state itself is not used
        PasswordPolicyRetriever.retrieve(
            session, request.getDesiredResourceState(), request.getLogicalResourceIdentifier(), logger);

        final String name = model.getResourceId() != null
            ? model.getResourceId()
            : request.getLogicalResourceIdentifier();
        final ResourceModel upserted = PasswordPolicyUpserter.upsert(session, model, name, logger);
        return ProgressEvent.progress(upserted, OperationStatus.SUCCESS);
    }
}
