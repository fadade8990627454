package com.oc.organizations.passwordpolicy;

import com.amazonaws.services.identitymanagement.model.DeleteAccountPasswordPolicyRequest;
import com.oc.cfn.proxy.Logger;
import com.oc.cfn.proxy.OperationStatus;
import com.oc.cfn.proxy.ProgressEvent;
import com.oc.cfn.proxy.ResourceHandlerRequest;
import com.oc.cfn.proxy.SessionProxy;

import java.util.Map;

public class DeleteHandler extends BaseHandler {

    private final ReadHandler readHandler;

    public DeleteHandler() {
        this(new ReadHandler());
    }

    DeleteHandler(final ReadHandler readHandler) {
        this.readHandler = readHandler;
    }

    @Override
    public ProgressEvent<ResourceModel> handleRequest(
        final SessionProxy session,
        final ResourceHandlerRequest<ResourceModel> request,
        final Map<String, Object> callbackContext,
        final Logger logger) {

        if (session == null) {
            return ProgressEvent.progress(
                ResourceModel.copyOf(request.getDesiredResourceState()), OperationStatus.IN_PROGRESS);
        }

        final ProgressEvent<ResourceModel> progress =
            this.readHandler.handleRequest(session, request, callbackContext, logger);

        ClientBuilder.getClient(session).deleteAccountPasswordPolicy(new DeleteAccountPasswordPolicyRequest());

        logger.log(String.format("%s [%s] [%s] successfully deleted.",
            ResourceModel.TYPE_NAME,
            progress.getResourceModel().getResourceId(),
            request.getLogicalResourceIdentifier()));
        return progress;
    }
}
