package com.oc.organizations.passwordpolicy;

import com.oc.cfn.proxy.Logger;
import com.oc.cfn.proxy.ProgressEvent;
import com.oc.cfn.proxy.ResourceHandlerRequest;
import com.oc.cfn.proxy.SessionProxy;

import java.util.Map;

public abstract class BaseHandler {

    /**
     * @param session           caller session, null when the caller supplied no credentials
     * @param request           the typed request
     * @param callbackContext   context returned by a previous IN_PROGRESS event, if any
     * @param logger            handler logger
     */
    public abstract ProgressEvent<ResourceModel> handleRequest(
        SessionProxy session,
        ResourceHandlerRequest<ResourceModel> request,
        Map<String, Object> callbackContext,
        Logger logger);
}
