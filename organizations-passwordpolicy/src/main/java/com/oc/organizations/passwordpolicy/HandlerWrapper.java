package com.oc.organizations.passwordpolicy;

import com.google.inject.Inject;
import com.oc.cfn.Action;
import com.oc.cfn.LambdaWrapper;
import com.oc.cfn.exceptions.TerminalException;
import com.oc.cfn.metrics.MetricsPublisher;
import com.oc.cfn.proxy.CallbackAdapter;
import com.oc.cfn.proxy.HandlerRequest;
import com.oc.cfn.proxy.ProgressEvent;
import com.oc.cfn.proxy.RequestData;
import com.oc.cfn.proxy.ResourceHandlerRequest;
import com.oc.cfn.proxy.SessionProxy;
import com.oc.cfn.scheduler.CloudWatchScheduler;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lambda entry point for OC::Organizations::PasswordPolicy
 */
public final class HandlerWrapper extends LambdaWrapper<ResourceModel> {

    private final Map<Action, BaseHandler> handlers;

    public HandlerWrapper() {
        this.handlers = defaultHandlers();
    }

    @Inject
    public HandlerWrapper(final CallbackAdapter callbackAdapter,
                          final MetricsPublisher metricsPublisher,
                          final CloudWatchScheduler scheduler) {
        this(callbackAdapter, metricsPublisher, scheduler, defaultHandlers());
    }

    HandlerWrapper(final CallbackAdapter callbackAdapter,
                   final MetricsPublisher metricsPublisher,
                   final CloudWatchScheduler scheduler,
                   final Map<Action, BaseHandler> handlers) {
        super(callbackAdapter, metricsPublisher, scheduler);
        this.handlers = handlers;
    }

    private static Map<Action, BaseHandler> defaultHandlers() {
        final Map<Action, BaseHandler> handlers = new EnumMap<>(Action.class);
        handlers.put(Action.CREATE, new CreateHandler());
        handlers.put(Action.READ, new ReadHandler());
        handlers.put(Action.UPDATE, new UpdateHandler());
        handlers.put(Action.DELETE, new DeleteHandler());
        handlers.put(Action.LIST, new ListHandler());
        return handlers;
    }

    @Override
    public ProgressEvent<ResourceModel> invokeHandler(final SessionProxy session,
                                                      final ResourceHandlerRequest<ResourceModel> request,
                                                      final Action action,
                                                      final Map<String, Object> callbackContext) {

        final BaseHandler handler = action == null ? null : this.handlers.get(action);
        if (handler == null) {
            throw new TerminalException("Unknown action " + action);
        }

        this.log(String.format("Invoking %s handler for %s", action, request.getLogicalResourceIdentifier()));
        return handler.handleRequest(session, request, callbackContext, this.logger);
    }

    @Override
    protected ResourceHandlerRequest<ResourceModel> transform(final HandlerRequest<Map<String, Object>> request) {
        final RequestData<Map<String, Object>> requestData = request.getRequestData();

        final ResourceHandlerRequest.ResourceHandlerRequestBuilder<ResourceModel> builder =
            ResourceHandlerRequest.<ResourceModel>builder()
                .awsAccountId(request.getAwsAccountId())
                .region(request.getRegion())
                .nextToken(request.getNextToken())
                .resourceType(request.getResourceType())
                .resourceTypeVersion(request.getResourceTypeVersion());

        if (requestData == null) {
            return builder.desiredResourceState(new ResourceModel()).build();
        }

        return builder
            .logicalResourceIdentifier(requestData.getLogicalResourceId())
            .desiredResourceState(toModel("resourceProperties", requestData.getResourceProperties()))
            .previousResourceState(requestData.getPreviousResourceProperties() == null
                ? null
                : toModel("previousResourceProperties", requestData.getPreviousResourceProperties()))
            .build();
    }

    private ResourceModel toModel(final String source, final Map<String, Object> properties) {
        final List<String> undeclared = ResourceModel.undeclaredProperties(properties);
        if (!undeclared.isEmpty()) {
            this.log(String.format("Ignoring %s in %s, not declared by %s",
                undeclared, source, ResourceModel.TYPE_NAME));
        }
        return ResourceModel.of(properties);
    }
}
