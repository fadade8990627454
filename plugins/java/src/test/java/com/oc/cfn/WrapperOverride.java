package com.oc.cfn;

import com.oc.cfn.metrics.MetricsPublisher;
import com.oc.cfn.proxy.CallbackAdapter;
import com.oc.cfn.proxy.HandlerRequest;
import com.oc.cfn.proxy.ProgressEvent;
import com.oc.cfn.proxy.ResourceHandlerRequest;
import com.oc.cfn.proxy.SessionProxy;
import com.oc.cfn.scheduler.CloudWatchScheduler;
import com.google.inject.Inject;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

/**
 * Test class used for testing of LambdaWrapper functionality; returns a canned handler response
 * and records what the handler was invoked with
 */
@Getter
@Setter
public class WrapperOverride extends LambdaWrapper<TestModel> {

    private ProgressEvent<TestModel> invokeHandlerResponse;
    private RuntimeException invokeHandlerException;

    private SessionProxy invokedSession;
    private ResourceHandlerRequest<TestModel> invokedRequest;
    private Action invokedAction;
    private Map<String, Object> invokedCallbackContext;

    /**
     * This .ctor provided for testing
     */
    @Inject
    public WrapperOverride(final CallbackAdapter callbackAdapter,
                           final MetricsPublisher metricsPublisher,
                           final CloudWatchScheduler scheduler) {
        super(callbackAdapter, metricsPublisher, scheduler);
    }

    @Override
    protected ResourceHandlerRequest<TestModel> transform(final HandlerRequest<Map<String, Object>> request) {
        return ResourceHandlerRequest.<TestModel>builder()
            .awsAccountId(request.getAwsAccountId())
            .region(request.getRegion())
            .resourceType(request.getResourceType())
            .logicalResourceIdentifier(request.getRequestData().getLogicalResourceId())
            .desiredResourceState(this.objectMapper.convertValue(
                request.getRequestData().getResourceProperties(), TestModel.class))
            .build();
    }

    @Override
    public ProgressEvent<TestModel> invokeHandler(final SessionProxy session,
                                                  final ResourceHandlerRequest<TestModel> request,
                                                  final Action action,
                                                  final Map<String, Object> callbackContext) {
        this.invokedSession = session;
        this.invokedRequest = request;
        this.invokedAction = action;
        this.invokedCallbackContext = callbackContext;
        if (this.invokeHandlerException != null) {
            throw this.invokeHandlerException;
        }
        return this.invokeHandlerResponse;
    }
}
