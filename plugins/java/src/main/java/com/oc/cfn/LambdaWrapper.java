package com.oc.cfn;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.oc.cfn.exceptions.BaseHandlerException;
import com.oc.cfn.exceptions.TerminalException;
import com.oc.cfn.metrics.MetricsPublisher;
import com.oc.cfn.proxy.CallbackAdapter;
import com.oc.cfn.proxy.HandlerErrorCode;
import com.oc.cfn.proxy.HandlerRequest;
import com.oc.cfn.proxy.Logger;
import com.oc.cfn.proxy.LoggerProxy;
import com.oc.cfn.proxy.OperationStatus;
import com.oc.cfn.proxy.ProgressEvent;
import com.oc.cfn.proxy.RequestContext;
import com.oc.cfn.proxy.ResourceHandlerRequest;
import com.oc.cfn.proxy.SessionProxy;
import com.oc.cfn.scheduler.CloudWatchScheduler;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;

public abstract class LambdaWrapper<T> implements RequestStreamHandler {

    private static final TypeReference<HandlerRequest<Map<String, Object>>> REQUEST_TYPE =
        new TypeReference<HandlerRequest<Map<String, Object>>>() { };
    private static final TypeReference<Map<String, Object>> MODEL_TYPE =
        new TypeReference<Map<String, Object>>() { };

    private final CallbackAdapter callbackAdapter;
    private final MetricsPublisher metricsPublisher;
    private final CloudWatchScheduler scheduler;
    protected final ObjectMapper objectMapper = new ObjectMapper();
    protected Logger logger;

    /**
     * This .ctor provided for Lambda runtime which will not automatically invoke Guice injector
     */
    public LambdaWrapper() {
        final Injector injector = Guice.createInjector(new LambdaModule());
        this.callbackAdapter = injector.getInstance(CallbackAdapter.class);
        this.metricsPublisher = injector.getInstance(MetricsPublisher.class);
        this.scheduler = injector.getInstance(CloudWatchScheduler.class);
        configureObjectMapper(this.objectMapper);
    }

    /**
     * This .ctor provided for testing
     */
    @Inject
    public LambdaWrapper(final CallbackAdapter callbackAdapter,
                         final MetricsPublisher metricsPublisher,
                         final CloudWatchScheduler scheduler) {
        this.callbackAdapter = callbackAdapter;
        this.metricsPublisher = metricsPublisher;
        this.scheduler = scheduler;
        configureObjectMapper(this.objectMapper);
    }

    /**
     * Configures the specified ObjectMapper with the (de)serialization behaviours we want to enforce
     */
    private void configureObjectMapper(final ObjectMapper objectMapper) {
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public void handleRequest(final InputStream inputStream,
                              final OutputStream outputStream,
                              final Context context) throws IOException {
        final LambdaLogger lambdaLogger = context == null ? null : context.getLogger();
        this.logger = new LoggerProxy(lambdaLogger);
        this.scheduler.setLogger(this.logger);

        ProgressEvent<T> handlerResponse = null;
        HandlerRequest<Map<String, Object>> request = null;

        try {
            if (inputStream == null) {
                throw new TerminalException("No request object received");
            }

            // decode the input request
            final String input = IOUtils.toString(inputStream, StandardCharsets.UTF_8);
            request = this.objectMapper.readValue(input, REQUEST_TYPE);

            handlerResponse = processInvocation(request, context);
        } catch (final BaseHandlerException e) {
            // an expected failure from the handler carries its own error code
            this.log(String.format("Handler failed with %s: %s", e.getErrorCode(), e.getMessage()));
            publishExceptionMetric(request, e);
            handlerResponse = ProgressEvent.failed(e.getErrorCode(), e.getMessage());
        } catch (final Exception e) {
            // Exceptions are wrapped as a consistent error response to the caller (i.e; CloudFormation)
            this.log(ExceptionUtils.getStackTrace(e));
            publishExceptionMetric(request, e);
            handlerResponse = ProgressEvent.failed(HandlerErrorCode.InternalFailure, e.getMessage());
        } finally {
            // A response will be output on all paths, though CloudFormation will
            // not block on invoking the handlers, but rather listen for callbacks
            writeResponse(outputStream, createProgressResponse(handlerResponse));
        }
    }

    public ProgressEvent<T> processInvocation(final HandlerRequest<Map<String, Object>> request,
                                              final Context context) throws IOException {

        if (request == null || request.getRequestContext() == null) {
            throw new TerminalException("Invalid request object received");
        }

        final RequestContext requestContext = request.getRequestContext();

        // If this invocation was triggered by a 're-invoke' CloudWatch Event, clean it up
        if (StringUtils.isNotEmpty(requestContext.getCloudWatchEventsRuleName())) {
            this.scheduler.cleanupCloudWatchEvents(
                requestContext.getCloudWatchEventsRuleName(),
                requestContext.getCloudWatchEventsTargetId());
        }

        // MetricsPublisher is initialised with the resource type name for metrics namespace
        this.metricsPublisher.setResourceTypeName(request.getResourceType());

        this.metricsPublisher.publishInvocationMetric(now(), request.getAction());

        final ResourceHandlerRequest<T> resourceHandlerRequest = transform(request);

        // without caller credentials there is no session; handlers decide whether they can proceed
        final SessionProxy session = request.getRequestData() == null
            ? null
            : SessionProxy.from(request.getRequestData().getCredentials(), request.getRegion());

        final Date startTime = now();

        final ProgressEvent<T> handlerResponse = invokeHandler(
            session,
            resourceHandlerRequest,
            request.getAction(),
            requestContext.getCallbackContext());
        if (handlerResponse != null) {
            this.log(String.format("Handler returned %s", handlerResponse.getStatus()));
        } else {
            this.log("Handler returned null");
        }

        final Date endTime = now();

        this.metricsPublisher.publishDurationMetric(
            now(),
            request.getAction(),
            (endTime.getTime() - startTime.getTime()));

        // ensure we got a valid response
        if (handlerResponse == null) {
            throw new TerminalException("Handler failed to provide a response.");
        }

        // When the handler responds IN_PROGRESS we trigger a callback to re-invoke the handler,
        // e.g. once the caller is able to supply credentials
        if (handlerResponse.getStatus() == OperationStatus.IN_PROGRESS) {
            final RequestContext nextContext = new RequestContext();
            nextContext.setInvocation(requestContext.getInvocation() + 1);
            nextContext.setCallbackContext(handlerResponse.getCallbackContext());

            // the re-invocation replays this request with the next context
            request.setRequestContext(nextContext);
            this.scheduler.rescheduleAfterMinutes(
                context.getInvokedFunctionArn(),
                handlerResponse.getCallbackDelayMinutes(),
                request);
        }

        // report the progress status back to the caller
        this.callbackAdapter.reportProgress(request.getBearerToken(),
            handlerResponse.getErrorCode(),
            handlerResponse.getStatus(),
            serializeModel(handlerResponse.getResourceModel()),
            handlerResponse.getMessage());

        return handlerResponse;
    }

    private Response createProgressResponse(final ProgressEvent<T> progressEvent) {
        final Response response = new Response();
        response.setMessage(progressEvent.getMessage());
        response.setStatus(progressEvent.getStatus());
        response.setErrorCode(progressEvent.getErrorCode());
        response.setResourceModel(serializeModel(progressEvent.getResourceModel()));

        if (progressEvent.getResourceModels() != null) {
            final List<JSONObject> models = new ArrayList<>();
            for (final T model : progressEvent.getResourceModels()) {
                models.add(serializeModel(model));
            }
            response.setResourceModels(models);
        }

        return response;
    }

    /**
     * Converts a resource model into its JSON form using the model's Jackson view
     */
    protected JSONObject serializeModel(final T resourceModel) {
        if (resourceModel == null) {
            return null;
        }
        return new JSONObject(this.objectMapper.convertValue(resourceModel, MODEL_TYPE));
    }

    private void writeResponse(final OutputStream outputStream,
                               final Response response) throws IOException {

        outputStream.write(new JSONObject(response).toString().getBytes(StandardCharsets.UTF_8));
        outputStream.close();
    }

    private void publishExceptionMetric(final HandlerRequest<Map<String, Object>> request,
                                        final Exception e) {
        try {
            this.metricsPublisher.publishExceptionMetric(
                now(),
                request == null ? null : request.getAction(),
                e);
        } catch (final RuntimeException metricsFailure) {
            // the failure response must still be written
            this.log(String.format("Unable to publish exception metric: %s", metricsFailure.getMessage()));
        }
    }

    private static Date now() {
        return Date.from(OffsetDateTime.now(ZoneOffset.UTC).toInstant());
    }

    /**
     * Converts the wire request into the typed request handed to the resource handler
     * @param request the decoded wire request, resource properties still untyped
     */
    protected abstract ResourceHandlerRequest<T> transform(final HandlerRequest<Map<String, Object>> request);

    /**
     * Routes the request to the handler for the action
     * @param session           caller session, null when no credentials were supplied
     * @param request           the typed request
     * @param action            the lifecycle action to perform
     * @param callbackContext   context returned by a previous IN_PROGRESS event, if any
     */
    public abstract ProgressEvent<T> invokeHandler(final SessionProxy session,
                                                   final ResourceHandlerRequest<T> request,
                                                   final Action action,
                                                   final Map<String, Object> callbackContext);

    /**
     * null-safe logger redirect
     * @param message A string containing the event to log.
     */
    protected void log(final String message) {
        if (this.logger != null) {
            this.logger.log(message);
        }
    }
}
