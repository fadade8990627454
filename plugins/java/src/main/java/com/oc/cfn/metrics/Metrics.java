package com.oc.cfn.metrics;

public final class Metrics {

    public static final String METRIC_NAMESPACE_ROOT = "OC/CloudFormation";
    public static final String METRIC_NAME_HANDLER_EXCEPTION = "HandlerException";
    public static final String METRIC_NAME_HANDLER_DURATION = "HandlerInvocationDuration";
    public static final String METRIC_NAME_HANDLER_INVOCATION_COUNT = "HandlerInvocationCount";

    public static final String DIMENSION_KEY_ACTION_TYPE = "Action";
    public static final String DIMENSION_KEY_EXCEPTION_TYPE = "ExceptionType";
    public static final String DIMENSION_KEY_RESOURCE_TYPE = "ResourceType";

    private Metrics() {
    }
}
