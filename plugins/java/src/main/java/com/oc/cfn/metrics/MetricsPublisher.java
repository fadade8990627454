package com.oc.cfn.metrics;

import com.oc.cfn.Action;

import java.util.Date;

/**
 * Records one data point per handler invocation event. Every metric carries the lifecycle action as a
 * dimension; a request that could not be decoded has no action and is recorded as {@code NO_ACTION}.
 */
public interface MetricsPublisher {

    /**
     * Scopes subsequent metrics to a resource type. {@code OC::Organizations::PasswordPolicy} publishes under
     * {@code OC/CloudFormation/OC/Organizations/PasswordPolicy}; while no type is known metrics go to the
     * {@code OC/CloudFormation} root without a resource type dimension.
     * @param resourceTypeName the type named by the request, or null
     */
    void setResourceTypeName(String resourceTypeName);

    void publishExceptionMetric(Date timestamp, Action action, Exception e);

    void publishInvocationMetric(Date timestamp, Action action);

    /**
     * @param milliseconds time spent inside the resource handler
     */
    void publishDurationMetric(Date timestamp, Action action, long milliseconds);
}
