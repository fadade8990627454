package com.oc.cfn;

import com.amazonaws.services.cloudformation.AmazonCloudFormation;
import com.amazonaws.services.cloudformation.AmazonCloudFormationClientBuilder;
import com.amazonaws.services.cloudwatch.AmazonCloudWatch;
import com.amazonaws.services.cloudwatch.AmazonCloudWatchClientBuilder;
import com.amazonaws.services.cloudwatchevents.AmazonCloudWatchEvents;
import com.amazonaws.services.cloudwatchevents.AmazonCloudWatchEventsClientBuilder;
import com.oc.cfn.metrics.MetricsPublisher;
import com.oc.cfn.metrics.MetricsPublisherImpl;
import com.oc.cfn.proxy.CallbackAdapter;
import com.oc.cfn.proxy.CloudFormationCallbackAdapter;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;

import java.time.Clock;

/**
 * Wiring of the plugin's own AWS collaborators. These clients run with the Lambda execution role,
 * not with the caller credentials carried in the request.
 */
public class LambdaModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(MetricsPublisher.class).to(MetricsPublisherImpl.class);
        bind(CallbackAdapter.class).to(CloudFormationCallbackAdapter.class);
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    @Provides
    AmazonCloudFormation provideCloudFormation() {
        return AmazonCloudFormationClientBuilder.defaultClient();
    }

    @Provides
    AmazonCloudWatch provideCloudWatch() {
        return AmazonCloudWatchClientBuilder.defaultClient();
    }

    @Provides
    AmazonCloudWatchEvents provideCloudWatchEvents() {
        return AmazonCloudWatchEventsClientBuilder.defaultClient();
    }
}
