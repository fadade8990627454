package com.oc.cfn.metrics;

import com.amazonaws.services.cloudwatch.AmazonCloudWatch;
import com.amazonaws.services.cloudwatch.model.Dimension;
import com.amazonaws.services.cloudwatch.model.MetricDatum;
import com.amazonaws.services.cloudwatch.model.PutMetricDataRequest;
import com.amazonaws.services.cloudwatch.model.StandardUnit;
import com.oc.cfn.Action;
import com.oc.cfn.LambdaModule;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MetricsPublisherImpl implements MetricsPublisher {

    private final AmazonCloudWatch amazonCloudWatch;
    private String namespace = Metrics.METRIC_NAMESPACE_ROOT;
    private String resourceTypeName;

    /**
     * This .ctor provided for Lambda runtime which will not invoke Guice injector
     */
    public MetricsPublisherImpl() {
        final Injector injector = Guice.createInjector(new LambdaModule());
        this.amazonCloudWatch = injector.getInstance(AmazonCloudWatch.class);
    }

    /**
     * This .ctor provided for testing
     * @param amazonCloudWatch client the metric data is put through
     */
    @Inject
    public MetricsPublisherImpl(final AmazonCloudWatch amazonCloudWatch) {
        this.amazonCloudWatch = amazonCloudWatch;
    }

    @Override
    public void setResourceTypeName(final String resourceTypeName) {
        this.resourceTypeName = resourceTypeName;
        this.namespace = resourceTypeName == null
            ? Metrics.METRIC_NAMESPACE_ROOT
            : String.format("%s/%s", Metrics.METRIC_NAMESPACE_ROOT, resourceTypeName.replace("::", "/"));
    }

    @Override
    public void publishExceptionMetric(final Date timestamp,
                                       final Action action,
                                       final Exception e) {
        final Map<String, String> dimensions = dimensionsFor(action);
        dimensions.put(Metrics.DIMENSION_KEY_EXCEPTION_TYPE, e.getClass().getName());

        publishMetric(Metrics.METRIC_NAME_HANDLER_EXCEPTION,
            dimensions,
            StandardUnit.Count,
            1.0,
            timestamp);
    }

    @Override
    public void publishInvocationMetric(final Date timestamp,
                                        final Action action) {
        publishMetric(
            Metrics.METRIC_NAME_HANDLER_INVOCATION_COUNT,
            dimensionsFor(action),
            StandardUnit.Count,
            1.0,
            timestamp);
    }

    @Override
    public void publishDurationMetric(final Date timestamp,
                                      final Action action,
                                      final long milliseconds) {
        publishMetric(
            Metrics.METRIC_NAME_HANDLER_DURATION,
            dimensionsFor(action),
            StandardUnit.Milliseconds,
            (double) milliseconds,
            timestamp);
    }

    private Map<String, String> dimensionsFor(final Action action) {
        final Map<String, String> dimensions = new LinkedHashMap<>();
        dimensions.put(Metrics.DIMENSION_KEY_ACTION_TYPE, action == null ? "NO_ACTION" : action.name());
        if (this.resourceTypeName != null) {
            dimensions.put(Metrics.DIMENSION_KEY_RESOURCE_TYPE, this.resourceTypeName);
        }
        return dimensions;
    }

    private void publishMetric(final String metricName,
                               final Map<String, String> dimensionData,
                               final StandardUnit unit,
                               final Double value,
                               final Date timestamp) {

        final List<Dimension> dimensions = new ArrayList<>();
        for (final Map.Entry<String, String> kvp : dimensionData.entrySet()) {
            final Dimension dimension = new Dimension()
                .withName(kvp.getKey())
                .withValue(kvp.getValue());
            dimensions.add(dimension);
        }

        final MetricDatum metricDatum = new MetricDatum()
            .withMetricName(metricName)
            .withUnit(unit)
            .withValue(value)
            .withDimensions(dimensions)
            .withTimestamp(timestamp);

        final PutMetricDataRequest putMetricDataRequest = new PutMetricDataRequest()
            .withNamespace(this.namespace)
            .withMetricData(metricDatum);

        this.amazonCloudWatch.putMetricData(putMetricDataRequest);
    }
}
