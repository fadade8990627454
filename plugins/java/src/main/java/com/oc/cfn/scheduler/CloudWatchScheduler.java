package com.oc.cfn.scheduler;

import com.amazonaws.services.cloudwatchevents.AmazonCloudWatchEvents;
import com.amazonaws.services.cloudwatchevents.model.DeleteRuleRequest;
import com.amazonaws.services.cloudwatchevents.model.PutRuleRequest;
import com.amazonaws.services.cloudwatchevents.model.PutTargetsRequest;
import com.amazonaws.services.cloudwatchevents.model.RemoveTargetsRequest;
import com.amazonaws.services.cloudwatchevents.model.RuleState;
import com.amazonaws.services.cloudwatchevents.model.Target;
import com.oc.cfn.LambdaModule;
import com.oc.cfn.proxy.HandlerRequest;
import com.oc.cfn.proxy.Logger;
import com.oc.cfn.proxy.RequestContext;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import lombok.Getter;
import lombok.Setter;
import org.apache.commons.lang3.StringUtils;
import org.json.JSONObject;

import java.util.UUID;

/**
 * Re-invokes an IN_PROGRESS handler through a one-time CloudWatch Events rule targeting the handler's own function
 */
public class CloudWatchScheduler {

    static final String RULE_NAME_PREFIX = "reinvoke-handler-";
    static final String TARGET_ID_PREFIX = "reinvoke-target-";

    @Getter
    @Setter
    private Logger logger;
    private final CronHelper cronHelper;
    private final AmazonCloudWatchEvents client;

    /**
     * This .ctor provided for Lambda runtime which will not automatically invoke Guice injector
     */
    public CloudWatchScheduler() {
        final Injector injector = Guice.createInjector(new LambdaModule());
        this.client = injector.getInstance(AmazonCloudWatchEvents.class);
        this.cronHelper = new CronHelper();
    }

    /**
     * This .ctor provided for testing
     */
    @Inject
    public CloudWatchScheduler(final AmazonCloudWatchEvents client,
                               final CronHelper cronHelper) {
        this.client = client;
        this.cronHelper = cronHelper;
    }

    /**
     * Schedule a re-invocation of the executing handler no less than 1 minute from now. The target input is the
     * whole request, so the re-invocation decodes exactly like the original one.
     * @param functionArn       the ARN of the Lambda function to be invoked
     * @param minutesFromNow    the minimum minutes from now that the re-invocation will occur. CWE provides only
     *                          minute-granularity
     * @param request           the request to replay; its request context must already hold the next invocation
     */
    public void rescheduleAfterMinutes(final String functionArn,
                                       final int minutesFromNow,
                                       final HandlerRequest<?> request) {

        // minutes must be a positive integer
        final String cronRule = this.cronHelper.generateOneTimeCronExpression(Math.max(minutesFromNow, 1));

        final UUID rescheduleId = UUID.randomUUID();
        final String ruleName = RULE_NAME_PREFIX + rescheduleId;
        final String targetId = TARGET_ID_PREFIX + rescheduleId;

        // record the CloudWatchEvents objects for cleanup on the callback
        final RequestContext requestContext = request.getRequestContext();
        requestContext.setCloudWatchEventsRuleName(ruleName);
        requestContext.setCloudWatchEventsTargetId(targetId);

        final String jsonRequest = new JSONObject(request).toString();
        this.log(String.format("Scheduling re-invoke at %s (%s)", cronRule, rescheduleId));

        final PutRuleRequest putRuleRequest = new PutRuleRequest()
            .withName(ruleName)
            .withScheduleExpression(cronRule)
            .withState(RuleState.ENABLED);
        this.client.putRule(putRuleRequest);

        final Target target = new Target()
            .withArn(functionArn)
            .withId(targetId)
            .withInput(jsonRequest);
        final PutTargetsRequest putTargetsRequest = new PutTargetsRequest()
            .withTargets(target)
            .withRule(putRuleRequest.getName());
        this.client.putTargets(putTargetsRequest);
    }

    /**
     * After a re-invocation, the CWE rule which generated the reinvocation should be scrubbed.
     * Cleanup failures are logged and never fail the invocation.
     * @param cloudWatchEventsRuleName  the name of the CWE rule which triggered a re-invocation
     * @param cloudWatchEventsTargetId  the target of the CWE rule which triggered a re-invocation
     */
    public void cleanupCloudWatchEvents(final String cloudWatchEventsRuleName,
                                        final String cloudWatchEventsTargetId) {

        // targets must be removed before their rule can be deleted
        try {
            if (StringUtils.isNotEmpty(cloudWatchEventsTargetId)) {
                final RemoveTargetsRequest removeTargetsRequest = new RemoveTargetsRequest()
                    .withRule(cloudWatchEventsRuleName)
                    .withIds(cloudWatchEventsTargetId);
                this.client.removeTargets(removeTargetsRequest);
            }
        } catch (final Exception e) {
            this.log(String.format("Error cleaning CloudWatchEvents Target (targetId=%s): %s",
                cloudWatchEventsTargetId,
                e.getMessage()));
        }

        try {
            if (StringUtils.isNotEmpty(cloudWatchEventsRuleName)) {
                final DeleteRuleRequest deleteRuleRequest = new DeleteRuleRequest()
                    .withName(cloudWatchEventsRuleName);
                this.client.deleteRule(deleteRuleRequest);
            }
        } catch (final Exception e) {
            this.log(String.format("Error cleaning CloudWatchEvents (ruleName=%s): %s",
                cloudWatchEventsRuleName,
                e.getMessage()));
        }
    }

    private void log(final String message) {
        if (this.logger != null) {
            this.logger.log(message);
        }
    }
}
