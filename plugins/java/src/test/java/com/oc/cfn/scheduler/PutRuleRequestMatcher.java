package com.oc.cfn.scheduler;

import com.amazonaws.services.cloudwatchevents.model.PutRuleRequest;
import lombok.AllArgsConstructor;
import org.mockito.ArgumentMatcher;

/**
 * Matches a one-time re-invoke rule by name prefix, schedule and state
 */
@AllArgsConstructor
public class PutRuleRequestMatcher implements ArgumentMatcher<PutRuleRequest> {

    private final String namePrefix;
    private final String scheduleExpression;
    private final String state;

    @Override
    public boolean matches(final PutRuleRequest argument) {
        return argument != null &&
            argument.getEventPattern() == null &&
            argument.getRoleArn() == null &&
            argument.getName().startsWith(namePrefix) &&
            scheduleExpression.equals(argument.getScheduleExpression()) &&
            state.equals(argument.getState());
    }
}
