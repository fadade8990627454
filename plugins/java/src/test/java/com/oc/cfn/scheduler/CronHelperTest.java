package com.oc.cfn.scheduler;

import org.junit.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsEqual.equalTo;

public class CronHelperTest {

    private static CronHelper cronHelperAt(final String instant) {
        return new CronHelper(Clock.fixed(Instant.parse(instant), ZoneOffset.UTC));
    }

    @Test
    public void testGenerateOneTimeCronExpression_Simple() {
        assertThat(
            cronHelperAt("2018-10-30T13:40:23Z").generateOneTimeCronExpression(5),
            is(equalTo("cron(45 13 30 10 ? 2018)"))
        );
    }

    @Test
    public void testGenerateOneTimeCronExpression_DayBreak() {
        assertThat(
            cronHelperAt("2018-10-30T23:59:01Z").generateOneTimeCronExpression(3),
            is(equalTo("cron(2 0 31 10 ? 2018)"))
        );
    }

    @Test
    public void testGenerateOneTimeCronExpression_YearBreak() {
        assertThat(
            cronHelperAt("2018-12-31T23:56:59Z").generateOneTimeCronExpression(5),
            is(equalTo("cron(1 0 1 1 ? 2019)"))
        );
    }

    @Test
    public void testGenerateOneTimeCronExpression_Zero() {
        assertThat(
            cronHelperAt("2019-02-28T08:07:00Z").generateOneTimeCronExpression(0),
            is(equalTo("cron(7 8 28 2 ? 2019)"))
        );
    }
}
