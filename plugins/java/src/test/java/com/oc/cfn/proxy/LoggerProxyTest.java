package com.oc.cfn.proxy;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import org.junit.Test;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class LoggerProxyTest {

    @Test
    public void testLog_AppendsLineSeparator() {
        final LambdaLogger lambdaLogger = mock(LambdaLogger.class);

        new LoggerProxy(lambdaLogger).log("hello");

        verify(lambdaLogger).log(String.format("hello%n"));
    }

    @Test
    public void testLog_NullLoggerIsIgnored() {
        new LoggerProxy(null).log("hello");
    }
}
