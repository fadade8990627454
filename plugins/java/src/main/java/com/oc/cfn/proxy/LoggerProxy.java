package com.oc.cfn.proxy;

import com.amazonaws.services.lambda.runtime.LambdaLogger;

/**
 * Forwards handler log lines to the Lambda runtime logger, which ships them to CloudWatch Logs
 */
public class LoggerProxy implements Logger {

    private final LambdaLogger logger;

    public LoggerProxy(final LambdaLogger logger) {
        this.logger = logger;
    }

    /**
     * null-safe logger redirect
     * @param message A string containing the event to log.
     */
    @Override
    public void log(final String message) {
        if (this.logger != null) {
            this.logger.log(String.format("%s%n", message));
        }
    }
}
