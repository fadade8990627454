package com.oc.cfn.proxy;

/**
 * Log sink handed to resource handlers
 */
public interface Logger {

    void log(final String message);
}
