package com.oc.cfn.proxy;

/**
 * IN_PROGRESS asks the caller to re-invoke the handler; SUCCESS and FAILED are terminal
 */
public enum OperationStatus {
    IN_PROGRESS,
    SUCCESS,
    FAILED
}
