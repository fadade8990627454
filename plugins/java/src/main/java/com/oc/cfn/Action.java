package com.oc.cfn;

/**
 * The lifecycle actions a resource provider is invoked for
 */
public enum Action {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    LIST
}
