package com.oc.cfn.proxy;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The resource-specific part of a request. Properties stay untyped until the resource type coerces them.
 * @param <T> Type of the desired and previous resource properties
 */
@Data
@NoArgsConstructor
public class RequestData<T> {
    /**
     * Absent when the caller could not supply credentials yet
     */
    private Credentials credentials;
    private String logicalResourceId;
    private T resourceProperties;

    /**
     * Only populated for UPDATE
     */
    private T previousResourceProperties;
}
