package com.oc.cfn.proxy;

import com.oc.cfn.Action;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A provisioning request as it arrives on the wire. The same shape is scheduled as the input of a
 * re-invocation, carrying the next {@link RequestContext}; fields not declared here are ignored on decode.
 * @param <T> Type of the resource properties in the request payload
 */
@Data
@NoArgsConstructor
public class HandlerRequest<T> {
    private Action action;
    private String awsAccountId;

    /**
     * Identifies the operation when reporting progress back to CloudFormation
     */
    private String bearerToken;

    /**
     * Pagination token, LIST only
     */
    private String nextToken;
    private String region;
    private String resourceType;
    private String resourceTypeVersion;
    private RequestData<T> requestData;
    private RequestContext requestContext;
}
