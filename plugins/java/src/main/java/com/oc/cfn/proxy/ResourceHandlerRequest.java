package com.oc.cfn.proxy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The typed request handed to a resource handler
 * @param <T> Type of resource model being provisioned
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceHandlerRequest<T> {
    private String awsAccountId;
    private String region;
    private String nextToken;
    private String resourceType;
    private String resourceTypeVersion;
    private String logicalResourceIdentifier;
    private T desiredResourceState;
    private T previousResourceState;
}
