package com.oc.cfn.exceptions;

import com.oc.cfn.proxy.HandlerErrorCode;
import lombok.Getter;

@Getter
public class ResourceAlreadyExistsException extends BaseHandlerException {

    private static final long serialVersionUID = 2855328264315437287L;

    private final String resourceTypeName;
    private final String resourceIdentifier;

    public ResourceAlreadyExistsException(final String resourceTypeName,
                                          final String resourceIdentifier) {
        super(String.format("Resource of type '%s' with identifier '%s' already exists.",
                resourceTypeName, resourceIdentifier),
            HandlerErrorCode.AlreadyExists);
        this.resourceTypeName = resourceTypeName;
        this.resourceIdentifier = resourceIdentifier;
    }
}
