package com.oc.cfn.exceptions;

import com.oc.cfn.proxy.HandlerErrorCode;
import lombok.Getter;

@Getter
public class ResourceNotFoundException extends BaseHandlerException {

    private static final long serialVersionUID = -7312734417473536862L;

    private final String resourceTypeName;
    private final String resourceIdentifier;

    public ResourceNotFoundException(final String resourceTypeName,
                                     final String resourceIdentifier) {
        super(String.format("Resource of type '%s' with identifier '%s' was not found.",
                resourceTypeName, resourceIdentifier),
            HandlerErrorCode.NotFound);
        this.resourceTypeName = resourceTypeName;
        this.resourceIdentifier = resourceIdentifier;
    }
}
