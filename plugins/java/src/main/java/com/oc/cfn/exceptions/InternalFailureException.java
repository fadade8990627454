package com.oc.cfn.exceptions;

import com.oc.cfn.proxy.HandlerErrorCode;

public class InternalFailureException extends BaseHandlerException {

    private static final long serialVersionUID = 6452398624391247658L;

    public InternalFailureException(final String message) {
        super(message, HandlerErrorCode.InternalFailure);
    }

    public InternalFailureException(final String message,
                                    final Throwable cause) {
        super(message, cause, HandlerErrorCode.InternalFailure);
    }
}
