package com.oc.cfn.exceptions;

import com.oc.cfn.proxy.HandlerErrorCode;
import lombok.Getter;

/**
 * Base class of the failures a handler raises on purpose; the wrapper reports them with their own error code
 */
@Getter
public abstract class BaseHandlerException extends RuntimeException {

    private static final long serialVersionUID = -1413947916536372716L;

    private final HandlerErrorCode errorCode;

    protected BaseHandlerException(final String message,
                                   final HandlerErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    protected BaseHandlerException(final String message,
                                   final Throwable cause,
                                   final HandlerErrorCode errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
