package com.oc.cfn.exceptions;

/**
 * Raised by the wrapper when an invocation cannot proceed: the request is missing or undecodable, no handler
 * serves the action, or the handler returned nothing. Reported to the caller as an InternalFailure.
 */
public class TerminalException extends RuntimeException {

    private static final long serialVersionUID = 4181625263391504227L;

    public TerminalException(final String message) {
        super(message);
    }
}
