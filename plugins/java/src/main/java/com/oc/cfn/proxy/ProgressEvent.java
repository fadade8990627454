package com.oc.cfn.proxy;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
public class ProgressEvent<T> {
    /**
     * The status indicates whether the handler has reached a terminal state or
     * is still computing and requires more time to complete
     */
    private OperationStatus status;

    /**
     * If OperationStatus is FAILED, an error code should be provided
     */
    private HandlerErrorCode errorCode;

    /**
     * The handler can (and should) specify a contextual information message which
     * can be shown to callers to indicate the nature of a progress transition
     * or callback delay
     */
    private String message;

    /**
     * Arbitrary state the handler can return in an IN_PROGRESS event; it is
     * handed back unchanged on the re-invocation
     */
    private Map<String, Object> callbackContext;

    /**
     * A callback will be scheduled with an initial delay of no less than
     * the number of minutes specified in the progress event. Values below
     * one minute are raised to one minute.
     */
    private int callbackDelayMinutes;

    /**
     * The output resource instance populated by a READ for synchronous results
     * and by CREATE/UPDATE/DELETE for final response validation/confirmation
     */
    private T resourceModel;

    /**
     * The output resource instances populated by a LIST for synchronous results
     */
    private List<T> resourceModels;

    public static <T> ProgressEvent<T> progress(final T model,
                                                final OperationStatus status) {
        final ProgressEvent<T> event = new ProgressEvent<>();
        event.setResourceModel(model);
        event.setStatus(status);
        return event;
    }

    public static <T> ProgressEvent<T> failed(final HandlerErrorCode errorCode,
                                              final String message) {
        final ProgressEvent<T> event = new ProgressEvent<>();
        event.setErrorCode(errorCode);
        event.setMessage(message);
        event.setStatus(OperationStatus.FAILED);
        return event;
    }
}
