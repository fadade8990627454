package com.oc.cfn;

import com.oc.cfn.proxy.HandlerErrorCode;
import com.oc.cfn.proxy.OperationStatus;
import lombok.Data;
import org.json.JSONObject;

import java.util.List;

/**
 * The payload written back to the caller on every invocation. Null members are left out of the JSON.
 */
@Data
public class Response {

    /**
     * The status indicates whether the handler has reached a terminal state or
     * is still computing and requires more time to complete
     */
    private OperationStatus status;

    /**
     * Set when the status is FAILED
     */
    private HandlerErrorCode errorCode;

    /**
     * Contextual information about the progress transition or failure
     */
    private String message;

    /**
     * The output resource instance populated by a READ for synchronous results
     * and by CREATE/UPDATE/DELETE for final response validation/confirmation
     */
    private JSONObject resourceModel;

    /**
     * The output resource instances populated by a LIST
     */
    private List<JSONObject> resourceModels;
}
