package com.oc.cfn.proxy;

import org.json.JSONObject;

/**
 * Interface used to abstract the function of reporting back provisioning progress to the handler caller
 */
public interface CallbackAdapter {

    void reportProgress(final String bearerToken,
                        final HandlerErrorCode errorCode,
                        final OperationStatus operationStatus,
                        final JSONObject resourceModel,
                        final String statusMessage);

}
