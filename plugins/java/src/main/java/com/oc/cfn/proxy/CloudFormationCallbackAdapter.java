package com.oc.cfn.proxy;

import com.amazonaws.services.cloudformation.AmazonCloudFormation;
import com.amazonaws.services.cloudformation.model.RecordHandlerProgressRequest;
import com.oc.cfn.LambdaModule;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.google.inject.Injector;
import org.json.JSONObject;

public class CloudFormationCallbackAdapter implements CallbackAdapter {

    private final AmazonCloudFormation cloudFormationClient;

    /**
     * This .ctor provided for Lambda runtime which will not automatically invoke Guice injector
     */
    public CloudFormationCallbackAdapter() {
        final Injector injector = Guice.createInjector(new LambdaModule());
        this.cloudFormationClient = injector.getInstance(AmazonCloudFormation.class);
    }

    /**
     * This .ctor provided for testing
     */
    @Inject
    public CloudFormationCallbackAdapter(final AmazonCloudFormation cloudFormationClient) {
        this.cloudFormationClient = cloudFormationClient;
    }

    @Override
    public void reportProgress(final String bearerToken,
                               final HandlerErrorCode errorCode,
                               final OperationStatus operationStatus,
                               final JSONObject resourceModel,
                               final String statusMessage) {
        final RecordHandlerProgressRequest request = new RecordHandlerProgressRequest()
            .withBearerToken(bearerToken)
            .withOperationStatus(translate(operationStatus))
            .withStatusMessage(statusMessage);

        if (resourceModel != null) {
            request.setResourceModel(resourceModel.toString());
        }

        if (errorCode != null) {
            request.withErrorCode(translate(errorCode));
        }

        this.cloudFormationClient.recordHandlerProgress(request);
    }

    private com.amazonaws.services.cloudformation.model.HandlerErrorCode translate(final HandlerErrorCode errorCode) {
        switch (errorCode) {
            case AccessDenied:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.AccessDenied;
            case AlreadyExists:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.AlreadyExists;
            case InvalidCredentials:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.InvalidCredentials;
            case InvalidRequest:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.InvalidRequest;
            case NetworkFailure:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.NetworkFailure;
            case NotFound:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.NotFound;
            case NotReady:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.NotStabilized;
            case NotUpdatable:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.NotUpdatable;
            case ServiceException:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.GeneralServiceException;
            case ServiceLimitExceeded:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.ServiceLimitExceeded;
            case ServiceTimeout:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.ServiceInternalError;
            case Throttling:
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.Throttling;
            default:
                // InternalFailure is CloudFormation's fallback error code when no more specificity is there
                return com.amazonaws.services.cloudformation.model.HandlerErrorCode.InternalFailure;
        }
    }

    private com.amazonaws.services.cloudformation.model.OperationStatus translate(final OperationStatus operationStatus) {
        switch (operationStatus) {
            case SUCCESS:
                return com.amazonaws.services.cloudformation.model.OperationStatus.SUCCESS;
            case IN_PROGRESS:
                return com.amazonaws.services.cloudformation.model.OperationStatus.IN_PROGRESS;
            default:
                // default will be to fail on unknown status
                return com.amazonaws.services.cloudformation.model.OperationStatus.FAILED;
        }
    }
}
