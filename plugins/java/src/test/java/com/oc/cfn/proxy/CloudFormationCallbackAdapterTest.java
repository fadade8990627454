package com.oc.cfn.proxy;

import com.amazonaws.services.cloudformation.AmazonCloudFormation;
import com.amazonaws.services.cloudformation.model.RecordHandlerProgressRequest;
import org.json.JSONObject;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collections;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

public class CloudFormationCallbackAdapterTest {

    private AmazonCloudFormation cloudFormation;
    private CloudFormationCallbackAdapter adapter;

    @Before
    public void setup() {
        this.cloudFormation = mock(AmazonCloudFormation.class);
        this.adapter = new CloudFormationCallbackAdapter(this.cloudFormation);
    }

    private RecordHandlerProgressRequest captureRequest() {
        final ArgumentCaptor<RecordHandlerProgressRequest> captor =
            ArgumentCaptor.forClass(RecordHandlerProgressRequest.class);
        verify(this.cloudFormation).recordHandlerProgress(captor.capture());
        return captor.getValue();
    }

    @Test
    public void testReportProgress_Success() {
        final JSONObject model = new JSONObject(Collections.singletonMap("ResourceId", "abc"));

        this.adapter.reportProgress("123456", null, OperationStatus.SUCCESS, model, null);

        final RecordHandlerProgressRequest request = captureRequest();
        assertThat(request.getBearerToken(), is(equalTo("123456")));
        assertThat(request.getOperationStatus(), is(equalTo("SUCCESS")));
        assertThat(request.getResourceModel(), is(equalTo("{\"ResourceId\":\"abc\"}")));
        assertThat(request.getErrorCode(), is(nullValue()));
    }

    @Test
    public void testReportProgress_FailedTranslatesErrorCode() {
        this.adapter.reportProgress("123456", HandlerErrorCode.NotReady, OperationStatus.FAILED, null, "waiting");

        final RecordHandlerProgressRequest request = captureRequest();
        assertThat(request.getOperationStatus(), is(equalTo("FAILED")));
        assertThat(request.getErrorCode(), is(equalTo("NotStabilized")));
        assertThat(request.getStatusMessage(), is(equalTo("waiting")));
        assertThat(request.getResourceModel(), is(nullValue()));
    }

    @Test
    public void testReportProgress_ServiceErrorCodes() {
        this.adapter.reportProgress("t", HandlerErrorCode.ServiceException, OperationStatus.FAILED, null, null);
        assertThat(captureRequest().getErrorCode(), is(equalTo("GeneralServiceException")));
    }

    @Test
    public void testReportProgress_NoOperationFallsBackToInternalFailure() {
        this.adapter.reportProgress("t", HandlerErrorCode.NoOperationToPerform, OperationStatus.FAILED, null, null);
        assertThat(captureRequest().getErrorCode(), is(equalTo("InternalFailure")));
    }

    @Test
    public void testReportProgress_InProgress() {
        this.adapter.reportProgress("t", null, OperationStatus.IN_PROGRESS, null, null);
        assertThat(captureRequest().getOperationStatus(), is(equalTo("IN_PROGRESS")));
    }
}
