package com.oc.organizations.passwordpolicy;

import com.amazonaws.services.identitymanagement.model.GetAccountPasswordPolicyRequest;
import com.amazonaws.services.identitymanagement.model.GetAccountPasswordPolicyResult;
import com.amazonaws.services.identitymanagement.model.PasswordPolicy;
import com.amazonaws.services.identitymanagement.model.UpdateAccountPasswordPolicyRequest;
import com.oc.cfn.exceptions.ResourceNotFoundException;
import com.oc.cfn.proxy.OperationStatus;
import com.oc.cfn.proxy.ProgressEvent;
import org.junit.Test;
import org.mockito.InOrder;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.core.Is.is;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class UpdateHandlerTest extends AbstractTestBase {

    @Test
    public void handleRequest_SimpleSuccess() {
        when(this.iam.getAccountPasswordPolicy(any(GetAccountPasswordPolicyRequest.class)))
            .thenReturn(new GetAccountPasswordPolicyResult()
                .withPasswordPolicy(new PasswordPolicy().withMinimumPasswordLength(8).withRequireNumbers(true)));
        final ResourceModel desired = ResourceModel.of(properties(
            "ResourceId", "abc",
            "MinimumPasswordLength", 14));

        final ProgressEvent<ResourceModel> response =
            new UpdateHandler().handleRequest(this.session, request(desired), null, this.logger);

        assertThat(response.getStatus(), is(equalTo(OperationStatus.SUCCESS)));
        // the retrieved state is not merged into the result
        assertThat(response.getResourceModel(), is(equalTo(desired)));

        final InOrder order = inOrder(this.iam);
        order.verify(this.iam).getAccountPasswordPolicy(any(GetAccountPasswordPolicyRequest.class));
        order.verify(this.iam).updateAccountPasswordPolicy(
            new UpdateAccountPasswordPolicyRequest().withMinimumPasswordLength(14));
        verify(this.logger).log(
            "OC::Organizations::PasswordPolicy [abc] [abc] successfully upserted.");
    }

    @Test
    public void handleRequest_LogsLogicalIdWhenNoResourceId() {
        when(this.iam.getAccountPasswordPolicy(any(GetAccountPasswordPolicyRequest.class)))
            .thenReturn(new GetAccountPasswordPolicyResult().withPasswordPolicy(new PasswordPolicy()));

        final ProgressEvent<ResourceModel> response = new UpdateHandler().handleRequest(
            this.session, request(ResourceModel.of(properties("HardExpiry", true))), null, this.logger);

        verify(this.logger).log(String.format(
            "OC::Organizations::PasswordPolicy [%s] [MyPasswordPolicy] successfully upserted.",
            response.getResourceModel().getResourceId()));
    }

    @Test
    public void handleRequest_PolicyGone() {
        when(this.iam.getAccountPasswordPolicy(any(GetAccountPasswordPolicyRequest.class))).thenThrow(noSuchEntity());

        assertThrows(ResourceNotFoundException.class, () -> new UpdateHandler().handleRequest(
            this.session, request(ResourceModel.of(properties("MinimumPasswordLength", 14))), null, this.logger));

        verify(this.iam, never()).updateAccountPasswordPolicy(any());
    }

    @Test
    public void handleRequest_NoSessionIsInProgress() {
        final ResourceModel desired = ResourceModel.of(properties("MinimumPasswordLength", 14));

        final ProgressEvent<ResourceModel> response =
            new UpdateHandler().handleRequest(null, request(desired), null, this.logger);

        assertThat(response.getStatus(), is(equalTo(OperationStatus.IN_PROGRESS)));
        assertThat(response.getResourceModel(), is(equalTo(desired)));
        verifyNoInteractions(this.iam);
    }
}
