package com.oc.organizations.passwordpolicy;

import com.amazonaws.services.identitymanagement.AmazonIdentityManagement;
import com.amazonaws.services.identitymanagement.model.NoSuchEntityException;
import com.oc.cfn.proxy.Logger;
import com.oc.cfn.proxy.ResourceHandlerRequest;
import com.oc.cfn.proxy.SessionProxy;
import org.junit.Before;

import java.util.HashMap;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

public abstract class AbstractTestBase {

    protected static final String LOGICAL_ID = "MyPasswordPolicy";

    protected AmazonIdentityManagement iam;
    protected SessionProxy session;
    protected Logger logger;

    @Before
    public void setupSession() {
        this.iam = mock(AmazonIdentityManagement.class);
        this.session = mock(SessionProxy.class);
        this.logger = mock(Logger.class);
        doReturn(this.iam).when(this.session).client(any());
    }

    protected static ResourceHandlerRequest<ResourceModel> request(final ResourceModel desiredState) {
        return ResourceHandlerRequest.<ResourceModel>builder()
            .logicalResourceIdentifier(LOGICAL_ID)
            .desiredResourceState(desiredState)
            .build();
    }

    protected static Map<String, Object> properties(final Object... keyValues) {
        final Map<String, Object> properties = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.put((String) keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    protected static NoSuchEntityException noSuchEntity() {
        final NoSuchEntityException e =
            new NoSuchEntityException("The Password Policy with domain name 123456789012 cannot be found.");
        e.setErrorCode("NoSuchEntity");
        e.setStatusCode(404);
        return e;
    }
}
