package com.oc.organizations.passwordpolicy;

import com.amazonaws.services.identitymanagement.AmazonIdentityManagement;
import com.amazonaws.services.identitymanagement.AmazonIdentityManagementClientBuilder;
import com.oc.cfn.proxy.SessionProxy;

final class ClientBuilder {

    private ClientBuilder() {
    }

    static AmazonIdentityManagement getClient(final SessionProxy session) {
        return session.client(AmazonIdentityManagementClientBuilder.standard());
    }
}
