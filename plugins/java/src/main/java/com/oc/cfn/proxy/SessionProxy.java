package com.oc.cfn.proxy;

import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.client.builder.AwsClientBuilder;
import lombok.Getter;

/**
 * An authenticated session for the caller's account. Handlers build the service clients
 * they need from it; one session lives for a single invocation.
 */
@Getter
public class SessionProxy {

    private final Credentials credentials;
    private final String region;

    public SessionProxy(final Credentials credentials,
                        final String region) {
        this.credentials = credentials;
        this.region = region;
    }

    /**
     * @return a session for the supplied credentials, or null when the caller sent none
     */
    public static SessionProxy from(final Credentials credentials,
                                    final String region) {
        if (credentials == null || credentials.getAccessKeyId() == null) {
            return null;
        }
        return new SessionProxy(credentials, region);
    }

    /**
     * Configures the builder with this session's credentials and region and builds the client
     * @param builder   a fresh SDK client builder, e.g. {@code AmazonIdentityManagementClientBuilder.standard()}
     * @param <C>       the client interface the builder produces
     * @return the authenticated client
     */
    public <C> C client(final AwsClientBuilder<?, C> builder) {
        builder.setCredentials(new AWSStaticCredentialsProvider(this.credentials.toAwsCredentials()));
        if (this.region != null) {
            builder.setRegion(this.region);
        }
        return builder.build();
    }
}
