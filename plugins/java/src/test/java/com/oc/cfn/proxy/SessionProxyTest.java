package com.oc.cfn.proxy;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSSessionCredentials;
import com.amazonaws.services.cloudwatch.AmazonCloudWatch;
import com.amazonaws.services.cloudwatch.AmazonCloudWatchClientBuilder;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;

public class SessionProxyTest {

    @Test
    public void testFrom_NoCredentials() {
        assertThat(SessionProxy.from(null, "us-east-1"), is(nullValue()));
        assertThat(SessionProxy.from(new Credentials(), "us-east-1"), is(nullValue()));
    }

    @Test
    public void testFrom_WithCredentials() {
        final Credentials credentials = new Credentials("AKID", "secret", "token");

        final SessionProxy session = SessionProxy.from(credentials, "eu-west-1");

        assertThat(session, is(notNullValue()));
        assertThat(session.getRegion(), is(equalTo("eu-west-1")));
        assertThat(session.getCredentials(), is(equalTo(credentials)));
    }

    @Test
    public void testClient_BuildsWithSessionRegion() {
        final SessionProxy session = new SessionProxy(new Credentials("AKID", "secret", null), "eu-west-1");

        final AmazonCloudWatch client = session.client(AmazonCloudWatchClientBuilder.standard());

        assertThat(client, is(notNullValue()));
    }

    @Test
    public void testToAwsCredentials_SessionToken() {
        final AWSCredentials withToken = new Credentials("AKID", "secret", "token").toAwsCredentials();
        final AWSCredentials withoutToken = new Credentials("AKID", "secret", "").toAwsCredentials();

        assertThat(withToken, is(instanceOf(AWSSessionCredentials.class)));
        assertThat(((AWSSessionCredentials) withToken).getSessionToken(), is(equalTo("token")));
        assertThat(withoutToken, is(not(instanceOf(AWSSessionCredentials.class))));
        assertThat(withoutToken.getAWSAccessKeyId(), is(equalTo("AKID")));
    }

    @Test
    public void testToString_HidesSecrets() {
        final String text = new Credentials("AKID", "secret", "token").toString();

        assertThat(text.contains("secret"), is(false));
        assertThat(text.contains("token"), is(false));
    }
}
