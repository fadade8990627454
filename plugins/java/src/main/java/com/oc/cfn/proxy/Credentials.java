package com.oc.cfn.proxy;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.BasicSessionCredentials;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Short-lived caller credentials delivered with the request
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Credentials {
    private String accessKeyId;
    @ToString.Exclude
    private String secretAccessKey;
    @ToString.Exclude
    private String sessionToken;

    @JsonIgnore
    public AWSCredentials toAwsCredentials() {
        if (this.sessionToken == null || this.sessionToken.isEmpty()) {
            return new BasicAWSCredentials(this.accessKeyId, this.secretAccessKey);
        }
        return new BasicSessionCredentials(this.accessKeyId, this.secretAccessKey, this.sessionToken);
    }
}
