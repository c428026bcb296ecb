package net.clusterpool.adapter.aws;

import net.clusterpool.core.model.Credentials;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

final class StaticKeys {
    private StaticKeys() {}

    static AwsCredentialsProvider provider(Credentials.AccessKey key) {
        AwsCredentials creds = key.sessionToken() == null || key.sessionToken().isBlank()
                ? AwsBasicCredentials.create(key.accessKeyId(), key.secretAccessKey())
                : AwsSessionCredentials.create(key.accessKeyId(), key.secretAccessKey(), key.sessionToken());
        return StaticCredentialsProvider.create(creds);
    }
}
