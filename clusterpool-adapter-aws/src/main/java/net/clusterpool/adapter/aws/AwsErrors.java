package net.clusterpool.adapter.aws;

import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.awscore.exception.AwsServiceException;

/** Error text for SDK failures. Service errors lead with their error code so callers can match on it. */
final class AwsErrors {
    private AwsErrors() {}

    static String describe(Exception e) {
        if (e instanceof AwsServiceException ase) {
            AwsErrorDetails d = ase.awsErrorDetails();
            if (d != null && d.errorCode() != null) {
                return d.errorCode() + ": " + ase.getMessage();
            }
        }
        return e.getMessage();
    }

    static int statusCode(Exception e) {
        return e instanceof AwsServiceException ase ? ase.statusCode() : -1;
    }
}
