package net.clusterpool.adapter.aws;

import net.clusterpool.core.error.CredentialsException;
import net.clusterpool.core.error.UnableToUploadContentException;
import net.clusterpool.core.model.Credentials;
import net.clusterpool.core.spi.ContentStore;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.net.URI;

/** {@link ContentStore} on S3, addressed by {@code s3://bucket/key}. */
public final class S3ContentStore implements ContentStore, AutoCloseable {

    private final S3Client s3;

    public S3ContentStore(S3Client s3) {
        this.s3 = s3;
    }

    public static S3ContentStore forKey(Credentials.AccessKey key) {
        return new S3ContentStore(S3Client.builder()
                .region(Region.of(key.region()))
                .credentialsProvider(StaticKeys.provider(key))
                .build());
    }

    /** Store signed with the SDK's default credential chain (environment, profile, instance role). */
    public static S3ContentStore forRegion(String region) {
        return new S3ContentStore(S3Client.builder()
                .region(Region.of(region == null ? Credentials.DEFAULT_REGION : region))
                .build());
    }

    @Override
    public void upload(String uri, byte[] content) throws UnableToUploadContentException {
        Location loc = Location.parse(uri);
        try {
            s3.putObject(PutObjectRequest.builder().bucket(loc.bucket()).key(loc.key()).build(), RequestBody.fromBytes(content));
        } catch (SdkException e) {
            throw new UnableToUploadContentException(uri, "Unable to upload content - msg: " + AwsErrors.describe(e), e);
        }
    }

    @Override
    public byte[] download(String uri) throws IOException {
        Location loc = Location.parse(uri);
        try {
            return s3.getObjectAsBytes(GetObjectRequest.builder().bucket(loc.bucket()).key(loc.key()).build()).asByteArray();
        } catch (SdkException e) {
            throw new IOException("Unable to download " + uri + " - msg: " + AwsErrors.describe(e), e);
        }
    }

    @Override
    public boolean exists(String uri) throws CredentialsException {
        Location loc = Location.parse(uri);
        try {
            s3.headObject(HeadObjectRequest.builder().bucket(loc.bucket()).key(loc.key()).build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (SdkException e) {
            int status = AwsErrors.statusCode(e);
            if (status == 404) return false;
            if (status == 403) {
                throw new CredentialsException(uri, "The credentials for reading " + uri + " are invalid", e);
            }
            throw new IllegalStateException("Unable to look up " + uri + " - msg: " + AwsErrors.describe(e), e);
        }
    }

    @Override
    public void close() {
        s3.close();
    }

    record Location(String bucket, String key) {
        static Location parse(String uri) {
            URI u = URI.create(uri);
            if (!"s3".equals(u.getScheme()) || u.getAuthority() == null) {
                throw new IllegalArgumentException("not an s3 uri: " + uri);
            }
            String path = u.getPath() == null ? "" : u.getPath();
            return new Location(u.getAuthority(), path.startsWith("/") ? path.substring(1) : path);
        }
    }
}
