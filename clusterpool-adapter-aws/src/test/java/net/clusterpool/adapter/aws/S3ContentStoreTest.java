package net.clusterpool.adapter.aws;

import net.clusterpool.core.error.CredentialsException;
import net.clusterpool.core.error.UnableToUploadContentException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class S3ContentStoreTest {

    @Mock
    S3Client s3;

    static S3Exception status(int code) {
        return (S3Exception) S3Exception.builder().statusCode(code).message("status " + code).build();
    }

    @Test
    void upload_targets_bucket_and_key_from_the_uri() throws Exception {
        new S3ContentStore(s3).upload("s3://bi.config.dl/cluster-manager/etl/1.json",
                "{}".getBytes(StandardCharsets.UTF_8));

        ArgumentCaptor<PutObjectRequest> sent = ArgumentCaptor.forClass(PutObjectRequest.class);
        verify(s3).putObject(sent.capture(), any(RequestBody.class));
        assertEquals("bi.config.dl", sent.getValue().bucket());
        assertEquals("cluster-manager/etl/1.json", sent.getValue().key());
    }

    @Test
    void failed_upload_is_typed() {
        when(s3.putObject(any(PutObjectRequest.class), any(RequestBody.class))).thenThrow(status(500));

        assertThrows(UnableToUploadContentException.class,
                () -> new S3ContentStore(s3).upload("s3://b/k", new byte[0]));
    }

    @Test
    void exists_tells_missing_from_forbidden() throws Exception {
        S3ContentStore store = new S3ContentStore(s3);
        when(s3.headObject(any(HeadObjectRequest.class)))
                .thenReturn(HeadObjectResponse.builder().build())
                .thenThrow(status(404))
                .thenThrow(status(403));

        assertTrue(store.exists("s3://b/present"));
        assertFalse(store.exists("s3://b/missing"));
        assertThrows(CredentialsException.class, () -> store.exists("s3://b/locked"));
    }

    @Test
    void only_s3_uris_are_accepted() {
        assertThrows(IllegalArgumentException.class, () -> S3ContentStore.Location.parse("https://example.com/x"));
        assertEquals(new S3ContentStore.Location("my_bucket", "a/b"), S3ContentStore.Location.parse("s3://my_bucket/a/b"));
    }
}
