package net.clusterpool.core.spi;

import net.clusterpool.core.error.CredentialsException;
import net.clusterpool.core.error.UnableToUploadContentException;

import java.io.IOException;

/** Object storage for configuration templates and scripts, addressed by URI ({@code s3://bucket/key}). */
public interface ContentStore {
    void upload(String uri, byte[] content) throws UnableToUploadContentException;

    byte[] download(String uri) throws IOException;

    /** @throws CredentialsException when the store answers "forbidden" rather than "not found" */
    boolean exists(String uri) throws CredentialsException;
}
