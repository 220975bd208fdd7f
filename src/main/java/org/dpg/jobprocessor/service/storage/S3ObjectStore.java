package org.dpg.jobprocessor.service.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.file.Path;

/**
 * Thin wrapper over the shared {@link S3Client} for the two buckets this service writes to: the
 * IIIF image bucket and the preservation registry's receiving bucket.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class S3ObjectStore {

    private final S3Client s3Client;

    /**
     * True if at least one object exists under the prefix.
     */
    public boolean existsUnderPrefix(final String bucket, final String prefix) {
        final ListObjectsV2Request request = ListObjectsV2Request.builder().bucket(bucket).prefix(prefix).maxKeys(1)
                                                                 .build();
        return !s3Client.listObjectsV2(request).contents().isEmpty();
    }

    @Retryable(retryFor = {SdkException.class},
            maxAttemptsExpression = "#{${app.processing.retry.attempts} + 1}",
            backoff = @Backoff(delayExpression = "#{${app.processing.retry.delay-ms}}"),
            listeners = {"s3UploadRetryListener"})
    public void upload(final String bucket, final String key, final Path source) {
        log.debug("Uploading {} to s3://{}/{}", source, bucket, key);
        s3Client.putObject(PutObjectRequest.builder().bucket(bucket).key(key).build(), RequestBody.fromFile(source));
        log.info("Uploaded {} to s3://{}/{}", source.getFileName(), bucket, key);
    }

    public void delete(final String bucket, final String key) {
        s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key).build());
        log.info("Deleted s3://{}/{}", bucket, key);
    }
}
