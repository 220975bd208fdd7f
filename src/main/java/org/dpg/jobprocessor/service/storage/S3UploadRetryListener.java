package org.dpg.jobprocessor.service.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component("s3UploadRetryListener")
public class S3UploadRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("S3 upload failed on attempt {}. Retrying... Error: {}", context.getRetryCount(),
                 throwable.getMessage());
    }
}
