package org.dpg.jobprocessor.common.apiclient;

import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.stereotype.Component;

/**
 * Logs each failed attempt of a retried call to an external service.
 */
@Slf4j
@Component("externalCallRetryListener")
public class ExternalCallRetryListener implements RetryListener {

    @Override
    public <T, E extends Throwable> void onError(RetryContext context, RetryCallback<T, E> callback,
                                                 Throwable throwable) {
        log.warn("External call '{}' failed on attempt {}. Retrying... Error: {}",
                 context.getAttribute(RetryContext.NAME), context.getRetryCount(), throwable.getMessage());
    }
}
