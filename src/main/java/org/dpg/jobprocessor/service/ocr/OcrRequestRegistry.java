package org.dpg.jobprocessor.service.ocr;

import lombok.extern.slf4j.Slf4j;
import org.dpg.jobprocessor.dto.ocr.OcrCallbackRequest;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pending OCR requests keyed by job ID. The job waiting for OCR registers a one-shot future before
 * submitting; the callback endpoint completes and removes it.
 */
@Slf4j
@Component
public class OcrRequestRegistry {

    private final Map<Long, CompletableFuture<OcrCallbackRequest>> pending = new ConcurrentHashMap<>();

    /**
     * Registers a job as waiting for an OCR callback. Registering a job twice replaces the first wait.
     */
    public CompletableFuture<OcrCallbackRequest> register(final long jobId) {
        final CompletableFuture<OcrCallbackRequest> future = new CompletableFuture<>();
        final CompletableFuture<OcrCallbackRequest> previous = pending.put(jobId, future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("Job ID {}: waiting for OCR callback", jobId);
        return future;
    }

    /**
     * Hands the callback to the waiting job and forgets it.
     *
     * @return false if no job was waiting, e.g. after a timeout or a restart.
     */
    public boolean complete(final long jobId, final OcrCallbackRequest result) {
        final CompletableFuture<OcrCallbackRequest> future = pending.remove(jobId);
        if (future == null) {
            log.error("Could not find pending OCR job {}", jobId);
            return false;
        }
        log.info("Remove pending OCR job {}", jobId);
        return future.complete(result);
    }

    /**
     * Forgets a wait without completing it. Used when the request could not be sent or timed out.
     */
    public void remove(final long jobId) {
        pending.remove(jobId);
    }

    public boolean isPending(final long jobId) {
        return pending.containsKey(jobId);
    }
}
