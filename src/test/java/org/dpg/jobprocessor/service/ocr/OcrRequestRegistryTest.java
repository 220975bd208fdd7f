package org.dpg.jobprocessor.service.ocr;

import org.dpg.jobprocessor.dto.ocr.OcrCallbackRequest;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class OcrRequestRegistryTest {

    private final OcrRequestRegistry registry = new OcrRequestRegistry();

    @Test
    void callbackCompletesWaitingJob() throws Exception {
        // given
        final CompletableFuture<OcrCallbackRequest> wait = registry.register(12L);
        final OcrCallbackRequest callback = new OcrCallbackRequest("success", null);

        // when
        final boolean delivered = registry.complete(12L, callback);

        // then
        assertThat(delivered).isTrue();
        assertThat(wait.get()).isSameAs(callback);
        assertThat(registry.isPending(12L)).isFalse();
    }

    @Test
    void callbackWithoutWaitingJobIsDropped() {
        assertThat(registry.complete(99L, new OcrCallbackRequest("failure", "no pages"))).isFalse();
    }

    @Test
    void secondRegistrationCancelsFirst() {
        // given
        final CompletableFuture<OcrCallbackRequest> first = registry.register(12L);

        // when
        final CompletableFuture<OcrCallbackRequest> second = registry.register(12L);

        // then
        assertThat(first).isCancelled();
        assertThat(second).isNotDone();
        assertThat(registry.isPending(12L)).isTrue();
    }

    @Test
    void removedWaitIsNotCompleted() {
        // given
        final CompletableFuture<OcrCallbackRequest> wait = registry.register(12L);

        // when
        registry.remove(12L);

        // then
        assertThat(registry.complete(12L, new OcrCallbackRequest("success", null))).isFalse();
        assertThat(wait).isNotDone();
    }

    @Test
    void onlySuccessStatusIsSuccess() {
        assertThat(new OcrCallbackRequest("SUCCESS", null).isSuccess()).isTrue();
        assertThat(new OcrCallbackRequest("failure", "timeout").isSuccess()).isFalse();
    }
}
