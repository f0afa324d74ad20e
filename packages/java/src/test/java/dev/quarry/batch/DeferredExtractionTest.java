package dev.quarry.batch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.quarry.QuarryException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class DeferredExtractionTest {
    private BatchOrchestrator orchestrator;
    private CountDownLatch release;

    @BeforeEach
    void setUp() {
        orchestrator = new BatchOrchestrator(2);
        release = new CountDownLatch(1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        orchestrator.close();
    }

    private Task<String> blocked(String value) {
        return () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new QuarryException("interrupted", e);
            }
            return value;
        };
    }

    @Test
    void shouldKeepResultAfterTimedOutWait() throws Exception {
        DeferredExtraction<String> handle = orchestrator.defer("slow", blocked("done"));

        assertThat(handle.await(Duration.ZERO)).isEmpty();
        assertThat(handle.await(Duration.ofMillis(20))).isEmpty();
        assertThat(handle.tryGetResult()).isEmpty();
        assertThat(handle.isReady()).isFalse();

        release.countDown();

        assertThat(handle.getResult()).isEqualTo("done");
        assertThat(handle.isReady()).isTrue();
        assertThat(handle.tryGetResult()).contains("done");
    }

    @Test
    void shouldSurfaceTypedFailure() {
        DeferredExtraction<String> handle = orchestrator.defer("bad", () -> {
            throw new QuarryException.Parsing("truncated stream");
        });

        assertThatThrownBy(handle::getResult)
            .isInstanceOf(QuarryException.Parsing.class)
            .hasMessage("truncated stream");
    }

    @Test
    void shouldReportCancellation() {
        DeferredExtraction<String> handle = orchestrator.defer("cancel", blocked("never"));

        assertThat(handle.cancel()).isTrue();

        assertThat(handle.isCancelled()).isTrue();
        assertThatThrownBy(handle::getResult)
            .isInstanceOf(QuarryException.class)
            .hasMessageContaining("cancelled");
    }

    @Test
    void shouldDetachFutureView() throws Exception {
        DeferredExtraction<String> handle = orchestrator.defer("view", blocked("value"));
        CompletableFuture<String> view = handle.toCompletableFuture();

        view.complete("hijacked");
        release.countDown();

        assertThat(handle.getResult()).isEqualTo("value");
    }

    @Test
    void shouldCompleteSubmittedFuture() throws Exception {
        CompletableFuture<Integer> future = orchestrator.submit("sum", () -> 1 + 2);

        assertThat(future.get(5, TimeUnit.SECONDS)).isEqualTo(3);
    }
}
