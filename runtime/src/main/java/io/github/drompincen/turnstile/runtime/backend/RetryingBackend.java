package io.github.drompincen.turnstile.runtime.backend;

import io.github.drompincen.turnstile.protocol.api.ToolDescriptor;
import io.github.drompincen.turnstile.runtime.cancel.CancellationSignal;
import io.github.drompincen.turnstile.runtime.cancel.TurnCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Retries retryable backend failures with exponential backoff. Non-retryable failures and
 * cancellation end the call immediately.
 */
public class RetryingBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(RetryingBackend.class);
    private static final double BACKOFF_MULTIPLIER = 2.0;

    private final Backend delegate;
    private final int maxAttempts;
    private final Duration initialDelay;
    private final RetryListener listener;

    public RetryingBackend(Backend delegate, int maxAttempts, Duration initialDelay, RetryListener listener) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.listener = listener == null ? RetryListener.NONE : listener;
    }

    @Override
    public BackendResponse createResponse(List<BackendMessage> messages, List<ToolDescriptor> tools,
                                          CancellationSignal signal) {
        long backoffMs = initialDelay.toMillis();
        for (int attempt = 1; ; attempt++) {
            signal.throwIfCancelled();
            try {
                return delegate.createResponse(messages, tools, signal);
            } catch (BackendException e) {
                if (!e.isRetryable() || signal.isCancelled()) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.warn("[{}] Giving up after {} attempts: {}", delegate.providerName(), attempt, e.getMessage());
                    listener.onRetryExhausted(attempt, e);
                    throw e;
                }
                Duration delay = Duration.ofMillis(backoffMs);
                log.warn("[{}] Attempt {}/{} failed, retrying in {}ms: {}",
                        delegate.providerName(), attempt, maxAttempts, backoffMs, e.getMessage());
                listener.onRetryAttempt(attempt, maxAttempts, delay, e);
                sleep(backoffMs);
                backoffMs = (long) (backoffMs * BACKOFF_MULTIPLIER);
            }
        }
    }

    /** Same policy for streams; deltas of a failed attempt have already reached {@code onToken}. */
    @Override
    public Mono<BackendResponse> streamResponse(List<BackendMessage> messages, List<ToolDescriptor> tools,
                                                CancellationSignal signal, Consumer<String> onToken) {
        Mono<BackendResponse> call = Mono.defer(() -> delegate.streamResponse(messages, tools, signal, onToken));
        if (maxAttempts == 1) {
            return call;
        }
        return call.retryWhen(Retry.backoff(maxAttempts - 1, initialDelay)
                .jitter(0)
                .filter(e -> e instanceof BackendException b && b.isRetryable() && !signal.isCancelled())
                .doBeforeRetry(retry -> {
                    int attempt = (int) retry.totalRetries() + 1;
                    Duration delay = initialDelay.multipliedBy(1L << retry.totalRetries());
                    log.warn("[{}] Stream attempt {}/{} failed, retrying in {}ms: {}",
                            delegate.providerName(), attempt, maxAttempts, delay.toMillis(), retry.failure().getMessage());
                    listener.onRetryAttempt(attempt, maxAttempts, delay, (BackendException) retry.failure());
                })
                .onRetryExhaustedThrow((spec, retry) -> {
                    log.warn("[{}] Giving up after {} attempts: {}",
                            delegate.providerName(), maxAttempts, retry.failure().getMessage());
                    listener.onRetryExhausted(maxAttempts, (BackendException) retry.failure());
                    return retry.failure();
                }));
    }

    @Override
    public boolean supportsStreaming() {
        return delegate.supportsStreaming();
    }

    @Override
    public String providerName() {
        return delegate.providerName();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnCancelledException("Interrupted during retry backoff", e);
        }
    }
}
