package io.github.drompincen.turnstile.runtime.backend;

import io.github.drompincen.turnstile.protocol.api.ToolDescriptor;
import io.github.drompincen.turnstile.runtime.cancel.CancellationSignal;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Consumer;

/**
 * A language-model provider. Implementations translate the neutral message list into their own
 * wire format; nothing provider-specific leaks past this interface.
 */
public interface Backend {

    /**
     * Runs one model call. Throws {@link BackendException} when the provider rejects the request
     * and {@link io.github.drompincen.turnstile.runtime.cancel.TurnCancelledException} when the
     * signal fires before a response is available.
     */
    BackendResponse createResponse(List<BackendMessage> messages, List<ToolDescriptor> tools,
                                   CancellationSignal signal);

    /**
     * Streaming variant. Text deltas go to {@code onToken}; the returned response has the same
     * shape as {@link #createResponse}. The default emits the whole text as one delta.
     */
    default Mono<BackendResponse> streamResponse(List<BackendMessage> messages, List<ToolDescriptor> tools,
                                                 CancellationSignal signal, Consumer<String> onToken) {
        return Mono.fromCallable(() -> createResponse(messages, tools, signal))
                .doOnNext(response -> {
                    if (response.content() != null && !response.content().isEmpty()) {
                        onToken.accept(response.content());
                    }
                });
    }

    default boolean supportsStreaming() {
        return false;
    }

    String providerName();
}
