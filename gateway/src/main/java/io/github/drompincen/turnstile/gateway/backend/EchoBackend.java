package io.github.drompincen.turnstile.gateway.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.turnstile.protocol.api.ToolDescriptor;
import io.github.drompincen.turnstile.protocol.event.TokenUsage;
import io.github.drompincen.turnstile.protocol.event.ToolResultData;
import io.github.drompincen.turnstile.runtime.backend.Backend;
import io.github.drompincen.turnstile.runtime.backend.BackendException;
import io.github.drompincen.turnstile.runtime.backend.BackendMessage;
import io.github.drompincen.turnstile.runtime.backend.BackendResponse;
import io.github.drompincen.turnstile.runtime.backend.BackendToolCall;
import io.github.drompincen.turnstile.runtime.cancel.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Provider that needs no API key. Echoes the last user message; a message of the form
 * {@code /tool <name> <json-args>} produces a tool call so approvals can be exercised by hand.
 *
 * <p>Activate with {@code turnstile.backend.provider=echo} (the default).
 */
@Component
@ConditionalOnProperty(name = "turnstile.backend.provider", havingValue = "echo", matchIfMissing = true)
public class EchoBackend implements Backend {

    private static final Logger log = LoggerFactory.getLogger(EchoBackend.class);
    static final String TOOL_PREFIX = "/tool ";

    private final ObjectMapper objectMapper;

    public EchoBackend(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public BackendResponse createResponse(List<BackendMessage> messages, List<ToolDescriptor> tools,
                                          CancellationSignal signal) {
        signal.throwIfCancelled();
        if (messages.isEmpty()) {
            throw new BackendException("No messages to respond to", false);
        }
        BackendMessage last = messages.get(messages.size() - 1);
        long promptTokens = estimateTokens(messages);

        if (!last.toolResults().isEmpty()) {
            String summary = last.toolResults().stream()
                    .map(r -> r.callId() + ": " + r.status().name().toLowerCase() + " " + r.text())
                    .collect(Collectors.joining("\n"));
            return reply("Tool results:\n" + summary, promptTokens);
        }

        String content = last.content() == null ? "" : last.content();
        if (content.startsWith(TOOL_PREFIX)) {
            BackendToolCall call = parseToolCall(content.substring(TOOL_PREFIX.length()).trim());
            log.debug("[ECHO] tool call {} for {}", call.name(), call.id());
            return new BackendResponse("Calling " + call.name(), List.of(call),
                    TokenUsage.of(promptTokens, 5), "tool_use");
        }
        return reply("Echo: " + content, promptTokens);
    }

    @Override
    public Mono<BackendResponse> streamResponse(List<BackendMessage> messages, List<ToolDescriptor> tools,
                                                CancellationSignal signal, Consumer<String> onToken) {
        return Mono.fromCallable(() -> createResponse(messages, tools, signal))
                .flatMap(response -> {
                    String text = response.content() == null ? "" : response.content();
                    return Flux.fromArray(text.split("(?<=\\s)"))
                            .filter(word -> !word.isEmpty())
                            .doOnNext(onToken)
                            .then(Mono.just(response));
                });
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public String providerName() {
        return "echo";
    }

    private BackendToolCall parseToolCall(String command) {
        int space = command.indexOf(' ');
        String name = space < 0 ? command : command.substring(0, space);
        String rawArgs = space < 0 ? "{}" : command.substring(space + 1).trim();
        if (name.isEmpty()) {
            throw new BackendException("Tool name missing after /tool", false);
        }
        try {
            JsonNode args = objectMapper.readTree(rawArgs);
            return new BackendToolCall("call_" + UUID.randomUUID(), name, args);
        } catch (JsonProcessingException e) {
            throw new BackendException("Tool arguments are not valid JSON: " + rawArgs, false, e);
        }
    }

    private static BackendResponse reply(String text, long promptTokens) {
        return BackendResponse.text(text, TokenUsage.of(promptTokens, Math.max(1, text.length() / 4)));
    }

    private static long estimateTokens(List<BackendMessage> messages) {
        long chars = 0;
        for (BackendMessage message : messages) {
            chars += message.content() == null ? 0 : message.content().length();
            for (ToolResultData result : message.toolResults()) {
                chars += result.text().length();
            }
        }
        return Math.max(1, chars / 4);
    }
}
