package io.github.drompincen.turnstile.runtime.tools;

import io.github.drompincen.turnstile.runtime.cancel.CancellationSignal;

import java.nio.file.Path;
import java.util.Map;

public record ToolContext(
        String threadId,
        Path workingDirectory,
        Map<String, String> environment,
        CancellationSignal cancellation
) {
    public ToolContext {
        environment = environment == null ? Map.of() : Map.copyOf(environment);
        if (cancellation == null) {
            cancellation = CancellationSignal.none();
        }
    }

    /** Resolves a tool path argument against the working directory. */
    public Path resolve(String path) {
        Path candidate = Path.of(path);
        if (candidate.isAbsolute() || workingDirectory == null) {
            return candidate.normalize();
        }
        return workingDirectory.resolve(candidate).normalize();
    }
}
