package com.phillippitts.interviewcopilot.service.context;

import com.phillippitts.interviewcopilot.domain.ContextPayload;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-session holder of the candidate context.
 *
 * <p>Each {@link #replace(ContextPayload)} installs a new immutable baseline with a higher
 * version. Generations capture a {@link Baseline} when they start, so a later update never
 * changes the context an in-flight or past answer was built from.
 */
public final class ContextStore {

    /** Context payload tagged with the version it was installed under. */
    public record Baseline(long version, ContextPayload payload) {}

    private final AtomicReference<Baseline> current = new AtomicReference<>(new Baseline(0, ContextPayload.EMPTY));

    public Baseline replace(ContextPayload payload) {
        Objects.requireNonNull(payload, "payload");
        return current.updateAndGet(prev -> new Baseline(prev.version() + 1, payload));
    }

    public Baseline snapshot() {
        return current.get();
    }

    /** Drops the context reference; the next baseline starts from the empty payload. */
    public Baseline clear() {
        return current.updateAndGet(prev -> new Baseline(prev.version() + 1, ContextPayload.EMPTY));
    }
}
