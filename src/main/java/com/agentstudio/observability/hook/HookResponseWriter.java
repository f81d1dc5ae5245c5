package com.agentstudio.observability.hook;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Writes the hook response exactly once, whichever of the normal path, the error path or the
 * deadline watchdog gets there first.
 *
 * @author Agent Studio 2025-2026
 */
public class HookResponseWriter {

    private final PrintStream out;
    private final HookResponse defaultResponse;
    private final AtomicBoolean emitted = new AtomicBoolean(false);

    public HookResponseWriter(PrintStream out, HookResponse defaultResponse) {
        this.out = out;
        this.defaultResponse = defaultResponse;
    }

    /**
     * Emits {@code response} unless a response was already written.
     *
     * @return true when this call wrote the response
     */
    public boolean emit(HookResponse response) {
        if (!emitted.compareAndSet(false, true)) {
            return false;
        }
        out.println(response.json());
        out.flush();
        return true;
    }

    public boolean emitDefault() {
        return emit(defaultResponse);
    }

    public boolean isEmitted() {
        return emitted.get();
    }

    public HookResponse defaultResponse() {
        return defaultResponse;
    }
}
