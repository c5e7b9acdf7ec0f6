package com.phillippitts.retroauto.service.hotkey;

import java.util.function.Consumer;

/**
 * Abstraction over a global keyboard hook (JNativeHook in production).
 *
 * Test seam: unit tests inject a fake and push {@link NormalizedKeyEvent}s directly,
 * so no OS-level hook is needed in CI.
 */
public interface GlobalKeyHook {

    /** Register the global hook. Idempotent. */
    void register();

    /** Unregister the global hook. Idempotent. */
    void unregister();

    /** Subscribe to normalized key events. A later call replaces the listener. */
    void addListener(Consumer<NormalizedKeyEvent> listener);
}
