package com.phillippitts.retroauto.service.hotkey;

import com.phillippitts.retroauto.config.properties.HotkeyProperties;
import com.phillippitts.retroauto.service.hotkey.event.HotkeyPermissionDeniedEvent;
import com.phillippitts.retroauto.service.hotkey.event.HotkeyPressedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Registers the global key hook and publishes a {@link HotkeyPressedEvent} when a press matches
 * the start, stop or pause binding. Bindings come from {@code hotkey.*}; a script's
 * {@code @hotkeys} block replaces them for its session via {@link #rebind(Map)}.
 *
 * Tests inject a fake GlobalKeyHook and push NormalizedKeyEvent instances directly to
 * the registered listener.
 */
@Service
@ConditionalOnProperty(prefix = "hotkey", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScriptHotkeyManager implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(ScriptHotkeyManager.class);

    private final GlobalKeyHook hook;
    private final ApplicationEventPublisher publisher;
    private final HotkeyProperties props;
    private final Map<HotkeyAction, KeyBinding> defaults;

    private volatile Map<HotkeyAction, KeyBinding> bindings;
    private volatile boolean running;

    public ScriptHotkeyManager(GlobalKeyHook hook,
                               HotkeyProperties props,
                               ApplicationEventPublisher publisher) {
        this.hook = hook;
        this.props = props;
        this.publisher = publisher;
        Map<HotkeyAction, KeyBinding> map = new EnumMap<>(HotkeyAction.class);
        map.put(HotkeyAction.START, KeyBinding.parse(props.getStart()));
        map.put(HotkeyAction.STOP, KeyBinding.parse(props.getStop()));
        map.put(HotkeyAction.PAUSE, KeyBinding.parse(props.getPause()));
        this.defaults = Collections.unmodifiableMap(map);
        this.bindings = defaults;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        try {
            hook.addListener(dispatcher());
            hook.register();
            running = true;
            LOG.info("Hotkeys active: {}", bindings);
            detectReservedConflicts(bindings);
        } catch (SecurityException se) {
            LOG.warn("Global key hook permission denied: {}", se.toString());
            publisher.publishEvent(new HotkeyPermissionDeniedEvent(Instant.now()));
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        hook.unregister();
        running = false;
        LOG.info("Hotkeys released");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Overrides bindings with a script's {@code @hotkeys} entries; actions it does not name keep
     * the configured key.
     *
     * @throws IllegalArgumentException for an unknown action or key name
     */
    public void rebind(Map<String, String> scriptHotkeys) {
        Map<HotkeyAction, KeyBinding> map = new EnumMap<>(defaults);
        scriptHotkeys.forEach((name, spec) -> {
            HotkeyAction action = HotkeyAction.fromKey(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown hotkey action: " + name));
            map.put(action, KeyBinding.parse(spec));
        });
        detectReservedConflicts(map);
        bindings = Collections.unmodifiableMap(map);
        if (!scriptHotkeys.isEmpty()) {
            LOG.info("Hotkeys rebound by script: {}", bindings);
        }
    }

    /** Restores the configured bindings. */
    public void resetBindings() {
        bindings = defaults;
    }

    public Map<HotkeyAction, KeyBinding> bindings() {
        return bindings;
    }

    Consumer<NormalizedKeyEvent> dispatcher() {
        return e -> {
            if (e.type() != NormalizedKeyEvent.Type.PRESSED) {
                return;
            }
            for (Map.Entry<HotkeyAction, KeyBinding> entry : bindings.entrySet()) {
                if (entry.getValue().matches(e)) {
                    LOG.debug("Hotkey {} -> {}", entry.getValue(), entry.getKey());
                    publisher.publishEvent(new HotkeyPressedEvent(entry.getKey(), Instant.now()));
                    return;
                }
            }
        };
    }

    private void detectReservedConflicts(Map<HotkeyAction, KeyBinding> map) {
        map.forEach((action, binding) -> {
            for (String spec : props.getReserved()) {
                if (binding.conflictsWith(spec)) {
                    LOG.warn("Hotkey {} for {} conflicts with reserved '{}'", binding, action.key(), spec);
                }
            }
        });
    }
}
