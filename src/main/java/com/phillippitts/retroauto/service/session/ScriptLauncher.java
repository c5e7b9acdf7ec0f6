package com.phillippitts.retroauto.service.session;

import com.phillippitts.retroauto.config.properties.EngineProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts {@code engine.script-path} once the application is ready. With no path configured
 * the engine waits for the start hotkey or {@code POST /api/engine/start}.
 */
@Component
class ScriptLauncher {

    private static final Logger LOG = LogManager.getLogger(ScriptLauncher.class);

    private final ScriptSessionService sessions;
    private final EngineProperties props;

    ScriptLauncher(ScriptSessionService sessions, EngineProperties props) {
        this.sessions = sessions;
        this.props = props;
    }

    @EventListener(ApplicationReadyEvent.class)
    void launch() {
        if (props.getScriptPath().isBlank()) {
            LOG.info("No startup script; waiting for start hotkey or REST call");
            return;
        }
        sessions.startConfiguredScript()
                .ifPresent(id -> LOG.info("Startup script {} running as session {}", props.getScriptPath(), id));
    }
}
