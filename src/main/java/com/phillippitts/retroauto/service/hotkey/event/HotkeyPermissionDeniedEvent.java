package com.phillippitts.retroauto.service.hotkey.event;

import java.time.Instant;

/** Published when the OS refuses the global keyboard hook (e.g., missing accessibility permission). */
public record HotkeyPermissionDeniedEvent(Instant at) {}
